/*
 * DKIMVerifier.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of bluezoo-dkim, a DKIM library for Java.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * bluezoo-dkim is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * bluezoo-dkim is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with bluezoo-dkim.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.dkim;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.text.MessageFormat;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dkim.dns.DKIMKeyResolver;
import org.bluezoo.dkim.dns.KeyCallback;
import org.bluezoo.dkim.dns.TXTResolver;
import org.bluezoo.dkim.message.Message;
import org.bluezoo.dkim.message.RawHeader;

/**
 * DKIM signature verifier (RFC 6376 section 6).
 *
 * <p>Every DKIM-Signature header of a message is verified independently
 * and concurrently. For each one the verifier:
 * <ol>
 * <li>parses and validates the header</li>
 * <li>checks the expiration time against its clock</li>
 * <li>computes the body hash and compares it with {@code bh=}</li>
 * <li>retrieves the public key from DNS and checks it may be used</li>
 * <li>computes the header hash and verifies {@code b=}</li>
 * </ol>
 * A signature that fails a step is not taken further, so body hash
 * mismatches cost no DNS traffic.
 *
 * <p>Usage:
 * <pre><code>
 * DKIMVerifier verifier = new DKIMVerifier(new DnsJavaTXTResolver());
 * verifier.verify(message, new DKIMCallback() {
 *     public void dkimResults(List&lt;DKIMVerification&gt; results) {
 *         if (DKIMVerification.anyPass(results)) {
 *             // at least one valid signature
 *         }
 *     }
 * });
 * </code></pre>
 *
 * <p>A verifier holds no per-message state and may be shared between
 * threads once configured.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DKIMSigner
 */
public class DKIMVerifier {

    private static final Logger LOGGER = Logger.getLogger(DKIMVerifier.class.getName());
    private static final ResourceBundle L10N = TagList.L10N;

    /** Minimum RSA key size, from RFC 8301. */
    public static final int DEFAULT_MINIMUM_KEY_BITS = 1024;

    private final DKIMKeyResolver keyResolver;
    private Clock clock = Clock.systemUTC();
    private int minimumKeyBits = DEFAULT_MINIMUM_KEY_BITS;

    /**
     * Creates a verifier that retrieves keys through a DNS capability with
     * the default key resolver settings.
     *
     * @param resolver the TXT resolver
     */
    public DKIMVerifier(TXTResolver resolver) {
        this(new DKIMKeyResolver(resolver));
    }

    /**
     * Creates a verifier with a configured key resolver.
     *
     * @param keyResolver the key resolver
     */
    public DKIMVerifier(DKIMKeyResolver keyResolver) {
        this.keyResolver = keyResolver;
    }

    public DKIMKeyResolver getKeyResolver() {
        return keyResolver;
    }

    /**
     * Sets the clock used to check signature expiration.
     *
     * @param clock the clock
     */
    public void setClock(Clock clock) {
        this.clock = clock;
    }

    /**
     * Sets the smallest RSA key accepted. Shorter keys are inapplicable.
     *
     * @param bits the minimum modulus length
     */
    public void setMinimumKeyBits(int bits) {
        this.minimumKeyBits = bits;
    }

    public int getMinimumKeyBits() {
        return minimumKeyBits;
    }

    /**
     * Verifies all DKIM signatures of a message.
     *
     * @param message the message
     * @param callback receives the results once, in header order
     */
    public void verify(Message message, DKIMCallback callback) {
        List<RawHeader> headers = message.getHeaders(DKIMSignature.HEADER_NAME);
        if (headers.isEmpty()) {
            callback.dkimResults(Collections.<DKIMVerification>emptyList());
            return;
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.verify_start"),
                    Integer.valueOf(headers.size())));
        }
        ResultCollector collector = new ResultCollector(headers.size(), callback);
        for (int i = 0; i < headers.size(); i++) {
            verifySignature(message, headers.get(i), i, collector);
        }
    }

    private void verifySignature(Message message, RawHeader header, final int index,
                                 final ResultCollector collector) {
        final DKIMSignature signature;
        try {
            signature = DKIMSignature.parse(header.getValue());
        } catch (DKIMSignatureException e) {
            String detail = MessageFormat.format(L10N.getString("err.verify_parse"), e.getMessage());
            collector.complete(index, DKIMVerification.fail(DKIMFailure.PARSE_ERROR, detail, null, null));
            return;
        }

        long expiration = signature.getExpiration();
        if (expiration >= 0 && clock.millis() / 1000L > expiration) {
            String detail = MessageFormat.format(L10N.getString("err.verify_expired"),
                    Instant.ofEpochSecond(expiration));
            collector.complete(index, DKIMVerification.fail(DKIMFailure.EXPIRED, detail, signature, null));
            return;
        }

        HashAlgorithm hashAlgorithm = signature.getAlgorithm().getHashAlgorithm();
        byte[] bodyHash = DKIMHash.bodyHash(message.getBody(), signature.getBodyCanonicalization(),
                hashAlgorithm, signature.getBodyLength());
        if (!MessageDigest.isEqual(bodyHash, signature.getBodyHashBytes())) {
            String detail = L10N.getString("err.verify_body_hash");
            collector.complete(index,
                    DKIMVerification.fail(DKIMFailure.BODY_HASH_MISMATCH, detail, signature, null));
            return;
        }

        // The message is immutable, so the header hash can be computed now
        RawHeader emptied = RawHeader.of(header.getNamePart() + signature.getValueWithoutSignature());
        final byte[] headerHash = DKIMHash.headerHash(message, signature.getSignedHeaders(), emptied,
                signature.getHeaderCanonicalization(), hashAlgorithm);

        keyResolver.resolve(signature.getSelector(), signature.getDomain(), new KeyCallback() {

            @Override
            public void keyResolved(DKIMPublicKey key) {
                collector.complete(index, checkSignature(signature, key, headerHash));
            }

            @Override
            public void keyFailed(DKIMKeyException error) {
                collector.complete(index,
                        DKIMVerification.fail(error.getFailure(), error.getMessage(), signature, null));
            }

        });
    }

    /**
     * Checks that a key may verify a signature, then verifies it.
     */
    DKIMVerification checkSignature(DKIMSignature signature, DKIMPublicKey key, byte[] headerHash) {
        SignatureAlgorithm algorithm = signature.getAlgorithm();
        if (key.getKeyType() != algorithm.getKeyType()) {
            String detail = MessageFormat.format(L10N.getString("err.verify_key_type"),
                    key.getKeyTypeName(), algorithm.getValue());
            return DKIMVerification.fail(DKIMFailure.KEY_ALGORITHM_MISMATCH, detail, signature, key);
        }
        if (!key.allowsHashAlgorithm(algorithm.getHashAlgorithm())) {
            String detail = MessageFormat.format(L10N.getString("err.verify_key_hash"),
                    algorithm.getHashAlgorithm().getValue());
            return DKIMVerification.fail(DKIMFailure.KEY_ALGORITHM_MISMATCH, detail, signature, key);
        }
        if (!key.allowsService(DKIMPublicKey.SERVICE_EMAIL)) {
            String detail = L10N.getString("err.verify_service");
            return DKIMVerification.fail(DKIMFailure.KEY_INAPPLICABLE, detail, signature, key);
        }
        if (key.isStrict() && !signature.getIdentityDomain().equalsIgnoreCase(signature.getDomain())) {
            String detail = MessageFormat.format(L10N.getString("err.verify_strict"),
                    signature.getIdentityDomain(), signature.getDomain());
            return DKIMVerification.fail(DKIMFailure.KEY_INAPPLICABLE, detail, signature, key);
        }

        PublicKey publicKey;
        try {
            publicKey = key.toPublicKey();
        } catch (DKIMKeyException e) {
            return DKIMVerification.fail(e.getFailure(), e.getMessage(), signature, key);
        }
        if (publicKey instanceof RSAPublicKey) {
            int bits = ((RSAPublicKey) publicKey).getModulus().bitLength();
            if (bits < minimumKeyBits) {
                String detail = MessageFormat.format(L10N.getString("err.verify_key_size"),
                        Integer.valueOf(bits), Integer.valueOf(minimumKeyBits));
                return DKIMVerification.fail(DKIMFailure.KEY_INAPPLICABLE, detail, signature, key);
            }
        }

        DKIMVerification result;
        try {
            if (algorithm.verify(publicKey, headerHash, signature.getSignatureBytes())) {
                result = DKIMVerification.pass(signature, key, publicKey);
            } else {
                String detail = L10N.getString("err.verify_signature");
                result = DKIMVerification.fail(DKIMFailure.SIGNATURE_INVALID, detail, signature, key);
            }
        } catch (InvalidKeyException e) {
            String detail = MessageFormat.format(L10N.getString("err.verify_crypto"), e.getMessage());
            result = DKIMVerification.fail(DKIMFailure.KEY_MALFORMED, detail, signature, key);
        } catch (GeneralSecurityException e) {
            LOGGER.log(Level.FINE, e.getMessage(), e);
            String detail = MessageFormat.format(L10N.getString("err.verify_crypto"), e.getMessage());
            result = DKIMVerification.fail(DKIMFailure.SIGNATURE_INVALID, detail, signature, key);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.verify_result"),
                    signature.getDomain(), signature.getSelector(), result.getResult()));
        }
        return result;
    }

    /**
     * Joins the per-signature results and delivers them once all are in.
     */
    private static class ResultCollector {

        private final AtomicReferenceArray<DKIMVerification> results;
        private final AtomicInteger pending;
        private final DKIMCallback callback;

        ResultCollector(int count, DKIMCallback callback) {
            this.results = new AtomicReferenceArray<DKIMVerification>(count);
            this.pending = new AtomicInteger(count);
            this.callback = callback;
        }

        void complete(int index, DKIMVerification result) {
            if (!results.compareAndSet(index, null, result)) {
                return;
            }
            if (pending.decrementAndGet() == 0) {
                List<DKIMVerification> list = new ArrayList<DKIMVerification>(results.length());
                for (int i = 0; i < results.length(); i++) {
                    list.add(results.get(i));
                }
                callback.dkimResults(Collections.unmodifiableList(list));
            }
        }

    }

}
