/*
 * DKIMSigner.java
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

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.text.MessageFormat;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dkim.canon.Canonicalization;
import org.bluezoo.dkim.message.Message;
import org.bluezoo.dkim.message.RawHeader;

/**
 * Creates DKIM signatures (RFC 6376 section 5).
 *
 * <p>A signer is configured once through its {@link Builder} and may then
 * sign any number of messages, from any thread:
 * <pre><code>
 * DKIMSigner signer = new DKIMSigner.Builder()
 *         .selector("mail")
 *         .domain("example.com")
 *         .privateKey(key)
 *         .signedHeaders("From", "To", "Subject", "Date")
 *         .canonicalization(Canonicalization.RELAXED, Canonicalization.SIMPLE)
 *         .build();
 * String header = signer.sign(message);
 * </code></pre>
 *
 * <p>The signature algorithm follows from the key: RSA keys sign with
 * rsa-sha256, Ed25519 keys with ed25519-sha256. SHA-1 is refused
 * (RFC 8301).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DKIMVerifier
 */
public class DKIMSigner {

    private static final Logger LOGGER = Logger.getLogger(DKIMSigner.class.getName());
    private static final ResourceBundle L10N = TagList.L10N;

    private final String selector;
    private final String domain;
    private final PrivateKey privateKey;
    private final SignatureAlgorithm algorithm;
    private final Canonicalization headerCanonicalization;
    private final Canonicalization bodyCanonicalization;
    private final List<String> signedHeaders;
    private final String identity;
    private final long bodyLength;
    private final Instant time;
    private final Duration expiry;
    private final Clock clock;
    private final boolean copyHeaders;

    private DKIMSigner(Builder builder, SignatureAlgorithm algorithm) {
        this.selector = builder.selector;
        this.domain = builder.domain;
        this.privateKey = builder.privateKey;
        this.algorithm = algorithm;
        this.headerCanonicalization = builder.headerCanonicalization;
        this.bodyCanonicalization = builder.bodyCanonicalization;
        this.signedHeaders = Collections.unmodifiableList(new ArrayList<String>(builder.signedHeaders));
        this.identity = builder.identity;
        this.bodyLength = builder.bodyLength;
        this.time = builder.time;
        this.expiry = builder.expiry;
        this.clock = builder.clock;
        this.copyHeaders = builder.copyHeaders;
    }

    public SignatureAlgorithm getAlgorithm() {
        return algorithm;
    }

    public String getDomain() {
        return domain;
    }

    public String getSelector() {
        return selector;
    }

    public List<String> getSignedHeaders() {
        return signedHeaders;
    }

    /**
     * Signs a message.
     *
     * @param message the message to sign
     * @return the complete DKIM-Signature header field, without a
     *         terminating CRLF, to be placed above the other headers
     * @throws DKIMSigningException if the settings do not form a valid
     *         signature or the key is rejected
     */
    public String sign(Message message) throws DKIMSigningException {
        HashAlgorithm hashAlgorithm = algorithm.getHashAlgorithm();
        long timestamp = ((time != null) ? time : clock.instant()).getEpochSecond();

        DKIMSignature.Builder template = new DKIMSignature.Builder(algorithm, domain, selector);
        template.canonicalization(headerCanonicalization, bodyCanonicalization);
        template.signedHeaders(signedHeaders);
        template.bodyHash(DKIMHash.bodyHash(message.getBody(), bodyCanonicalization,
                hashAlgorithm, bodyLength));
        template.timestamp(timestamp);
        if (expiry != null) {
            template.expiration(timestamp + expiry.getSeconds());
        }
        if (identity != null) {
            template.identity(identity);
        }
        if (bodyLength >= 0) {
            template.bodyLength(bodyLength);
        }
        if (copyHeaders) {
            template.copiedHeaders(copiedHeaders(message));
        }

        DKIMSignature unsigned;
        try {
            unsigned = template.build();
        } catch (DKIMSignatureException e) {
            throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                    MessageFormat.format(L10N.getString("err.sign_template"), e.getMessage()), e);
        }

        String field = DKIMSignature.HEADER_NAME + ": " + unsigned.getRawValue();
        byte[] headerHash = DKIMHash.headerHash(message, signedHeaders, RawHeader.of(field),
                headerCanonicalization, hashAlgorithm);
        byte[] signature;
        try {
            signature = algorithm.sign(privateKey, headerHash);
        } catch (GeneralSecurityException e) {
            throw new DKIMSigningException(DKIMSigningException.Reason.KEY_ERROR,
                    MessageFormat.format(L10N.getString("err.sign_key"), e.getMessage()), e);
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.signed"), domain, selector, algorithm));
        }
        return field + Base64.getEncoder().encodeToString(signature);
    }

    /**
     * Signs a message and returns it with the signature header added on
     * top.
     *
     * @param message the message to sign
     * @return the signed message
     * @throws DKIMSigningException if signing fails
     */
    public Message signMessage(Message message) throws DKIMSigningException {
        return message.prepend(sign(message));
    }

    /**
     * The signed header fields as they will be hashed, for {@code z=}.
     */
    private List<String> copiedHeaders(Message message) {
        List<RawHeader> selected = DKIMHash.selectHeaders(message, signedHeaders);
        List<String> fields = new ArrayList<String>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            String s = new String(selected.get(i).getBytesUnfolded(), StandardCharsets.ISO_8859_1);
            if (s.endsWith("\r\n")) {
                s = s.substring(0, s.length() - 2);
            }
            int colonPos = s.indexOf(':');
            fields.add(s.substring(0, colonPos).trim() + ":" + s.substring(colonPos + 1));
        }
        return fields;
    }

    /**
     * Configures a {@link DKIMSigner}. Selector, domain, private key and
     * signed headers are required.
     */
    public static class Builder {

        private String selector;
        private String domain;
        private PrivateKey privateKey;
        private HashAlgorithm hashAlgorithm = HashAlgorithm.SHA256;
        private Canonicalization headerCanonicalization = Canonicalization.SIMPLE;
        private Canonicalization bodyCanonicalization = Canonicalization.SIMPLE;
        private List<String> signedHeaders;
        private String identity;
        private long bodyLength = -1;
        private Instant time;
        private Duration expiry;
        private Clock clock = Clock.systemUTC();
        private boolean copyHeaders;

        public Builder selector(String selector) {
            this.selector = selector;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        /**
         * Sets the signing key, an RSA or Ed25519 private key.
         *
         * @param privateKey the private key
         * @return this builder
         */
        public Builder privateKey(PrivateKey privateKey) {
            this.privateKey = privateKey;
            return this;
        }

        /**
         * Sets the hash algorithm. Only SHA-256 is accepted.
         *
         * @param hashAlgorithm the hash algorithm
         * @return this builder
         */
        public Builder hashAlgorithm(HashAlgorithm hashAlgorithm) {
            this.hashAlgorithm = hashAlgorithm;
            return this;
        }

        public Builder canonicalization(Canonicalization header, Canonicalization body) {
            this.headerCanonicalization = header;
            this.bodyCanonicalization = body;
            return this;
        }

        public Builder headerCanonicalization(Canonicalization canonicalization) {
            this.headerCanonicalization = canonicalization;
            return this;
        }

        public Builder bodyCanonicalization(Canonicalization canonicalization) {
            this.bodyCanonicalization = canonicalization;
            return this;
        }

        /**
         * Sets the header fields to sign, in {@code h=} order. From is
         * required. Naming a header more often than it occurs protects
         * against further instances being added.
         *
         * @param names the header names
         * @return this builder
         */
        public Builder signedHeaders(String... names) {
            List<String> list = new ArrayList<String>(names.length);
            for (int i = 0; i < names.length; i++) {
                list.add(names[i]);
            }
            this.signedHeaders = list;
            return this;
        }

        public Builder signedHeaders(List<String> names) {
            this.signedHeaders = new ArrayList<String>(names);
            return this;
        }

        /**
         * Sets the agent or user identifier ({@code i=}), which must be in
         * the signing domain or one of its subdomains.
         *
         * @param identity the identity, e.g. {@code user@mail.example.com}
         * @return this builder
         */
        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        /**
         * Limits the signature to the first bytes of the canonical body
         * ({@code l=}).
         *
         * @param bodyLength the number of bytes, or -1 to sign the whole body
         * @return this builder
         */
        public Builder bodyLength(long bodyLength) {
            this.bodyLength = bodyLength;
            return this;
        }

        /**
         * Sets a fixed signing time. By default the clock is read for
         * every message.
         *
         * @param time the signing time
         * @return this builder
         */
        public Builder time(Instant time) {
            this.time = time;
            return this;
        }

        /**
         * Sets how long signatures are valid ({@code x=}).
         *
         * @param expiry the validity period, at least one second
         * @return this builder
         */
        public Builder expiry(Duration expiry) {
            this.expiry = expiry;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets whether to copy the signed header fields into {@code z=},
         * for diagnostics at the verifier.
         *
         * @param copyHeaders true to add {@code z=}
         * @return this builder
         */
        public Builder copyHeaders(boolean copyHeaders) {
            this.copyHeaders = copyHeaders;
            return this;
        }

        /**
         * Validates the settings and creates the signer.
         *
         * @return the signer
         * @throws DKIMSigningException if a required setting is missing,
         *         the settings are inconsistent or the algorithm may not be
         *         used for signing
         */
        public DKIMSigner build() throws DKIMSigningException {
            requireSetting(selector, "selector");
            requireSetting(domain, "domain");
            requireSetting(privateKey, "privateKey");
            requireSetting(signedHeaders, "signedHeaders");
            requireSetting(hashAlgorithm, "hashAlgorithm");
            requireSetting(headerCanonicalization, "headerCanonicalization");
            requireSetting(bodyCanonicalization, "bodyCanonicalization");
            requireSetting(clock, "clock");

            if (!hashAlgorithm.isSigningAllowed()) {
                throw new DKIMSigningException(DKIMSigningException.Reason.UNSUPPORTED_ALGORITHM,
                        MessageFormat.format(L10N.getString("err.sign_hash"), hashAlgorithm));
            }
            KeyType keyType = KeyType.forKey(privateKey);
            SignatureAlgorithm algorithm = (keyType == null) ? null
                    : SignatureAlgorithm.forKeyType(keyType, hashAlgorithm);
            if (algorithm == null) {
                throw new DKIMSigningException(DKIMSigningException.Reason.UNSUPPORTED_ALGORITHM,
                        MessageFormat.format(L10N.getString("err.sign_key_type"),
                                privateKey.getAlgorithm()));
            }

            boolean hasFrom = false;
            for (int i = 0; i < signedHeaders.size(); i++) {
                if ("from".equalsIgnoreCase(signedHeaders.get(i))) {
                    hasFrom = true;
                }
            }
            if (!hasFrom) {
                throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                        L10N.getString("err.sign_no_from"));
            }

            if (identity != null) {
                int atPos = identity.lastIndexOf('@');
                if (atPos < 0 || !DKIMSignature.isWithinDomain(identity.substring(atPos + 1), domain)) {
                    throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                            MessageFormat.format(L10N.getString("err.sign_identity"), identity, domain));
                }
            }
            if (bodyLength < -1) {
                throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                        MessageFormat.format(L10N.getString("err.sign_body_length"),
                                Long.toString(bodyLength)));
            }
            if (expiry != null && expiry.getSeconds() < 1) {
                throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                        MessageFormat.format(L10N.getString("err.sign_expiry"), expiry));
            }
            return new DKIMSigner(this, algorithm);
        }

        private static void requireSetting(Object value, String name) throws DKIMSigningException {
            if (value == null) {
                throw new DKIMSigningException(DKIMSigningException.Reason.INVALID_CONFIGURATION,
                        MessageFormat.format(L10N.getString("err.sign_missing"), name));
            }
        }

    }

}
