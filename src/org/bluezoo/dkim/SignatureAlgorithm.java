/*
 * SignatureAlgorithm.java
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
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;

/**
 * DKIM signing algorithms ({@code a=} tag).
 *
 * <p>Each algorithm pairs a key family with a digest. Signing and
 * verification always operate on the digest computed by {@link DKIMHash}:
 * RSA signs the DER DigestInfo of the digest (RSASSA-PKCS1-v1_5), and
 * Ed25519 signs the SHA-256 digest itself, as RFC 8463 requires.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum SignatureAlgorithm {

    RSA_SHA1("rsa-sha1", KeyType.RSA, HashAlgorithm.SHA1, "NONEwithRSA"),

    RSA_SHA256("rsa-sha256", KeyType.RSA, HashAlgorithm.SHA256, "NONEwithRSA"),

    ED25519_SHA256("ed25519-sha256", KeyType.ED25519, HashAlgorithm.SHA256, "Ed25519");

    private final String value;
    private final KeyType keyType;
    private final HashAlgorithm hashAlgorithm;
    private final String signatureAlgorithm;

    SignatureAlgorithm(String value, KeyType keyType, HashAlgorithm hashAlgorithm,
                       String signatureAlgorithm) {
        this.value = value;
        this.keyType = keyType;
        this.hashAlgorithm = hashAlgorithm;
        this.signatureAlgorithm = signatureAlgorithm;
    }

    /**
     * Returns the name used in the {@code a=} tag.
     *
     * @return the tag value
     */
    public String getValue() {
        return value;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    public HashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    /**
     * Signs a header hash.
     *
     * @param key the private key, of this algorithm's key type
     * @param digest the header hash
     * @return the signature bytes
     * @throws GeneralSecurityException if the key is rejected or signing fails
     */
    public byte[] sign(PrivateKey key, byte[] digest) throws GeneralSecurityException {
        Signature signature = Signature.getInstance(signatureAlgorithm);
        signature.initSign(key);
        signature.update(toBeSigned(digest));
        return signature.sign();
    }

    /**
     * Verifies a signature over a header hash.
     *
     * @param key the public key, of this algorithm's key type
     * @param digest the header hash
     * @param signatureBytes the decoded {@code b=} value
     * @return true if the signature is valid
     * @throws java.security.InvalidKeyException if the key is not usable
     * @throws GeneralSecurityException if the signature is not even
     *         well-formed for the key
     */
    public boolean verify(PublicKey key, byte[] digest, byte[] signatureBytes)
            throws GeneralSecurityException {
        Signature signature = Signature.getInstance(signatureAlgorithm);
        signature.initVerify(key);
        signature.update(toBeSigned(digest));
        return signature.verify(signatureBytes);
    }

    private byte[] toBeSigned(byte[] digest) {
        return (keyType == KeyType.RSA) ? hashAlgorithm.toDigestInfo(digest) : digest;
    }

    /**
     * Returns the algorithm for an {@code a=} value.
     *
     * @param value the name, case-insensitive
     * @return the algorithm, or null if not recognised
     */
    public static SignatureAlgorithm forValue(String value) {
        for (SignatureAlgorithm a : values()) {
            if (a.value.equalsIgnoreCase(value)) {
                return a;
            }
        }
        return null;
    }

    /**
     * Returns the algorithm combining a key type and a digest.
     *
     * @param keyType the key family
     * @param hashAlgorithm the digest
     * @return the algorithm, or null if DKIM defines no such combination
     */
    public static SignatureAlgorithm forKeyType(KeyType keyType, HashAlgorithm hashAlgorithm) {
        for (SignatureAlgorithm a : values()) {
            if (a.keyType == keyType && a.hashAlgorithm == hashAlgorithm) {
                return a;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }

}
