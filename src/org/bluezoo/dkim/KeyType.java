/*
 * KeyType.java
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
import java.security.Key;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.interfaces.EdECKey;
import java.security.interfaces.RSAKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * Public key families that can appear in a key record's {@code k=} tag.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc8463">RFC 8463 - Ed25519 for DKIM</a>
 */
public enum KeyType {

    /** RSA; {@code p=} is a DER SubjectPublicKeyInfo. */
    RSA("rsa", "RSA"),

    /** Ed25519; {@code p=} is the raw 32-byte public key (RFC 8463). */
    ED25519("ed25519", "Ed25519");

    /** SubjectPublicKeyInfo header preceding a raw Ed25519 key. */
    private static final byte[] ED25519_SPKI_PREFIX = {
        0x30, 0x2a, 0x30, 0x05, 0x06, 0x03, 0x2b, 0x65, 0x70, 0x03, 0x21, 0x00
    };
    private static final int ED25519_KEY_LENGTH = 32;

    private final String value;
    private final String keyAlgorithm;

    KeyType(String value, String keyAlgorithm) {
        this.value = value;
        this.keyAlgorithm = keyAlgorithm;
    }

    /**
     * Returns the name used in the {@code k=} tag.
     *
     * @return the tag value
     */
    public String getValue() {
        return value;
    }

    /**
     * Decodes the key material of a key record's {@code p=} tag.
     *
     * @param data the base64-decoded key data
     * @return the public key
     * @throws GeneralSecurityException if the data is not a key of this type
     */
    public PublicKey decodePublicKey(byte[] data) throws GeneralSecurityException {
        byte[] encoded = data;
        if (this == ED25519 && data.length == ED25519_KEY_LENGTH) {
            encoded = new byte[ED25519_SPKI_PREFIX.length + ED25519_KEY_LENGTH];
            System.arraycopy(ED25519_SPKI_PREFIX, 0, encoded, 0, ED25519_SPKI_PREFIX.length);
            System.arraycopy(data, 0, encoded, ED25519_SPKI_PREFIX.length, ED25519_KEY_LENGTH);
        }
        KeyFactory keyFactory = KeyFactory.getInstance(keyAlgorithm);
        return keyFactory.generatePublic(new X509EncodedKeySpec(encoded));
    }

    /**
     * Encodes a public key in the form published in {@code p=}.
     *
     * @param key the public key, which must be of this type
     * @return the key data before base64 encoding
     * @throws InvalidKeySpecException if the key has no usable encoding
     */
    public byte[] encodePublicKey(PublicKey key) throws InvalidKeySpecException {
        byte[] encoded = key.getEncoded();
        if (encoded == null) {
            throw new InvalidKeySpecException(key.getAlgorithm());
        }
        if (this == ED25519) {
            int prefixLength = ED25519_SPKI_PREFIX.length;
            if (encoded.length != prefixLength + ED25519_KEY_LENGTH
                    || !Arrays.equals(ED25519_SPKI_PREFIX, Arrays.copyOf(encoded, prefixLength))) {
                throw new InvalidKeySpecException(key.getAlgorithm());
            }
            return Arrays.copyOfRange(encoded, prefixLength, encoded.length);
        }
        return encoded;
    }

    /**
     * Returns the key type of a JCA key.
     *
     * @param key a public or private key
     * @return the key type, or null if DKIM has no key type for it
     */
    public static KeyType forKey(Key key) {
        if (key instanceof RSAKey) {
            return RSA;
        }
        if (key instanceof EdECKey) {
            String curve = ((EdECKey) key).getParams().getName();
            return "Ed25519".equalsIgnoreCase(curve) ? ED25519 : null;
        }
        return null;
    }

    /**
     * Returns the key type for a {@code k=} value.
     *
     * @param value the name, case-insensitive
     * @return the key type, or null if not recognised
     */
    public static KeyType forValue(String value) {
        for (KeyType k : values()) {
            if (k.value.equalsIgnoreCase(value)) {
                return k;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }

}
