/*
 * HashAlgorithm.java
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

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Digest algorithms used by DKIM.
 *
 * <p>SHA-1 is retained for verifying legacy signatures only
 * (RFC 8301); it is never offered for signing.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum HashAlgorithm {

    SHA1("sha1", "SHA-1", false, new byte[] {
        0x30, 0x21, 0x30, 0x09, 0x06, 0x05, 0x2b, 0x0e, 0x03, 0x02, 0x1a, 0x05, 0x00, 0x04, 0x14
    }),

    SHA256("sha256", "SHA-256", true, new byte[] {
        0x30, 0x31, 0x30, 0x0d, 0x06, 0x09, 0x60, (byte) 0x86, 0x48, 0x01, 0x65, 0x03, 0x04, 0x02, 0x01,
        0x05, 0x00, 0x04, 0x20
    });

    private final String value;
    private final String digestAlgorithm;
    private final boolean signingAllowed;
    private final byte[] digestInfoPrefix;

    HashAlgorithm(String value, String digestAlgorithm, boolean signingAllowed,
                  byte[] digestInfoPrefix) {
        this.value = value;
        this.digestAlgorithm = digestAlgorithm;
        this.signingAllowed = signingAllowed;
        this.digestInfoPrefix = digestInfoPrefix;
    }

    /**
     * Returns the name used in {@code a=} and in the key record's
     * {@code h=} tag.
     *
     * @return the tag value, e.g. "sha256"
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the JCA name of the digest.
     *
     * @return the digest algorithm name
     */
    public String getDigestAlgorithm() {
        return digestAlgorithm;
    }

    /**
     * Returns whether new signatures may be created with this digest.
     *
     * @return false for SHA-1
     */
    public boolean isSigningAllowed() {
        return signingAllowed;
    }

    /**
     * Creates a new digest instance.
     *
     * @return the message digest
     */
    public MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(digestAlgorithm);
        } catch (NoSuchAlgorithmException e) {
            // Every Java platform is required to support SHA-1 and SHA-256
            throw new IllegalStateException(digestAlgorithm, e);
        }
    }

    /**
     * Wraps a digest in the DER DigestInfo structure that RSASSA-PKCS1-v1_5
     * signs.
     *
     * @param digest the raw digest
     * @return the DigestInfo encoding
     */
    byte[] toDigestInfo(byte[] digest) {
        byte[] result = new byte[digestInfoPrefix.length + digest.length];
        System.arraycopy(digestInfoPrefix, 0, result, 0, digestInfoPrefix.length);
        System.arraycopy(digest, 0, result, digestInfoPrefix.length, digest.length);
        return result;
    }

    /**
     * Returns the hash algorithm for a tag value.
     *
     * @param value the name, case-insensitive
     * @return the algorithm, or null if not recognised
     */
    public static HashAlgorithm forValue(String value) {
        for (HashAlgorithm h : values()) {
            if (h.value.equalsIgnoreCase(value)) {
                return h;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }

}
