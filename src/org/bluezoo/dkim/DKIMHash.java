/*
 * DKIMHash.java
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

import java.io.ByteArrayOutputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.bluezoo.dkim.canon.Canonicalization;
import org.bluezoo.dkim.canon.Canonicalizer;
import org.bluezoo.dkim.message.Message;
import org.bluezoo.dkim.message.RawHeader;

/**
 * Computes the body hash and the header hash of a DKIM signature
 * (RFC 6376 sections 3.7 and 5.4.2).
 *
 * <p>The same computation serves signing and verification, so that both
 * sides agree byte for byte.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DKIMHash {

    private DKIMHash() {
    }

    /**
     * Computes the body hash.
     *
     * @param body the raw message body
     * @param canonicalization the body canonicalization
     * @param algorithm the hash algorithm
     * @param length the number of canonical body bytes to hash, or -1 for
     *        all of them; a length beyond the end hashes the whole body
     * @return the digest
     */
    public static byte[] bodyHash(byte[] body, Canonicalization canonicalization,
                                  HashAlgorithm algorithm, long length) {
        byte[] canonical = Canonicalizer.canonicalizeBody(body, canonicalization);
        int count = canonical.length;
        if (length >= 0 && length < count) {
            count = (int) length;
        }
        MessageDigest digest = algorithm.newDigest();
        digest.update(canonical, 0, count);
        return digest.digest();
    }

    /**
     * Selects the header fields named in {@code h=}.
     *
     * <p>Each name takes the next physical header of that name that has not
     * been taken yet, counting from the bottom of the message. A name with
     * no remaining instance selects nothing, which is how signers protect
     * against headers being added later.
     *
     * @param message the message
     * @param names the header names in {@code h=} order
     * @return the selected header fields in hashing order
     */
    public static List<RawHeader> selectHeaders(Message message, List<String> names) {
        List<RawHeader> selected = new ArrayList<RawHeader>(names.size());
        Map<String, Integer> remaining = new HashMap<String, Integer>();
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).toLowerCase(Locale.ROOT);
            List<RawHeader> instances = message.getHeaders(name);
            Integer count = remaining.get(name);
            int next = (count == null) ? instances.size() : count.intValue();
            if (next > 0) {
                next--;
                selected.add(instances.get(next));
            }
            remaining.put(name, Integer.valueOf(next));
        }
        return selected;
    }

    /**
     * Builds the data that the header hash is computed over.
     *
     * @param message the message
     * @param signedHeaders the {@code h=} names
     * @param signatureHeader the DKIM-Signature header field with its
     *        {@code b=} value emptied
     * @param canonicalization the header canonicalization
     * @return the hash input
     */
    public static byte[] headerHashInput(Message message, List<String> signedHeaders,
                                         RawHeader signatureHeader,
                                         Canonicalization canonicalization) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        List<RawHeader> selected = selectHeaders(message, signedHeaders);
        for (int i = 0; i < selected.size(); i++) {
            byte[] bytes = Canonicalizer.canonicalizeHeader(selected.get(i), canonicalization);
            out.write(bytes, 0, bytes.length);
        }
        // The signature header is hashed without its terminating CRLF
        byte[] bytes = Canonicalizer.canonicalizeHeader(signatureHeader, canonicalization);
        int length = bytes.length;
        if (length >= 2 && bytes[length - 2] == '\r' && bytes[length - 1] == '\n') {
            length -= 2;
        }
        out.write(bytes, 0, length);
        return out.toByteArray();
    }

    /**
     * Computes the header hash.
     *
     * @param message the message
     * @param signedHeaders the {@code h=} names
     * @param signatureHeader the DKIM-Signature header field with its
     *        {@code b=} value emptied
     * @param canonicalization the header canonicalization
     * @param algorithm the hash algorithm
     * @return the digest
     */
    public static byte[] headerHash(Message message, List<String> signedHeaders,
                                    RawHeader signatureHeader,
                                    Canonicalization canonicalization,
                                    HashAlgorithm algorithm) {
        byte[] input = headerHashInput(message, signedHeaders, signatureHeader, canonicalization);
        return algorithm.newDigest().digest(input);
    }

}
