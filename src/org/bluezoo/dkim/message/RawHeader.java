/*
 * RawHeader.java
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

package org.bluezoo.dkim.message;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A header field exactly as it appeared in the message.
 *
 * <p>The bytes include any folding and the terminating CRLF. DKIM
 * canonicalization needs the original, unmodified bytes:
 * <ul>
 *   <li><strong>Simple mode</strong> uses {@link #getBytes()} as is</li>
 *   <li><strong>Relaxed mode</strong> starts from {@link #getBytesUnfolded()}</li>
 * </ul>
 *
 * <p>Instances are immutable.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class RawHeader {

    private final String name;
    private final byte[] bytes;

    RawHeader(String name, byte[] bytes) {
        this.name = name;
        this.bytes = bytes;
    }

    /**
     * Creates a raw header from a complete header field such as
     * {@code "Subject: hello"}. A terminating CRLF is added if the field
     * does not already end with one.
     *
     * @param field the header field, name and value
     * @return the raw header
     * @throws IllegalArgumentException if the field has no colon
     */
    public static RawHeader of(String field) {
        int colonPos = field.indexOf(':');
        if (colonPos <= 0) {
            throw new IllegalArgumentException("Not a header field: " + field);
        }
        String line = field.endsWith("\r\n") ? field : field + "\r\n";
        String name = trimTrailingWhitespace(field.substring(0, colonPos));
        return new RawHeader(name, line.getBytes(StandardCharsets.ISO_8859_1));
    }

    /**
     * Returns the header name.
     *
     * @return the header name (original case preserved)
     */
    public String getName() {
        return name;
    }

    /**
     * Returns whether this header has the given name, ignoring case.
     *
     * @param headerName the name to compare
     * @return true if the names match
     */
    public boolean isNamed(String headerName) {
        return name.equalsIgnoreCase(headerName);
    }

    /**
     * Returns the raw header bytes, with fold CRLFs and the terminating
     * CRLF exactly as received.
     *
     * @return a copy of the raw bytes
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * Returns the number of raw bytes.
     *
     * @return the length
     */
    public int length() {
        return bytes.length;
    }

    /**
     * Returns the header bytes with fold line endings removed.
     *
     * <p>A fold is a CRLF followed by a space or tab. The CRLF is removed
     * and the continuation whitespace kept. The final CRLF is preserved.
     *
     * @return the bytes with fold line endings stripped
     */
    public byte[] getBytesUnfolded() {
        byte[] result = new byte[bytes.length];
        int destPos = 0;
        int i = 0;
        while (i < bytes.length) {
            if (bytes[i] == '\r' && i + 2 < bytes.length && bytes[i + 1] == '\n') {
                byte next = bytes[i + 2];
                if (next == ' ' || next == '\t') {
                    i += 2;
                    continue;
                }
            }
            result[destPos++] = bytes[i++];
        }
        return destPos == bytes.length ? result : Arrays.copyOf(result, destPos);
    }

    /**
     * Returns the raw header as a string using ISO-8859-1, so each byte
     * maps to exactly one char.
     *
     * @return the header as string with fold CRLFs preserved
     */
    public String asString() {
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /**
     * Returns the raw value: everything after the first colon, without
     * the terminating CRLF. Folding inside the value is kept.
     *
     * @return the raw header value
     */
    public String getValue() {
        String s = asString();
        int start = s.indexOf(':') + 1;
        int end = s.length();
        if (s.endsWith("\r\n")) {
            end -= 2;
        }
        return s.substring(start, end);
    }

    /**
     * Returns everything up to and including the first colon.
     *
     * @return the raw name part, e.g. {@code "Subject:"}
     */
    public String getNamePart() {
        String s = asString();
        return s.substring(0, s.indexOf(':') + 1);
    }

    @Override
    public String toString() {
        return asString();
    }

    static String trimTrailingWhitespace(String s) {
        int end = s.length();
        while (end > 0) {
            char c = s.charAt(end - 1);
            if (c != ' ' && c != '\t') {
                break;
            }
            end--;
        }
        return s.substring(0, end);
    }

}
