/*
 * Canonicalizer.java
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

package org.bluezoo.dkim.canon;

import java.io.ByteArrayOutputStream;

import org.bluezoo.dkim.message.RawHeader;

/**
 * DKIM canonicalization of header fields and message bodies
 * (RFC 6376 section 3.4).
 *
 * <p>All methods are pure functions over bytes. Input is never rejected:
 * bytes outside US-ASCII are carried through unchanged. Only CRLF is a
 * line terminator here; the treatment of bare LF is decided when the
 * message is parsed (see {@link org.bluezoo.dkim.message.LineEndings}).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Canonicalizer {

    private static final byte[] CRLF = { '\r', '\n' };

    private Canonicalizer() {
    }

    /**
     * Canonicalizes a header field.
     *
     * <p>The result always ends with CRLF.
     *
     * @param header the raw header field
     * @param canonicalization the algorithm
     * @return the canonical form
     */
    public static byte[] canonicalizeHeader(RawHeader header, Canonicalization canonicalization) {
        if (canonicalization == Canonicalization.RELAXED) {
            return relaxedHeader(header.getBytesUnfolded());
        }
        byte[] bytes = header.getBytes();
        if (endsWithCRLF(bytes, bytes.length)) {
            return bytes;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + 2);
        out.write(bytes, 0, bytes.length);
        out.write(CRLF, 0, 2);
        return out.toByteArray();
    }

    /**
     * Canonicalizes a message body.
     *
     * @param body the raw body bytes
     * @param canonicalization the algorithm
     * @return the canonical form; for an empty body {@code "\r\n"} under
     *         simple and the empty array under relaxed
     */
    public static byte[] canonicalizeBody(byte[] body, Canonicalization canonicalization) {
        if (canonicalization == Canonicalization.RELAXED) {
            return relaxedBody(body);
        }
        return simpleBody(body);
    }

    /**
     * Relaxed header canonicalization of an already unfolded header:
     * lower-case name, no whitespace around the colon, runs of WSP reduced
     * to a single space, no leading or trailing WSP in the value.
     */
    private static byte[] relaxedHeader(byte[] bytes) {
        int colonPos = -1;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == ':') {
                colonPos = i;
                break;
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length);
        int nameEnd = (colonPos < 0) ? 0 : colonPos;
        while (nameEnd > 0 && isWSP(bytes[nameEnd - 1])) {
            nameEnd--;
        }
        for (int i = 0; i < nameEnd; i++) {
            byte b = bytes[i];
            if (b >= 'A' && b <= 'Z') {
                b = (byte) (b + ('a' - 'A'));
            }
            out.write(b);
        }
        out.write(':');
        int end = bytes.length;
        if (endsWithCRLF(bytes, end)) {
            end -= 2;
        }
        boolean pendingSpace = false;
        boolean started = false;
        for (int i = colonPos + 1; i < end; i++) {
            byte b = bytes[i];
            if (b == '\r' && i + 1 < end && bytes[i + 1] == '\n') {
                // Line break left over from unfolding, not part of the value
                i++;
                continue;
            }
            if (isWSP(b)) {
                pendingSpace = started;
            } else {
                if (pendingSpace) {
                    out.write(' ');
                    pendingSpace = false;
                }
                out.write(b);
                started = true;
            }
        }
        out.write(CRLF, 0, 2);
        return out.toByteArray();
    }

    /**
     * Simple body canonicalization: trailing empty lines removed, exactly
     * one CRLF at the end.
     */
    private static byte[] simpleBody(byte[] body) {
        int end = body.length;
        while (endsWithCRLF(body, end)) {
            end -= 2;
        }
        byte[] result = new byte[end + 2];
        System.arraycopy(body, 0, result, 0, end);
        result[end] = '\r';
        result[end + 1] = '\n';
        return result;
    }

    /**
     * Relaxed body canonicalization. Empty lines are held back until a
     * line with content follows, so trailing empty lines are dropped.
     */
    private static byte[] relaxedBody(byte[] body) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(body.length);
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int pendingEmptyLines = 0;
        int pos = 0;
        while (pos < body.length) {
            int lineEnd = pos;
            while (lineEnd < body.length && !(body[lineEnd] == '\r'
                    && lineEnd + 1 < body.length && body[lineEnd + 1] == '\n')) {
                lineEnd++;
            }
            line.reset();
            boolean pendingSpace = false;
            for (int i = pos; i < lineEnd; i++) {
                byte b = body[i];
                if (isWSP(b)) {
                    pendingSpace = true;
                } else {
                    if (pendingSpace) {
                        line.write(' ');
                        pendingSpace = false;
                    }
                    line.write(b);
                }
            }
            if (line.size() == 0) {
                pendingEmptyLines++;
            } else {
                for (int i = 0; i < pendingEmptyLines; i++) {
                    out.write(CRLF, 0, 2);
                }
                pendingEmptyLines = 0;
                byte[] content = line.toByteArray();
                out.write(content, 0, content.length);
                out.write(CRLF, 0, 2);
            }
            pos = lineEnd + 2;
        }
        return out.toByteArray();
    }

    private static boolean isWSP(byte b) {
        return b == ' ' || b == '\t';
    }

    private static boolean endsWithCRLF(byte[] bytes, int end) {
        return end >= 2 && bytes[end - 2] == '\r' && bytes[end - 1] == '\n';
    }

}
