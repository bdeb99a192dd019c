/*
 * LineEndings.java
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

/**
 * How line endings in raw message data are treated when a
 * {@link Message} is parsed.
 *
 * <p>SMTP mandates CRLF, but messages handed over by local submission or
 * read from files often use bare LF. DKIM canonicalization only knows
 * CRLF, so the choice has to be the same on the signing and the verifying
 * side.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum LineEndings {

    /**
     * Every bare LF and bare CR is rewritten to CRLF before the message is
     * split into headers and body.
     */
    NORMALIZE,

    /**
     * The data is kept byte for byte. Only CRLF terminates a line; a bare
     * LF or CR is ordinary content.
     */
    PRESERVE;

    /**
     * Applies this policy to raw message data.
     *
     * @param data the raw message bytes
     * @return the bytes to parse (the same array if nothing changes)
     */
    public byte[] apply(byte[] data) {
        if (this == PRESERVE) {
            return data;
        }
        int extra = 0;
        for (int i = 0; i < data.length; i++) {
            byte b = data[i];
            if (b == '\n' && (i == 0 || data[i - 1] != '\r')) {
                extra++;
            } else if (b == '\r' && (i + 1 == data.length || data[i + 1] != '\n')) {
                extra++;
            }
        }
        if (extra == 0) {
            return data;
        }
        byte[] result = new byte[data.length + extra];
        int pos = 0;
        for (int i = 0; i < data.length; i++) {
            byte b = data[i];
            if (b == '\n' && (i == 0 || data[i - 1] != '\r')) {
                result[pos++] = '\r';
                result[pos++] = '\n';
            } else if (b == '\r' && (i + 1 == data.length || data[i + 1] != '\n')) {
                result[pos++] = '\r';
                result[pos++] = '\n';
            } else {
                result[pos++] = b;
            }
        }
        return result;
    }

}
