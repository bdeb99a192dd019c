/*
 * Message.java
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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An immutable mail message as seen by DKIM: the header fields in the
 * order received, each with its raw bytes, and the raw body.
 *
 * <p>No MIME structure is interpreted. The header block ends at the first
 * empty line; everything after that line is the body.
 *
 * <p>Headers are indexed by lower-case name. The index lists each name's
 * headers from top to bottom, which lets DKIM header selection count
 * occurrences from the bottom without touching the message itself.
 *
 * <p>Instances can be shared between threads.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class Message {

    private static final Logger LOGGER = Logger.getLogger(Message.class.getName());
    private static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.dkim.message.L10N");

    private final List<RawHeader> headers;
    private final Map<String, List<RawHeader>> headerMap;
    private final byte[] body;

    /**
     * Creates a message from headers and body.
     *
     * @param headers the header fields in message order
     * @param body the raw body bytes, starting after the empty separator line
     */
    public Message(List<RawHeader> headers, byte[] body) {
        this.headers = Collections.unmodifiableList(new ArrayList<RawHeader>(headers));
        this.body = body.clone();
        Map<String, List<RawHeader>> map = new HashMap<String, List<RawHeader>>();
        for (int i = 0; i < this.headers.size(); i++) {
            RawHeader header = this.headers.get(i);
            String key = header.getName().toLowerCase(Locale.ROOT);
            List<RawHeader> list = map.get(key);
            if (list == null) {
                list = new ArrayList<RawHeader>();
                map.put(key, list);
            }
            list.add(header);
        }
        for (Map.Entry<String, List<RawHeader>> entry : map.entrySet()) {
            entry.setValue(Collections.unmodifiableList(entry.getValue()));
        }
        this.headerMap = map;
    }

    /**
     * Parses raw message data, normalizing bare line endings to CRLF.
     *
     * @param data the raw message
     * @return the message
     * @see LineEndings#NORMALIZE
     */
    public static Message parse(byte[] data) {
        return parse(data, LineEndings.NORMALIZE);
    }

    /**
     * Parses raw message data.
     *
     * @param data the raw message
     * @param lineEndings how bare line endings are treated
     * @return the message
     */
    public static Message parse(byte[] data, LineEndings lineEndings) {
        byte[] bytes = lineEndings.apply(data);
        List<RawHeader> headers = new ArrayList<RawHeader>();
        ByteArrayOutputStream current = new ByteArrayOutputStream();
        String currentName = null;
        int pos = 0;
        int bodyStart = bytes.length;
        while (pos < bytes.length) {
            int lineEnd = indexOfCRLF(bytes, pos);
            int next = (lineEnd < 0) ? bytes.length : lineEnd + 2;
            if (lineEnd == pos) {
                // Empty line: end of headers
                bodyStart = next;
                break;
            }
            byte first = bytes[pos];
            if (first == ' ' || first == '\t') {
                if (currentName != null) {
                    current.write(bytes, pos, next - pos);
                }
            } else {
                if (currentName != null) {
                    headers.add(new RawHeader(currentName, current.toByteArray()));
                    current.reset();
                }
                currentName = extractHeaderName(bytes, pos, next);
                if (currentName != null) {
                    current.write(bytes, pos, next - pos);
                } else if (LOGGER.isLoggable(Level.FINE)) {
                    String line = new String(bytes, pos, next - pos, StandardCharsets.ISO_8859_1);
                    LOGGER.fine(MessageFormat.format(L10N.getString("debug.skip_header_line"), line.trim()));
                }
            }
            pos = next;
        }
        if (currentName != null) {
            headers.add(new RawHeader(currentName, current.toByteArray()));
        }
        byte[] body = new byte[bytes.length - bodyStart];
        System.arraycopy(bytes, bodyStart, body, 0, body.length);
        return new Message(headers, body);
    }

    /**
     * Returns all header fields in message order.
     *
     * @return an unmodifiable list of headers
     */
    public List<RawHeader> getHeaders() {
        return headers;
    }

    /**
     * Returns all header fields with the given name (case-insensitive),
     * from the top of the message to the bottom.
     *
     * @param name the header name
     * @return an unmodifiable list of headers (may be empty)
     */
    public List<RawHeader> getHeaders(String name) {
        List<RawHeader> list = headerMap.get(name.toLowerCase(Locale.ROOT));
        if (list == null) {
            return Collections.emptyList();
        }
        return list;
    }

    /**
     * Returns the first header with the given name.
     *
     * @param name the header name (case-insensitive)
     * @return the header, or null if not present
     */
    public RawHeader getHeader(String name) {
        List<RawHeader> list = getHeaders(name);
        return list.isEmpty() ? null : list.get(0);
    }

    /**
     * Returns the raw body.
     *
     * @return a copy of the body bytes
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * Returns a new message with a header field added above all others,
     * which is where a signer places its DKIM-Signature.
     *
     * @param field the complete header field, e.g. {@code "DKIM-Signature: v=1; ..."}
     * @return the new message
     */
    public Message prepend(String field) {
        List<RawHeader> list = new ArrayList<RawHeader>(headers.size() + 1);
        list.add(RawHeader.of(field));
        list.addAll(headers);
        return new Message(list, body);
    }

    /**
     * Returns a new message with one header field replaced. Used to derive
     * variants of a message, for instance a modified copy in tests or a
     * rewritten header in a relay.
     *
     * @param index the index of the header in {@link #getHeaders()}
     * @param field the replacement header field
     * @return the new message
     */
    public Message replaceHeader(int index, String field) {
        List<RawHeader> list = new ArrayList<RawHeader>(headers);
        list.set(index, RawHeader.of(field));
        return new Message(list, body);
    }

    /**
     * Returns a new message with the same headers and a different body.
     *
     * @param newBody the raw body bytes
     * @return the new message
     */
    public Message withBody(byte[] newBody) {
        return new Message(headers, newBody);
    }

    /**
     * Serializes the message: the header fields, an empty line and the
     * body.
     *
     * @return the message bytes
     */
    public byte[] toByteArray() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < headers.size(); i++) {
            byte[] bytes = headers.get(i).getBytes();
            out.write(bytes, 0, bytes.length);
        }
        out.write('\r');
        out.write('\n');
        out.write(body, 0, body.length);
        return out.toByteArray();
    }

    private static int indexOfCRLF(byte[] bytes, int from) {
        for (int i = from; i < bytes.length - 1; i++) {
            if (bytes[i] == '\r' && bytes[i + 1] == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * Extracts the field name from a header line, or null if the line
     * does not start with a valid field name and colon.
     */
    private static String extractHeaderName(byte[] bytes, int start, int end) {
        boolean seenWhitespace = false;
        for (int i = start; i < end; i++) {
            byte c = bytes[i];
            if (c == ':') {
                if (i == start) {
                    return null;
                }
                String name = new String(bytes, start, i - start, StandardCharsets.ISO_8859_1);
                return RawHeader.trimTrailingWhitespace(name);
            }
            if (c == ' ' || c == '\t') {
                // obsolete syntax allows WSP between name and colon only
                seenWhitespace = true;
            } else if (c < 33 || c > 126 || seenWhitespace) {
                break;
            }
        }
        return null;
    }

}
