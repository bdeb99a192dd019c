/*
 * DKIMSignature.java
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
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.ResourceBundle;

import org.bluezoo.dkim.canon.Canonicalization;

/**
 * Parsed DKIM-Signature header as defined in RFC 6376.
 *
 * <p>A DKIM signature contains tags that specify the signing domain,
 * selector, algorithm, signed headers, and the signature itself.
 * Instances are immutable and are produced either by {@link #parse}
 * (verification) or by a {@link Builder} (signing, with an empty
 * {@code b=} tag still to be filled in).
 *
 * <p>Whitespace and folding inside the values of the tags defined by
 * RFC 6376 is ignored. Unknown tags are preserved in {@link #getTags()}.
 * If a tag occurs more than once, the first occurrence is used.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc6376">RFC 6376 - DKIM</a>
 */
public final class DKIMSignature {

    /** Header field name. */
    public static final String HEADER_NAME = "DKIM-Signature";

    /** The only query method defined by RFC 6376. */
    public static final String QUERY_DNS_TXT = "dns/txt";

    private static final ResourceBundle L10N = TagList.L10N;

    private static final int MAX_TIMESTAMP_DIGITS = 12;
    private static final int MAX_LENGTH_DIGITS = 76;

    private static final String[] REQUIRED_TAGS = { "v", "a", "b", "bh", "d", "h", "s" };

    private final TagList tags;
    private final SignatureAlgorithm algorithm;
    private final Canonicalization headerCanonicalization;
    private final Canonicalization bodyCanonicalization;
    private final String domain;
    private final String selector;
    private final List<String> signedHeaders;
    private final String bodyHash;
    private final String signature;
    private final long bodyLength;
    private final long timestamp;
    private final long expiration;
    private final String identity;
    private final List<String> queryMethods;
    private final List<String> copiedHeaders;

    private DKIMSignature(TagList tags, boolean allowEmptySignature) throws DKIMSignatureException {
        this.tags = tags;
        for (int i = 0; i < REQUIRED_TAGS.length; i++) {
            String tag = REQUIRED_TAGS[i];
            String value = tags.getCompactValue(tag);
            if (value == null) {
                throw error("err.sig_missing_tag", tag);
            }
            if (value.isEmpty() && !(allowEmptySignature && "b".equals(tag))) {
                throw error("err.sig_empty_tag", tag);
            }
        }

        String version = tags.getCompactValue("v");
        if (!"1".equals(version)) {
            throw error("err.sig_version", version);
        }

        String a = tags.getCompactValue("a");
        algorithm = SignatureAlgorithm.forValue(a);
        if (algorithm == null) {
            throw error("err.sig_algorithm", a);
        }

        String c = tags.getCompactValue("c");
        if (c == null || c.isEmpty()) {
            headerCanonicalization = Canonicalization.SIMPLE;
            bodyCanonicalization = Canonicalization.SIMPLE;
        } else {
            int slashPos = c.indexOf('/');
            String header = (slashPos < 0) ? c : c.substring(0, slashPos);
            String body = (slashPos < 0) ? null : c.substring(slashPos + 1);
            headerCanonicalization = Canonicalization.forValue(header);
            bodyCanonicalization = (body == null) ? Canonicalization.SIMPLE
                    : Canonicalization.forValue(body);
            if (headerCanonicalization == null || bodyCanonicalization == null) {
                throw error("err.sig_canonicalization", c);
            }
        }

        domain = tags.getCompactValue("d");
        selector = tags.getCompactValue("s");

        List<String> headers = new ArrayList<String>();
        List<String> names = TagList.splitList(tags.getValue("h"));
        boolean hasFrom = false;
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i).toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                throw error("err.sig_header_list", tags.getValue("h"));
            }
            if ("from".equals(name)) {
                hasFrom = true;
            }
            headers.add(name);
        }
        if (!hasFrom) {
            throw error("err.sig_no_from", tags.getValue("h"));
        }
        signedHeaders = Collections.unmodifiableList(headers);

        bodyHash = tags.getCompactValue("bh");
        checkBase64("bh", bodyHash);
        signature = tags.getCompactValue("b");
        checkBase64("b", signature);

        bodyLength = parseNumber("l", MAX_LENGTH_DIGITS);
        timestamp = parseNumber("t", MAX_TIMESTAMP_DIGITS);
        expiration = parseNumber("x", MAX_TIMESTAMP_DIGITS);
        if (timestamp >= 0 && expiration >= 0 && expiration <= timestamp) {
            throw error("err.sig_expiration", Long.toString(expiration), Long.toString(timestamp));
        }

        String i = tags.getCompactValue("i");
        if (i == null) {
            identity = "@" + domain;
        } else {
            int atPos = i.lastIndexOf('@');
            if (atPos < 0 || !isWithinDomain(i.substring(atPos + 1), domain)) {
                throw error("err.sig_identity", i, domain);
            }
            identity = i;
        }

        String q = tags.getCompactValue("q");
        if (q == null) {
            queryMethods = Collections.singletonList(QUERY_DNS_TXT);
        } else {
            List<String> methods = TagList.splitList(q);
            boolean dnsTxt = false;
            for (int j = 0; j < methods.size(); j++) {
                if (QUERY_DNS_TXT.equalsIgnoreCase(methods.get(j))) {
                    dnsTxt = true;
                }
            }
            if (!dnsTxt) {
                throw error("err.sig_query_method", q);
            }
            queryMethods = Collections.unmodifiableList(methods);
        }

        String z = tags.getCompactValue("z");
        if (z == null) {
            copiedHeaders = Collections.emptyList();
        } else {
            copiedHeaders = decodeCopiedHeaders(z);
        }
    }

    /**
     * Parses a DKIM-Signature header value.
     *
     * @param headerValue the header value (after "DKIM-Signature:"),
     *        possibly folded
     * @return the parsed signature
     * @throws DKIMSignatureException if the value is malformed or fails
     *         validation
     */
    public static DKIMSignature parse(String headerValue) throws DKIMSignatureException {
        if (headerValue == null) {
            throw error("err.sig_missing_tag", "v");
        }
        TagList tags;
        try {
            tags = TagList.parse(headerValue);
        } catch (ParseException e) {
            throw new DKIMSignatureException(e.getMessage(), e);
        }
        return new DKIMSignature(tags, false);
    }

    // -- Getters --

    /**
     * Returns the parsed tag list, including unknown tags.
     *
     * @return the tags
     */
    public TagList getTags() {
        return tags;
    }

    /**
     * Returns the header value this signature was parsed from.
     *
     * @return the raw header value
     */
    public String getRawValue() {
        return tags.getText();
    }

    /**
     * Returns the header value with the {@code b=} value removed, the form
     * that is included in the header hash.
     *
     * @return the raw header value without signature data
     */
    public String getValueWithoutSignature() {
        return tags.withoutValue("b");
    }

    public String getVersion() {
        return "1";
    }

    public SignatureAlgorithm getAlgorithm() {
        return algorithm;
    }

    public Canonicalization getHeaderCanonicalization() {
        return headerCanonicalization;
    }

    public Canonicalization getBodyCanonicalization() {
        return bodyCanonicalization;
    }

    public String getDomain() {
        return domain;
    }

    public String getSelector() {
        return selector;
    }

    /**
     * Returns the signed header names in {@code h=} order, lower-cased.
     *
     * @return an unmodifiable list of names, possibly with repeats
     */
    public List<String> getSignedHeaders() {
        return signedHeaders;
    }

    /**
     * Returns the body hash, base64-encoded.
     *
     * @return the {@code bh=} value
     */
    public String getBodyHash() {
        return bodyHash;
    }

    public byte[] getBodyHashBytes() {
        return Base64.getDecoder().decode(bodyHash);
    }

    /**
     * Returns the signature, base64-encoded.
     *
     * @return the {@code b=} value, empty for an unsigned template
     */
    public String getSignature() {
        return signature;
    }

    public byte[] getSignatureBytes() {
        return Base64.getDecoder().decode(signature);
    }

    /**
     * Returns the body length limit.
     *
     * @return the {@code l=} value, or -1 if the whole body is signed
     */
    public long getBodyLength() {
        return bodyLength;
    }

    /**
     * Returns the signature timestamp.
     *
     * @return seconds since the epoch, or -1 if absent
     */
    public long getTimestamp() {
        return timestamp;
    }

    /**
     * Returns the signature expiration.
     *
     * @return seconds since the epoch, or -1 if absent
     */
    public long getExpiration() {
        return expiration;
    }

    /**
     * Returns the agent or user identifier.
     *
     * @return the {@code i=} value, by default "@" followed by the domain
     */
    public String getIdentity() {
        return identity;
    }

    /**
     * Returns the domain part of the identity.
     *
     * @return the identity domain
     */
    public String getIdentityDomain() {
        return identity.substring(identity.lastIndexOf('@') + 1);
    }

    public List<String> getQueryMethods() {
        return queryMethods;
    }

    /**
     * Returns the decoded copied header fields of the {@code z=} tag,
     * each as {@code name:value}.
     *
     * @return an unmodifiable list, empty if the tag is absent
     */
    public List<String> getCopiedHeaders() {
        return copiedHeaders;
    }

    /**
     * Returns the DNS query name for the public key.
     *
     * @return the DNS name: selector._domainkey.domain
     */
    public String getKeyQueryName() {
        return selector + "._domainkey." + domain;
    }

    @Override
    public String toString() {
        return HEADER_NAME + ":" + tags.getText();
    }

    // -- Helper Methods --

    private long parseNumber(String tag, int maxDigits) throws DKIMSignatureException {
        String value = tags.getCompactValue(tag);
        if (value == null) {
            return -1;
        }
        if (value.isEmpty() || value.length() > maxDigits) {
            throw error("err.sig_number", tag, value);
        }
        long result = 0;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                throw error("err.sig_number", tag, value);
            }
            if (result > (Long.MAX_VALUE - (c - '0')) / 10) {
                // l= may have up to 76 digits; anything this large means the whole body
                return Long.MAX_VALUE;
            }
            result = result * 10 + (c - '0');
        }
        return result;
    }

    private static void checkBase64(String tag, String value) throws DKIMSignatureException {
        try {
            Base64.getDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new DKIMSignatureException(format("err.sig_base64", tag), e);
        }
    }

    static boolean isWithinDomain(String candidate, String domain) {
        String c = candidate.toLowerCase(Locale.ROOT);
        String d = domain.toLowerCase(Locale.ROOT);
        return c.equals(d) || c.endsWith("." + d);
    }

    private static List<String> decodeCopiedHeaders(String z) throws DKIMSignatureException {
        List<String> result = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i <= z.length(); i++) {
            if (i == z.length() || z.charAt(i) == '|') {
                String field = z.substring(start, i);
                if (field.indexOf(':') <= 0) {
                    throw error("err.sig_copied_headers", field);
                }
                result.add(decodeQuotedPrintable(field));
                start = i + 1;
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Decodes DKIM-quoted-printable (RFC 6376 section 2.11).
     */
    static String decodeQuotedPrintable(String s) throws DKIMSignatureException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '=') {
                int hi = (i + 2 < s.length()) ? Character.digit(s.charAt(i + 1), 16) : -1;
                int lo = (hi >= 0) ? Character.digit(s.charAt(i + 2), 16) : -1;
                if (lo < 0) {
                    throw error("err.sig_copied_headers", s);
                }
                out.write((hi << 4) | lo);
                i += 2;
            } else {
                out.write(c);
            }
        }
        return new String(out.toByteArray(), StandardCharsets.ISO_8859_1);
    }

    /**
     * Encodes DKIM-quoted-printable. Characters outside 0x21-0x7E, and ';',
     * '=' and '|', are encoded.
     */
    static String encodeQuotedPrintable(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        byte[] bytes = s.getBytes(StandardCharsets.ISO_8859_1);
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xff;
            if (b > 0x20 && b < 0x7f && b != ';' && b != '=' && b != '|') {
                sb.append((char) b);
            } else {
                sb.append('=');
                sb.append(Character.toUpperCase(Character.forDigit(b >> 4, 16)));
                sb.append(Character.toUpperCase(Character.forDigit(b & 0xf, 16)));
            }
        }
        return sb.toString();
    }

    private static String format(String key, Object... args) {
        return MessageFormat.format(L10N.getString(key), args);
    }

    private static DKIMSignatureException error(String key, Object... args) {
        return new DKIMSignatureException(format(key, args));
    }

    /**
     * Builds the DKIM-Signature value for a new signature.
     *
     * <p>Tags are written in the order {@code v a c d s i l t x h bh z b}
     * on a single line. The {@code b=} tag is written last and empty, so
     * the signer can append the base64 signature to
     * {@link DKIMSignature#getRawValue()}.
     */
    public static class Builder {

        private final SignatureAlgorithm algorithm;
        private final String domain;
        private final String selector;
        private Canonicalization headerCanonicalization = Canonicalization.SIMPLE;
        private Canonicalization bodyCanonicalization = Canonicalization.SIMPLE;
        private List<String> signedHeaders = Collections.emptyList();
        private String bodyHash;
        private String identity;
        private long bodyLength = -1;
        private long timestamp = -1;
        private long expiration = -1;
        private List<String> copiedHeaders = Collections.emptyList();

        /**
         * Creates a builder.
         *
         * @param algorithm the signing algorithm
         * @param domain the signing domain ({@code d=})
         * @param selector the selector ({@code s=})
         */
        public Builder(SignatureAlgorithm algorithm, String domain, String selector) {
            this.algorithm = algorithm;
            this.domain = domain;
            this.selector = selector;
        }

        public Builder canonicalization(Canonicalization header, Canonicalization body) {
            this.headerCanonicalization = header;
            this.bodyCanonicalization = body;
            return this;
        }

        public Builder signedHeaders(List<String> names) {
            this.signedHeaders = new ArrayList<String>(names);
            return this;
        }

        public Builder bodyHash(byte[] hash) {
            this.bodyHash = Base64.getEncoder().encodeToString(hash);
            return this;
        }

        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        public Builder bodyLength(long length) {
            this.bodyLength = length;
            return this;
        }

        public Builder timestamp(long seconds) {
            this.timestamp = seconds;
            return this;
        }

        public Builder expiration(long seconds) {
            this.expiration = seconds;
            return this;
        }

        /**
         * Sets the header fields to copy into {@code z=}, each given as
         * {@code name:value}.
         *
         * @param fields the header fields
         * @return this builder
         */
        public Builder copiedHeaders(List<String> fields) {
            this.copiedHeaders = new ArrayList<String>(fields);
            return this;
        }

        /**
         * Serializes the tags into a header value ending in an empty
         * {@code b=} tag.
         *
         * @return the header value
         */
        public String toHeaderValue() {
            StringBuilder sb = new StringBuilder();
            sb.append("v=1; a=").append(algorithm.getValue());
            sb.append("; c=").append(headerCanonicalization.getValue())
                    .append('/').append(bodyCanonicalization.getValue());
            sb.append("; d=").append(domain);
            sb.append("; s=").append(selector);
            if (identity != null) {
                sb.append("; i=").append(identity);
            }
            if (bodyLength >= 0) {
                sb.append("; l=").append(bodyLength);
            }
            if (timestamp >= 0) {
                sb.append("; t=").append(timestamp);
            }
            if (expiration >= 0) {
                sb.append("; x=").append(expiration);
            }
            sb.append("; h=");
            for (int i = 0; i < signedHeaders.size(); i++) {
                if (i > 0) {
                    sb.append(':');
                }
                sb.append(signedHeaders.get(i).toLowerCase(Locale.ROOT));
            }
            sb.append("; bh=").append(bodyHash);
            if (!copiedHeaders.isEmpty()) {
                sb.append("; z=");
                for (int i = 0; i < copiedHeaders.size(); i++) {
                    if (i > 0) {
                        sb.append('|');
                    }
                    String field = copiedHeaders.get(i);
                    int colonPos = field.indexOf(':');
                    sb.append(field.substring(0, colonPos + 1));
                    sb.append(encodeQuotedPrintable(field.substring(colonPos + 1)));
                }
            }
            sb.append("; b=");
            return sb.toString();
        }

        /**
         * Builds the unsigned signature, validating it exactly as a
         * verifier would, except that {@code b=} is empty.
         *
         * @return the unsigned signature
         * @throws DKIMSignatureException if the settings do not form a
         *         valid signature
         */
        public DKIMSignature build() throws DKIMSignatureException {
            if (bodyHash == null) {
                throw error("err.sig_missing_tag", "bh");
            }
            TagList tags;
            try {
                tags = TagList.parse(toHeaderValue());
            } catch (ParseException e) {
                throw new DKIMSignatureException(e.getMessage(), e);
            }
            return new DKIMSignature(tags, true);
        }

    }

}
