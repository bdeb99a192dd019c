/*
 * TagList.java
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

import java.text.MessageFormat;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ResourceBundle;

/**
 * A parsed DKIM tag list (RFC 6376 section 3.2), the {@code tag=value;}
 * syntax shared by DKIM-Signature header fields and key records.
 *
 * <p>Tags are kept in the order they appear. When a tag name occurs more
 * than once the first occurrence wins; later ones are recorded in
 * {@link #getDuplicates()} and otherwise ignored. Unknown tags are kept.
 *
 * <p>Each tag remembers where its value lies in the original text, so
 * that a value can be cut out again without disturbing any other byte.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class TagList {

    static final ResourceBundle L10N = ResourceBundle.getBundle("org.bluezoo.dkim.L10N");

    /**
     * A single tag-spec.
     */
    public static final class Tag {

        private final String name;
        private final String rawValue;
        private final int valueStart;
        private final int valueEnd;

        Tag(String name, String rawValue, int valueStart, int valueEnd) {
            this.name = name;
            this.rawValue = rawValue;
            this.valueStart = valueStart;
            this.valueEnd = valueEnd;
        }

        public String getName() {
            return name;
        }

        /**
         * Returns the value exactly as written, including whitespace and
         * folding.
         *
         * @return the raw value
         */
        public String getRawValue() {
            return rawValue;
        }

        /**
         * Returns the value unfolded, with leading and trailing whitespace
         * removed.
         *
         * @return the value
         */
        public String getValue() {
            return unfold(rawValue).trim();
        }

        /**
         * Returns the value with all whitespace removed, the form used for
         * base64 data and token lists.
         *
         * @return the value without whitespace
         */
        public String getCompactValue() {
            return removeWhitespace(rawValue);
        }

        /** Offset of the first character after the '='. */
        int getValueStart() {
            return valueStart;
        }

        /** Offset of the terminating ';', or the end of the text. */
        int getValueEnd() {
            return valueEnd;
        }

    }

    private final String text;
    private final List<Tag> tags;
    private final List<String> duplicates;

    private TagList(String text, List<Tag> tags, List<String> duplicates) {
        this.text = text;
        this.tags = Collections.unmodifiableList(tags);
        this.duplicates = Collections.unmodifiableList(duplicates);
    }

    /**
     * Parses a tag list.
     *
     * @param text the tag list text, possibly folded
     * @return the tag list
     * @throws ParseException if a tag-spec has no '=' or an invalid tag name
     */
    public static TagList parse(String text) throws ParseException {
        List<Tag> tags = new ArrayList<Tag>();
        List<String> duplicates = new ArrayList<String>();
        int pos = 0;
        int length = text.length();
        while (pos < length) {
            int semi = text.indexOf(';', pos);
            int end = (semi < 0) ? length : semi;
            if (!isBlank(text, pos, end)) {
                int eq = text.indexOf('=', pos);
                if (eq < 0 || eq >= end) {
                    String message = MessageFormat.format(L10N.getString("err.tag_no_equals"),
                            unfold(text.substring(pos, end)).trim());
                    throw new ParseException(message, pos);
                }
                String name = unfold(text.substring(pos, eq)).trim();
                if (!isValidTagName(name)) {
                    String message = MessageFormat.format(L10N.getString("err.tag_bad_name"), name);
                    throw new ParseException(message, pos);
                }
                Tag tag = new Tag(name, text.substring(eq + 1, end), eq + 1, end);
                if (find(tags, name) != null) {
                    duplicates.add(name);
                } else {
                    tags.add(tag);
                }
            }
            if (semi < 0) {
                break;
            }
            pos = semi + 1;
        }
        return new TagList(text, tags, duplicates);
    }

    /**
     * Returns the text this list was parsed from.
     *
     * @return the original text
     */
    public String getText() {
        return text;
    }

    /**
     * Returns the tags in order of first appearance.
     *
     * @return an unmodifiable list of tags
     */
    public List<Tag> getTags() {
        return tags;
    }

    /**
     * Returns the names of tags that occurred more than once, once for
     * each ignored repetition.
     *
     * @return an unmodifiable list of tag names
     */
    public List<String> getDuplicates() {
        return duplicates;
    }

    /**
     * Returns the tag with the given name.
     *
     * @param name the tag name (case-sensitive, as RFC 6376 requires)
     * @return the first tag with this name, or null
     */
    public Tag getTag(String name) {
        return find(tags, name);
    }

    /**
     * Returns whether a tag is present.
     *
     * @param name the tag name
     * @return true if present
     */
    public boolean contains(String name) {
        return find(tags, name) != null;
    }

    /**
     * Returns the unfolded, trimmed value of a tag.
     *
     * @param name the tag name
     * @return the value, or null if the tag is absent
     */
    public String getValue(String name) {
        Tag tag = find(tags, name);
        return (tag == null) ? null : tag.getValue();
    }

    /**
     * Returns the value of a tag with all whitespace removed.
     *
     * @param name the tag name
     * @return the value, or null if the tag is absent
     */
    public String getCompactValue(String name) {
        Tag tag = find(tags, name);
        return (tag == null) ? null : tag.getCompactValue();
    }

    /**
     * Returns the original text with the value of one tag deleted,
     * including any whitespace around it. The tag name and '=' remain.
     *
     * @param name the tag name
     * @return the modified text, or the original text if the tag is absent
     */
    public String withoutValue(String name) {
        Tag tag = find(tags, name);
        if (tag == null) {
            return text;
        }
        return text.substring(0, tag.getValueStart()) + text.substring(tag.getValueEnd());
    }

    /**
     * Splits a colon-separated list value into trimmed elements.
     *
     * @param value the list value
     * @return the elements, empty elements included
     */
    static List<String> splitList(String value) {
        List<String> result = new ArrayList<String>();
        int start = 0;
        for (int i = 0; i <= value.length(); i++) {
            if (i == value.length() || value.charAt(i) == ':') {
                result.add(unfold(value.substring(start, i)).trim());
                start = i + 1;
            }
        }
        return result;
    }

    private static Tag find(List<Tag> tags, String name) {
        for (int i = 0; i < tags.size(); i++) {
            Tag tag = tags.get(i);
            if (tag.name.equals(name)) {
                return tag;
            }
        }
        return null;
    }

    /**
     * tag-name = ALPHA *ALNUMPUNC, where ALNUMPUNC is ALPHA / DIGIT / "_".
     */
    private static boolean isValidTagName(String name) {
        if (name.isEmpty() || !isAlpha(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isAlpha(c) && !(c >= '0' && c <= '9') && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isBlank(String s, int start, int end) {
        for (int i = start; i < end; i++) {
            if (!isWhitespace(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\n';
    }

    /**
     * Removes line breaks and reduces whitespace runs to a single space.
     */
    static String unfold(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean prevSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\r' || c == '\n') {
                continue;
            }
            if (c == ' ' || c == '\t') {
                if (!prevSpace) {
                    sb.append(' ');
                    prevSpace = true;
                }
            } else {
                sb.append(c);
                prevSpace = false;
            }
        }
        return sb.toString();
    }

    static String removeWhitespace(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (!isWhitespace(c)) {
                sb.append(c);
            }
        }
        return sb.toString();
    }

}
