/*
 * Canonicalization.java
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

/**
 * DKIM canonicalization algorithm as defined in RFC 6376 section 3.4.
 *
 * <p>Header and body canonicalization are chosen independently and
 * appear in the {@code c=} tag as {@code header/body}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see Canonicalizer
 */
public enum Canonicalization {

    /**
     * Tolerates almost no modification of the message.
     */
    SIMPLE("simple"),

    /**
     * Tolerates common modifications such as whitespace replacement and
     * header field line rewrapping.
     */
    RELAXED("relaxed");

    private final String value;

    Canonicalization(String value) {
        this.value = value;
    }

    /**
     * Returns the name used in the {@code c=} tag.
     *
     * @return the tag value
     */
    public String getValue() {
        return value;
    }

    /**
     * Returns the algorithm for a {@code c=} tag component.
     *
     * @param value the name, case-insensitive
     * @return the algorithm, or null if not recognised
     */
    public static Canonicalization forValue(String value) {
        for (Canonicalization c : values()) {
            if (c.value.equalsIgnoreCase(value)) {
                return c;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return value;
    }

}
