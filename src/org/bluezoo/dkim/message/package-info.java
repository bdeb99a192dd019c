/*
 * package-info.java
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

/**
 * A minimal RFC 5322 message model that keeps header fields exactly as
 * they were received.
 *
 * <p>DKIM hashes header fields byte for byte, so
 * {@link org.bluezoo.dkim.message.RawHeader} never decodes or refolds
 * anything. Line ending repair is an explicit choice made when parsing,
 * see {@link org.bluezoo.dkim.message.LineEndings}.
 */
package org.bluezoo.dkim.message;
