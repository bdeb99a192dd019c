/*
 * DKIMException.java
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

/**
 * Base class for DKIM errors.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DKIMException extends Exception {

    private static final long serialVersionUID = 1L;

    public DKIMException(String message) {
        super(message);
    }

    public DKIMException(String message, Throwable cause) {
        super(message, cause);
    }

}
