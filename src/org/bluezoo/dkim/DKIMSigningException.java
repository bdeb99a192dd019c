/*
 * DKIMSigningException.java
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
 * A message could not be signed.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DKIMSigner
 */
public class DKIMSigningException extends DKIMException {

    private static final long serialVersionUID = 1L;

    /**
     * Why signing was refused.
     */
    public enum Reason {

        /** The requested algorithm may not be used for signing, e.g. SHA-1. */
        UNSUPPORTED_ALGORITHM,

        /** The private key was rejected by the cryptographic provider. */
        KEY_ERROR,

        /** The signer settings are incomplete or inconsistent. */
        INVALID_CONFIGURATION

    }

    private final Reason reason;

    public DKIMSigningException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DKIMSigningException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

}
