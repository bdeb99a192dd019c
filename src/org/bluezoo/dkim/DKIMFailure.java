/*
 * DKIMFailure.java
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
 * The specific reason a signature did not verify.
 *
 * <p>Every failed {@link DKIMVerification} carries exactly one of these.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public enum DKIMFailure {

    /** The DKIM-Signature header field is malformed or invalid. */
    PARSE_ERROR(DKIMResult.PERMERROR),

    /** No key record exists at the selector (NXDOMAIN or no TXT record). */
    KEY_NOT_FOUND(DKIMResult.PERMERROR),

    /** The key lookup timed out or the DNS server failed; retryable. */
    KEY_DNS_FAILURE(DKIMResult.TEMPERROR),

    /** The key record or its key material cannot be parsed. */
    KEY_MALFORMED(DKIMResult.PERMERROR),

    /** The key record has an empty {@code p=} tag. */
    KEY_REVOKED(DKIMResult.PERMERROR),

    /** The key type or the key's hash allow-list does not permit the signature's algorithm. */
    KEY_ALGORITHM_MISMATCH(DKIMResult.PERMERROR),

    /**
     * The key may not be used for this signature: wrong service type,
     * strict identity flag violated, or an RSA key that is too short.
     */
    KEY_INAPPLICABLE(DKIMResult.PERMERROR),

    /** The signature expiration time ({@code x=}) has passed. */
    EXPIRED(DKIMResult.FAIL),

    /** The computed body hash does not match {@code bh=}. */
    BODY_HASH_MISMATCH(DKIMResult.FAIL),

    /** The cryptographic signature {@code b=} does not verify. */
    SIGNATURE_INVALID(DKIMResult.FAIL);

    private final DKIMResult result;

    DKIMFailure(DKIMResult result) {
        this.result = result;
    }

    /**
     * Returns the Authentication-Results value for this failure.
     *
     * @return the result
     */
    public DKIMResult getResult() {
        return result;
    }

    /**
     * Returns whether verifying again later may give a different outcome.
     *
     * @return true only for DNS failures
     */
    public boolean isRetryable() {
        return this == KEY_DNS_FAILURE;
    }

}
