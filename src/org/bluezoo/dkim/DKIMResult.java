/*
 * DKIMResult.java
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

import java.util.List;

/**
 * DKIM verification result as reported in Authentication-Results
 * (RFC 8601 section 2.7.1).
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc6376">RFC 6376 - DKIM</a>
 */
public enum DKIMResult {

    /**
     * The message signature was verified successfully.
     * The signature cryptographically matches and the public key was found.
     */
    PASS("pass"),

    /**
     * The message signature verification failed.
     * The signature does not match the message content, or has expired.
     */
    FAIL("fail"),

    /**
     * No DKIM signature was found in the message.
     */
    NONE("none"),

    /**
     * The public key could not be retrieved (DNS error).
     * Trying again later may succeed.
     */
    TEMPERROR("temperror"),

    /**
     * The signature or public key has a permanent problem.
     * This includes malformed signatures, revoked keys, or unsupported algorithms.
     */
    PERMERROR("permerror");

    private final String value;

    DKIMResult(String value) {
        this.value = value;
    }

    /**
     * Returns the lowercase string representation for Authentication-Results.
     *
     * @return the result value string
     */
    public String getValue() {
        return value;
    }

    /**
     * Combines the per-signature results of one message into a single
     * value, for callers that need one.
     *
     * <p>PASS if any signature passed; NONE if there were no signatures;
     * otherwise FAIL, TEMPERROR, PERMERROR in that order of precedence.
     *
     * @param verifications the per-signature results
     * @return the combined result
     */
    public static DKIMResult summarize(List<DKIMVerification> verifications) {
        if (verifications.isEmpty()) {
            return NONE;
        }
        boolean fail = false;
        boolean temperror = false;
        for (int i = 0; i < verifications.size(); i++) {
            DKIMResult result = verifications.get(i).getResult();
            if (result == PASS) {
                return PASS;
            } else if (result == FAIL) {
                fail = true;
            } else if (result == TEMPERROR) {
                temperror = true;
            }
        }
        if (fail) {
            return FAIL;
        }
        return temperror ? TEMPERROR : PERMERROR;
    }

    @Override
    public String toString() {
        return value;
    }

}
