/*
 * DKIMCallback.java
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
 * Callback interface for asynchronous DKIM verification results.
 *
 * <p>Verification is non-blocking: the callback is invoked once, when
 * every signature of the message has been evaluated, which requires
 * fetching the public keys from DNS. It may be invoked on a resolver or
 * timer thread.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DKIMVerifier
 */
public interface DKIMCallback {

    /**
     * Called when verification of a message completes.
     *
     * @param results one result per DKIM-Signature header, in the order the
     *        headers appear in the message; empty if the message is unsigned
     */
    void dkimResults(List<DKIMVerification> results);

}
