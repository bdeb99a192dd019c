/*
 * KeyCallback.java
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

package org.bluezoo.dkim.dns;

import org.bluezoo.dkim.DKIMKeyException;
import org.bluezoo.dkim.DKIMPublicKey;

/**
 * Callback interface for asynchronous DKIM key retrieval.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see DKIMKeyResolver
 */
public interface KeyCallback {

    /**
     * Called with the selected key record, which is never revoked.
     *
     * @param key the key record
     */
    void keyResolved(DKIMPublicKey key);

    /**
     * Called when no usable key record could be retrieved.
     *
     * @param error the failure, whose {@link DKIMKeyException#getFailure()}
     *        is one of the KEY_ kinds
     */
    void keyFailed(DKIMKeyException error);

}
