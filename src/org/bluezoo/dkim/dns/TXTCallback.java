/*
 * TXTCallback.java
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

import java.util.List;

/**
 * Callback interface for asynchronous TXT lookups.
 *
 * <p>Exactly one method is called per lookup.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 * @see TXTResolver
 */
public interface TXTCallback {

    /**
     * Called when the name has one or more TXT records.
     *
     * @param records the records in response order, each as the list of
     *        its character-strings
     */
    void onRecords(List<List<String>> records);

    /**
     * Called when the name does not exist or has no TXT records.
     */
    void onNotFound();

    /**
     * Called when the lookup fails due to timeout, server failure or
     * network error.
     *
     * @param error a description of the error
     */
    void onError(String error);

}
