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
 * DKIM key retrieval.
 *
 * <p>{@link org.bluezoo.dkim.dns.DKIMKeyResolver} turns TXT lookups into
 * key records, applying a timeout and a record selection policy. The
 * lookups themselves go through the
 * {@link org.bluezoo.dkim.dns.TXTResolver} capability, implemented by
 * {@link org.bluezoo.dkim.dns.DnsJavaTXTResolver} on top of dnsjava and
 * optionally wrapped in a {@link org.bluezoo.dkim.dns.CachingTXTResolver}.
 * Tests and applications with their own DNS stack supply their own
 * implementation.
 */
package org.bluezoo.dkim.dns;
