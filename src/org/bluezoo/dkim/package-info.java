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
 * DomainKeys Identified Mail (DKIM) signing and verification, as defined
 * by RFC 6376, with Ed25519 keys (RFC 8463) and the algorithm updates of
 * RFC 8301.
 *
 * <h2>Verification</h2>
 *
 * <p>{@link org.bluezoo.dkim.DKIMVerifier} verifies every DKIM-Signature
 * header of a {@link org.bluezoo.dkim.message.Message} independently.
 * Public keys are retrieved asynchronously from DNS, and the results are
 * delivered once, in header order, to a
 * {@link org.bluezoo.dkim.DKIMCallback}:
 *
 * <pre><code>
 * DKIMVerifier verifier = new DKIMVerifier(
 *         new CachingTXTResolver(new DnsJavaTXTResolver()));
 * verifier.verify(Message.parse(bytes), new DKIMCallback() {
 *     &#64;Override
 *     public void dkimResults(List&lt;DKIMVerification&gt; results) {
 *         for (DKIMVerification result : results) {
 *             String ar = result.toAuthenticationResults();
 *             // dkim=pass header.d=example.com header.s=mail ...
 *         }
 *     }
 * });
 * </code></pre>
 *
 * <p>Each {@link org.bluezoo.dkim.DKIMVerification} carries a
 * {@link org.bluezoo.dkim.DKIMResult} and, unless it passed, the
 * {@link org.bluezoo.dkim.DKIMFailure} that explains why. Verification
 * itself never throws.
 *
 * <h2>Signing</h2>
 *
 * <p>{@link org.bluezoo.dkim.DKIMSigner} creates the DKIM-Signature header
 * field for a message with an RSA or Ed25519 private key. The matching
 * key record to publish in DNS is produced by
 * {@link org.bluezoo.dkim.DKIMPublicKey#format(java.security.PublicKey)}.
 *
 * <h2>Localization</h2>
 *
 * <p>Error and log messages are read from the {@code L10N} resource
 * bundle of each package.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc6376">RFC 6376</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc8463">RFC 8463</a>
 * @see <a href="https://www.rfc-editor.org/rfc/rfc8301">RFC 8301</a>
 */
package org.bluezoo.dkim;
