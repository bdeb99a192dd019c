/*
 * DKIMVerification.java
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

import java.security.PublicKey;
import java.util.List;
import java.util.Locale;

/**
 * The outcome of verifying one DKIM signature.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DKIMVerification {

    private final DKIMResult result;
    private final DKIMFailure failure;
    private final String detail;
    private final DKIMSignature signature;
    private final DKIMPublicKey keyRecord;
    private final PublicKey publicKey;

    private DKIMVerification(DKIMResult result, DKIMFailure failure, String detail,
                             DKIMSignature signature, DKIMPublicKey keyRecord,
                             PublicKey publicKey) {
        this.result = result;
        this.failure = failure;
        this.detail = detail;
        this.signature = signature;
        this.keyRecord = keyRecord;
        this.publicKey = publicKey;
    }

    static DKIMVerification pass(DKIMSignature signature, DKIMPublicKey keyRecord,
                                 PublicKey publicKey) {
        return new DKIMVerification(DKIMResult.PASS, null, null, signature, keyRecord, publicKey);
    }

    static DKIMVerification fail(DKIMFailure failure, String detail, DKIMSignature signature,
                                 DKIMPublicKey keyRecord) {
        return new DKIMVerification(failure.getResult(), failure, detail, signature, keyRecord, null);
    }

    public DKIMResult getResult() {
        return result;
    }

    /**
     * Returns why the signature did not verify.
     *
     * @return the failure kind, or null if the signature passed
     */
    public DKIMFailure getFailure() {
        return failure;
    }

    /**
     * Returns a human-readable description of the failure.
     *
     * @return the detail text, or null if the signature passed
     */
    public String getDetail() {
        return detail;
    }

    /**
     * Returns the parsed signature.
     *
     * @return the signature, or null if the header could not be parsed
     */
    public DKIMSignature getSignature() {
        return signature;
    }

    public String getDomain() {
        return (signature == null) ? null : signature.getDomain();
    }

    public String getSelector() {
        return (signature == null) ? null : signature.getSelector();
    }

    /**
     * Returns the key record the signature was checked against.
     *
     * @return the key record, or null if none was retrieved
     */
    public DKIMPublicKey getKeyRecord() {
        return keyRecord;
    }

    /**
     * Returns the public key that verified the signature.
     *
     * @return the key, or null unless the signature passed
     */
    public PublicKey getPublicKey() {
        return publicKey;
    }

    public boolean isPass() {
        return result == DKIMResult.PASS;
    }

    /**
     * Returns whether the signing domain is testing DKIM ({@code t=y} in
     * its key record). Receivers should not treat such a failure
     * differently from an unsigned message.
     *
     * @return true if the key record has the testing flag
     */
    public boolean isTesting() {
        return keyRecord != null && keyRecord.isTesting();
    }

    /**
     * Formats this result as an Authentication-Results method result
     * (RFC 8601), for example
     * {@code dkim=pass header.d=example.com header.s=sel header.b=AbCdEfGh}.
     *
     * @return the method result text
     */
    public String toAuthenticationResults() {
        StringBuilder sb = new StringBuilder("dkim=");
        sb.append(result.getValue());
        if (failure != null) {
            sb.append(" (").append(failure.name().toLowerCase(Locale.ROOT).replace('_', ' '));
            if (isTesting()) {
                sb.append(", testing");
            }
            sb.append(')');
        }
        if (signature != null) {
            sb.append(" header.d=").append(signature.getDomain());
            sb.append(" header.s=").append(signature.getSelector());
            String b = signature.getSignature();
            if (!b.isEmpty()) {
                sb.append(" header.b=").append(b.length() > 8 ? b.substring(0, 8) : b);
            }
        }
        return sb.toString();
    }

    /**
     * Returns whether any signature of a message passed.
     *
     * @param verifications the per-signature results
     * @return true if at least one result is PASS
     */
    public static boolean anyPass(List<DKIMVerification> verifications) {
        for (int i = 0; i < verifications.size(); i++) {
            if (verifications.get(i).isPass()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return toAuthenticationResults();
    }

}
