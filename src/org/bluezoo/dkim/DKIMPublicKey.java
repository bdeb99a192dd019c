/*
 * DKIMPublicKey.java
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

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.spec.InvalidKeySpecException;
import java.text.MessageFormat;
import java.text.ParseException;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.ResourceBundle;

/**
 * A DKIM key record published in DNS (RFC 6376 section 3.6.1).
 *
 * <p>A record with an empty {@code p=} tag is a revoked key. Revocation
 * is a state of a well-formed record, not a parse error; see
 * {@link #isRevoked()}.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public final class DKIMPublicKey {

    private static final ResourceBundle L10N = TagList.L10N;

    /** Service type for email. */
    public static final String SERVICE_EMAIL = "email";

    private final TagList tags;
    private final String keyTypeName;
    private final KeyType keyType;
    private final List<String> hashAlgorithms;
    private final List<String> serviceTypes;
    private final List<String> flags;
    private final String notes;
    private final byte[] keyData;

    private DKIMPublicKey(TagList tags, String keyTypeName, List<String> hashAlgorithms,
                          List<String> serviceTypes, List<String> flags, byte[] keyData) {
        this.tags = tags;
        this.keyTypeName = keyTypeName;
        this.keyType = KeyType.forValue(keyTypeName);
        this.hashAlgorithms = hashAlgorithms;
        this.serviceTypes = serviceTypes;
        this.flags = flags;
        this.notes = tags.getValue("n");
        this.keyData = keyData;
    }

    /**
     * Parses a key record.
     *
     * @param record the TXT record text, all strings concatenated
     * @return the key record
     * @throws DKIMKeyException with {@link DKIMFailure#KEY_MALFORMED} if the
     *         record is not a valid DKIM key record
     */
    public static DKIMPublicKey parse(String record) throws DKIMKeyException {
        TagList tags;
        try {
            tags = TagList.parse(record);
        } catch (ParseException e) {
            throw new DKIMKeyException(DKIMFailure.KEY_MALFORMED, e.getMessage(), e);
        }

        // v=, if present, must be the first tag
        List<TagList.Tag> list = tags.getTags();
        for (int i = 0; i < list.size(); i++) {
            TagList.Tag tag = list.get(i);
            if ("v".equals(tag.getName())) {
                if (i != 0) {
                    throw malformed("err.key_version_position");
                }
                if (!"DKIM1".equals(tag.getCompactValue())) {
                    throw malformed("err.key_version", tag.getValue());
                }
            }
        }

        String p = tags.getCompactValue("p");
        if (p == null) {
            throw malformed("err.key_missing_p");
        }
        byte[] keyData;
        try {
            keyData = Base64.getDecoder().decode(p);
        } catch (IllegalArgumentException e) {
            throw new DKIMKeyException(DKIMFailure.KEY_MALFORMED, message("err.key_base64"), e);
        }

        String k = tags.getCompactValue("k");
        String keyTypeName = (k == null || k.isEmpty()) ? KeyType.RSA.getValue() : k.toLowerCase(Locale.ROOT);

        String h = tags.getValue("h");
        List<String> hashAlgorithms = (h == null) ? Collections.<String>emptyList()
                : Collections.unmodifiableList(TagList.splitList(h));

        String s = tags.getValue("s");
        List<String> serviceTypes = (s == null) ? Collections.singletonList("*")
                : Collections.unmodifiableList(TagList.splitList(s));

        String t = tags.getValue("t");
        List<String> flags = (t == null) ? Collections.<String>emptyList()
                : Collections.unmodifiableList(TagList.splitList(t));

        return new DKIMPublicKey(tags, keyTypeName, hashAlgorithms, serviceTypes, flags, keyData);
    }

    /**
     * Formats the key record to publish for a public key.
     *
     * @param key an RSA or Ed25519 public key
     * @return the record text, e.g. {@code v=DKIM1; k=rsa; p=MIIB...}
     * @throws InvalidKeySpecException if DKIM has no key type for the key
     */
    public static String format(PublicKey key) throws InvalidKeySpecException {
        KeyType type = KeyType.forKey(key);
        if (type == null) {
            throw new InvalidKeySpecException(message("err.key_type_unknown", key.getAlgorithm()));
        }
        byte[] data = type.encodePublicKey(key);
        return "v=DKIM1; k=" + type.getValue() + "; p=" + Base64.getEncoder().encodeToString(data);
    }

    public TagList getTags() {
        return tags;
    }

    /**
     * Returns the {@code k=} value, lower-cased.
     *
     * @return the key type name, "rsa" if absent
     */
    public String getKeyTypeName() {
        return keyTypeName;
    }

    /**
     * Returns the key type.
     *
     * @return the key type, or null if {@code k=} names a type this
     *         library does not know
     */
    public KeyType getKeyType() {
        return keyType;
    }

    /**
     * Returns whether the key has been revoked (empty {@code p=}).
     *
     * @return true if revoked
     */
    public boolean isRevoked() {
        return keyData.length == 0;
    }

    /**
     * Returns the decoded {@code p=} data.
     *
     * @return the key data, empty if revoked
     */
    public byte[] getKeyData() {
        return keyData.clone();
    }

    /**
     * Returns the acceptable hash algorithms of {@code h=}.
     *
     * @return the names, empty if all algorithms are allowed
     */
    public List<String> getHashAlgorithms() {
        return hashAlgorithms;
    }

    /**
     * Returns whether the key may be used with a hash algorithm.
     *
     * @param algorithm the hash algorithm
     * @return true if {@code h=} is absent or lists the algorithm
     */
    public boolean allowsHashAlgorithm(HashAlgorithm algorithm) {
        if (hashAlgorithms.isEmpty()) {
            return true;
        }
        for (int i = 0; i < hashAlgorithms.size(); i++) {
            if (algorithm.getValue().equalsIgnoreCase(hashAlgorithms.get(i))) {
                return true;
            }
        }
        return false;
    }

    public List<String> getServiceTypes() {
        return serviceTypes;
    }

    /**
     * Returns whether the key may be used for a service.
     *
     * @param service the service type, normally {@link #SERVICE_EMAIL}
     * @return true if {@code s=} lists the service or "*"
     */
    public boolean allowsService(String service) {
        for (int i = 0; i < serviceTypes.size(); i++) {
            String type = serviceTypes.get(i);
            if ("*".equals(type) || service.equalsIgnoreCase(type)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getFlags() {
        return flags;
    }

    /**
     * Returns whether the domain is testing DKIM ({@code t=y}).
     *
     * @return true if the testing flag is set
     */
    public boolean isTesting() {
        return flags.contains("y");
    }

    /**
     * Returns whether the {@code i=} domain of signatures must equal
     * {@code d=} exactly ({@code t=s}).
     *
     * @return true if the strict flag is set
     */
    public boolean isStrict() {
        return flags.contains("s");
    }

    /**
     * Returns the human-readable notes ({@code n=}).
     *
     * @return the notes, or null
     */
    public String getNotes() {
        return notes;
    }

    /**
     * Decodes the key material.
     *
     * @return the public key
     * @throws DKIMKeyException with {@link DKIMFailure#KEY_REVOKED} if the
     *         key is revoked, {@link DKIMFailure#KEY_ALGORITHM_MISMATCH} if
     *         the key type is unknown, or {@link DKIMFailure#KEY_MALFORMED}
     *         if the data is not a key of its type
     */
    public PublicKey toPublicKey() throws DKIMKeyException {
        if (isRevoked()) {
            throw new DKIMKeyException(DKIMFailure.KEY_REVOKED, message("err.key_revoked"));
        }
        if (keyType == null) {
            throw new DKIMKeyException(DKIMFailure.KEY_ALGORITHM_MISMATCH,
                    message("err.key_type_unknown", keyTypeName));
        }
        try {
            return keyType.decodePublicKey(keyData);
        } catch (GeneralSecurityException e) {
            throw new DKIMKeyException(DKIMFailure.KEY_MALFORMED,
                    message("err.key_data", keyTypeName), e);
        }
    }

    @Override
    public String toString() {
        return tags.getText();
    }

    private static String message(String key, Object... args) {
        return MessageFormat.format(L10N.getString(key), args);
    }

    private static DKIMKeyException malformed(String key, Object... args) {
        return new DKIMKeyException(DKIMFailure.KEY_MALFORMED, message(key, args));
    }

}
