/*
 * DKIMPublicKeyTest.java
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

import org.junit.BeforeClass;
import org.junit.Test;
import static org.junit.Assert.*;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Base64;

/**
 * Unit tests for DKIM key record parsing.
 */
public class DKIMPublicKeyTest {

    /** Ed25519 key from RFC 8463 appendix A.2. */
    private static final String RFC8463_KEY = "11qYAYKxCrfVS/7TyWQHOg7hcvPapiMlrwIaaPcHURo=";

    private static KeyPair rsaKeyPair;
    private static KeyPair ed25519KeyPair;

    @BeforeClass
    public static void generateKeys() throws Exception {
        KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
        rsa.initialize(1024);
        rsaKeyPair = rsa.generateKeyPair();
        ed25519KeyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    private static String rsaKeyData() {
        return Base64.getEncoder().encodeToString(rsaKeyPair.getPublic().getEncoded());
    }

    @Test
    public void testParseRsaRecord() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("v=DKIM1; k=rsa; p=" + rsaKeyData());

        assertEquals("rsa", key.getKeyTypeName());
        assertEquals(KeyType.RSA, key.getKeyType());
        assertFalse(key.isRevoked());
        assertFalse(key.isTesting());
        assertFalse(key.isStrict());
        assertTrue(key.allowsHashAlgorithm(HashAlgorithm.SHA256));
        assertTrue(key.allowsHashAlgorithm(HashAlgorithm.SHA1));
        assertTrue(key.allowsService("email"));
        assertEquals(rsaKeyPair.getPublic(), key.toPublicKey());
    }

    @Test
    public void testDefaults() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("p=" + rsaKeyData());
        assertEquals(KeyType.RSA, key.getKeyType());
        assertEquals(Arrays.asList("*"), key.getServiceTypes());
        assertTrue(key.getHashAlgorithms().isEmpty());
        assertTrue(key.getFlags().isEmpty());
        assertNull(key.getNotes());
    }

    @Test
    public void testFoldedKeyData() throws DKIMKeyException {
        String data = rsaKeyData();
        String record = "v=DKIM1; p=" + data.substring(0, 40) + " \t" + data.substring(40);
        DKIMPublicKey key = DKIMPublicKey.parse(record);
        assertEquals(rsaKeyPair.getPublic(), key.toPublicKey());
    }

    @Test
    public void testParseRawEd25519Record() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("v=DKIM1; k=ed25519; p=" + RFC8463_KEY);
        assertEquals(KeyType.ED25519, key.getKeyType());
        assertEquals(32, key.getKeyData().length);
        PublicKey publicKey = key.toPublicKey();
        assertEquals(KeyType.ED25519, KeyType.forKey(publicKey));
    }

    @Test
    public void testParseSpkiEd25519Record() throws DKIMKeyException {
        String data = Base64.getEncoder().encodeToString(ed25519KeyPair.getPublic().getEncoded());
        DKIMPublicKey key = DKIMPublicKey.parse("v=DKIM1; k=ed25519; p=" + data);
        assertEquals(ed25519KeyPair.getPublic(), key.toPublicKey());
    }

    @Test
    public void testRevokedKey() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("v=DKIM1; k=rsa; p=");
        assertTrue(key.isRevoked());
        try {
            key.toPublicKey();
            fail("Revoked key decoded");
        } catch (DKIMKeyException e) {
            assertEquals(DKIMFailure.KEY_REVOKED, e.getFailure());
        }
    }

    @Test
    public void testFlagsAndRestrictions() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("v=DKIM1; h=sha256; s=email; t=y:s; n=Test key; p="
                + rsaKeyData());
        assertTrue(key.isTesting());
        assertTrue(key.isStrict());
        assertTrue(key.allowsHashAlgorithm(HashAlgorithm.SHA256));
        assertFalse(key.allowsHashAlgorithm(HashAlgorithm.SHA1));
        assertTrue(key.allowsService("email"));
        assertEquals("Test key", key.getNotes());
    }

    @Test
    public void testServiceRestriction() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("s=other; p=" + rsaKeyData());
        assertFalse(key.allowsService(DKIMPublicKey.SERVICE_EMAIL));
    }

    @Test
    public void testUnknownKeyType() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("k=dsa; p=" + rsaKeyData());
        assertEquals("dsa", key.getKeyTypeName());
        assertNull(key.getKeyType());
        try {
            key.toPublicKey();
            fail("Unknown key type decoded");
        } catch (DKIMKeyException e) {
            assertEquals(DKIMFailure.KEY_ALGORITHM_MISMATCH, e.getFailure());
        }
    }

    @Test
    public void testUndecodableKeyData() throws DKIMKeyException {
        DKIMPublicKey key = DKIMPublicKey.parse("k=rsa; p=YWJjZGVm");
        try {
            key.toPublicKey();
            fail("Garbage key decoded");
        } catch (DKIMKeyException e) {
            assertEquals(DKIMFailure.KEY_MALFORMED, e.getFailure());
        }
    }

    private static void assertMalformed(String record) {
        try {
            DKIMPublicKey.parse(record);
            fail("Expected malformed record: " + record);
        } catch (DKIMKeyException e) {
            assertEquals(DKIMFailure.KEY_MALFORMED, e.getFailure());
        }
    }

    @Test
    public void testMalformedRecords() {
        assertMalformed("v=DKIM1; k=rsa");
        assertMalformed("v=DKIM2; p=" + rsaKeyData());
        assertMalformed("k=rsa; v=DKIM1; p=" + rsaKeyData());
        assertMalformed("v=DKIM1; p=@@@@");
        assertMalformed("v=DKIM1; garbage; p=" + rsaKeyData());
        assertMalformed("");
    }

    @Test
    public void testFormatRsa() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic());
        assertTrue(record.startsWith("v=DKIM1; k=rsa; p="));
        assertEquals(rsaKeyPair.getPublic(), DKIMPublicKey.parse(record).toPublicKey());
    }

    @Test
    public void testFormatEd25519IsRaw() throws Exception {
        String record = DKIMPublicKey.format(ed25519KeyPair.getPublic());
        assertTrue(record.startsWith("v=DKIM1; k=ed25519; p="));
        DKIMPublicKey key = DKIMPublicKey.parse(record);
        assertEquals(32, key.getKeyData().length);
        assertEquals(ed25519KeyPair.getPublic(), key.toPublicKey());
    }

}
