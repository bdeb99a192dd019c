/*
 * DKIMSignerTest.java
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

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.RSAPrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import org.bluezoo.dkim.canon.Canonicalization;
import org.bluezoo.dkim.message.Message;

/**
 * Unit tests for DKIMSigner configuration and output.
 */
public class DKIMSignerTest {

    private static final String MESSAGE =
            "From: Joe SixPack <joe@football.example.com>\r\n" +
            "To: Suzie Q <suzie@shopping.example.net>\r\n" +
            "Subject: Is dinner ready?\r\n" +
            "\r\n" +
            "Hi.\r\n" +
            "\r\n" +
            "We lost the game. Are you hungry yet?\r\n" +
            "\r\n" +
            "Joe.\r\n";

    private static KeyPair rsaKeyPair;
    private static KeyPair ed25519KeyPair;

    @BeforeClass
    public static void generateKeys() throws Exception {
        KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
        rsa.initialize(2048);
        rsaKeyPair = rsa.generateKeyPair();
        ed25519KeyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    private static Message message() {
        return Message.parse(MESSAGE.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static DKIMSigner.Builder builder() {
        return new DKIMSigner.Builder()
                .selector("sel")
                .domain("football.example.com")
                .privateKey(rsaKeyPair.getPrivate())
                .signedHeaders("From", "To", "Subject");
    }

    private static DKIMSignature parseHeader(String header) throws DKIMSignatureException {
        assertTrue(header.startsWith("DKIM-Signature: "));
        return DKIMSignature.parse(header.substring(header.indexOf(':') + 1));
    }

    @Test
    public void testSignatureHeader() throws Exception {
        DKIMSigner signer = builder()
                .clock(Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC))
                .build();
        String header = signer.sign(message());

        assertTrue(header, header.startsWith("DKIM-Signature: v=1; a=rsa-sha256; c=simple/simple; " +
                "d=football.example.com; s=sel; t=1700000000; h=from:to:subject; " +
                "bh=2jUSOH9NhtVGCQWNr9BrIAPreKQjO6Sn7XIkfJVOzv8=; b="));
        assertFalse(header.endsWith("\r\n"));

        DKIMSignature sig = parseHeader(header);
        assertEquals(SignatureAlgorithm.RSA_SHA256, sig.getAlgorithm());
        assertEquals(256, sig.getSignatureBytes().length);
        assertEquals(1700000000L, sig.getTimestamp());
        assertEquals(-1, sig.getExpiration());
    }

    @Test
    public void testEd25519Signature() throws Exception {
        DKIMSigner signer = builder().privateKey(ed25519KeyPair.getPrivate())
                .canonicalization(Canonicalization.RELAXED, Canonicalization.RELAXED)
                .build();
        assertEquals(SignatureAlgorithm.ED25519_SHA256, signer.getAlgorithm());

        DKIMSignature sig = parseHeader(signer.sign(message()));
        assertEquals(SignatureAlgorithm.ED25519_SHA256, sig.getAlgorithm());
        assertEquals(Canonicalization.RELAXED, sig.getHeaderCanonicalization());
        assertEquals(64, sig.getSignatureBytes().length);
    }

    @Test
    public void testEd25519SignatureIsDeterministic() throws Exception {
        DKIMSigner signer = builder().privateKey(ed25519KeyPair.getPrivate())
                .time(Instant.ofEpochSecond(1700000000L))
                .build();
        assertEquals(signer.sign(message()), signer.sign(message()));
    }

    @Test
    public void testOptionalTags() throws Exception {
        DKIMSigner signer = builder()
                .time(Instant.ofEpochSecond(1700000000L))
                .expiry(Duration.ofDays(7))
                .identity("joe@mail.football.example.com")
                .bodyLength(10)
                .build();
        DKIMSignature sig = parseHeader(signer.sign(message()));

        assertEquals(1700000000L, sig.getTimestamp());
        assertEquals(1700000000L + 7 * 86400, sig.getExpiration());
        assertEquals("joe@mail.football.example.com", sig.getIdentity());
        assertEquals(10, sig.getBodyLength());
    }

    @Test
    public void testCopiedHeaders() throws Exception {
        DKIMSigner signer = builder().copyHeaders(true).build();
        DKIMSignature sig = parseHeader(signer.sign(message()));

        List<String> copied = sig.getCopiedHeaders();
        assertEquals(Arrays.asList(
                "From: Joe SixPack <joe@football.example.com>",
                "To: Suzie Q <suzie@shopping.example.net>",
                "Subject: Is dinner ready?"), copied);
    }

    @Test
    public void testSignMessagePrepends() throws Exception {
        Message signed = builder().build().signMessage(message());
        assertEquals(4, signed.getHeaders().size());
        assertEquals("DKIM-Signature", signed.getHeaders().get(0).getName());
        assertArrayEquals(message().getBody(), signed.getBody());
    }

    @Test
    public void testHeaderNamesAreLowerCased() throws Exception {
        DKIMSignature sig = parseHeader(builder().build().sign(message()));
        assertEquals(Arrays.asList("from", "to", "subject"), sig.getSignedHeaders());
    }

    // -- Configuration errors --

    private static void assertRefused(DKIMSigner.Builder builder, DKIMSigningException.Reason reason) {
        try {
            builder.build();
            fail("Expected " + reason);
        } catch (DKIMSigningException e) {
            assertEquals(reason, e.getReason());
            assertNotNull(e.getMessage());
        }
    }

    @Test
    public void testSha1Refused() {
        assertRefused(builder().hashAlgorithm(HashAlgorithm.SHA1),
                DKIMSigningException.Reason.UNSUPPORTED_ALGORITHM);
    }

    @Test
    public void testUnsupportedKeyType() throws Exception {
        KeyPair ec = KeyPairGenerator.getInstance("EC").generateKeyPair();
        assertRefused(builder().privateKey(ec.getPrivate()),
                DKIMSigningException.Reason.UNSUPPORTED_ALGORITHM);
    }

    @Test
    public void testFromRequired() {
        assertRefused(builder().signedHeaders("To", "Subject"),
                DKIMSigningException.Reason.INVALID_CONFIGURATION);
    }

    @Test
    public void testMissingSettings() {
        assertRefused(builder().selector(null), DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertRefused(builder().domain(null), DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertRefused(builder().privateKey(null), DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertRefused(new DKIMSigner.Builder().selector("s").domain("example.com")
                .privateKey(rsaKeyPair.getPrivate()), DKIMSigningException.Reason.INVALID_CONFIGURATION);
    }

    @Test
    public void testIdentityOutsideDomain() {
        assertRefused(builder().identity("joe@example.org"),
                DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertRefused(builder().identity("joe"), DKIMSigningException.Reason.INVALID_CONFIGURATION);
    }

    @Test
    public void testExpiryTooShort() {
        assertRefused(builder().expiry(Duration.ZERO), DKIMSigningException.Reason.INVALID_CONFIGURATION);
    }

    @Test
    public void testNegativeBodyLength() throws Exception {
        assertRefused(builder().bodyLength(-2), DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertRefused(builder().bodyLength(Long.MIN_VALUE), DKIMSigningException.Reason.INVALID_CONFIGURATION);
        assertNotNull(builder().bodyLength(-1).build());
        assertNotNull(builder().bodyLength(0).build());
    }

    @Test
    public void testRejectedKey() throws Exception {
        DKIMSigner signer = builder().privateKey(new RSAPrivateKey() {
            @Override
            public BigInteger getPrivateExponent() {
                return BigInteger.valueOf(3);
            }

            @Override
            public BigInteger getModulus() {
                return BigInteger.valueOf(15);
            }

            @Override
            public String getAlgorithm() {
                return "RSA";
            }

            @Override
            public String getFormat() {
                return null;
            }

            @Override
            public byte[] getEncoded() {
                return null;
            }
        }).build();
        try {
            signer.sign(message());
            fail("Toy key accepted");
        } catch (DKIMSigningException e) {
            assertEquals(DKIMSigningException.Reason.KEY_ERROR, e.getReason());
            assertNotNull(e.getCause());
        }
    }

}
