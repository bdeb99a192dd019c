/*
 * DKIMVerifierTest.java
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

import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;
import static org.junit.Assert.*;

import java.nio.charset.StandardCharsets;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.bluezoo.dkim.canon.Canonicalization;
import org.bluezoo.dkim.dns.DKIMKeyResolver;
import org.bluezoo.dkim.dns.MapTXTResolver;
import org.bluezoo.dkim.dns.TXTCallback;
import org.bluezoo.dkim.dns.TXTResolver;
import org.bluezoo.dkim.message.Message;
import org.bluezoo.dkim.message.RawHeader;

/**
 * Tests for DKIM verification, mostly of messages signed by DKIMSigner.
 */
public class DKIMVerifierTest {

    private static final String MESSAGE =
            "From: Joe SixPack <joe@football.example.com>\r\n" +
            "To: Suzie Q <suzie@shopping.example.net>\r\n" +
            "Subject: Is dinner ready?\r\n" +
            "Date: Fri, 11 Jul 2003 21:00:37 -0700 (PDT)\r\n" +
            "Message-ID: <20030712040037.46341.5F8J@football.example.com>\r\n" +
            "\r\n" +
            "Hi.\r\n" +
            "\r\n" +
            "We lost the game. Are you hungry yet?\r\n" +
            "\r\n" +
            "Joe.\r\n";

    private static final String DOMAIN = "football.example.com";

    private static KeyPair rsaKeyPair;
    private static KeyPair ed25519KeyPair;

    private MapTXTResolver dns;
    private DKIMVerifier verifier;

    @BeforeClass
    public static void generateKeys() throws Exception {
        KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
        rsa.initialize(2048);
        rsaKeyPair = rsa.generateKeyPair();
        ed25519KeyPair = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    @Before
    public void setUp() throws Exception {
        dns = new MapTXTResolver();
        dns.put("rsa._domainkey." + DOMAIN, DKIMPublicKey.format(rsaKeyPair.getPublic()));
        dns.put("ed._domainkey." + DOMAIN, DKIMPublicKey.format(ed25519KeyPair.getPublic()));
        verifier = new DKIMVerifier(dns);
    }

    private static Message message() {
        return Message.parse(MESSAGE.getBytes(StandardCharsets.ISO_8859_1));
    }

    private static DKIMSigner.Builder rsaSigner() {
        return new DKIMSigner.Builder()
                .selector("rsa")
                .domain(DOMAIN)
                .privateKey(rsaKeyPair.getPrivate())
                .signedHeaders("From", "To", "Subject", "Date", "Message-ID");
    }

    private static DKIMSigner.Builder ed25519Signer() {
        return new DKIMSigner.Builder()
                .selector("ed")
                .domain(DOMAIN)
                .privateKey(ed25519KeyPair.getPrivate())
                .signedHeaders("From", "To", "Subject", "Date", "Message-ID");
    }

    private static List<DKIMVerification> verify(DKIMVerifier verifier, Message message)
            throws InterruptedException {
        final CountDownLatch latch = new CountDownLatch(1);
        final AtomicReference<List<DKIMVerification>> results =
                new AtomicReference<List<DKIMVerification>>();
        final AtomicInteger calls = new AtomicInteger();
        verifier.verify(message, new DKIMCallback() {
            @Override
            public void dkimResults(List<DKIMVerification> list) {
                calls.incrementAndGet();
                results.set(list);
                latch.countDown();
            }
        });
        assertTrue("No results delivered", latch.await(10, TimeUnit.SECONDS));
        assertEquals(1, calls.get());
        return results.get();
    }

    private DKIMVerification verifyOne(Message message) throws InterruptedException {
        List<DKIMVerification> results = verify(verifier, message);
        assertEquals(1, results.size());
        return results.get(0);
    }

    private static int indexOf(Message message, String name) {
        List<RawHeader> headers = message.getHeaders();
        for (int i = 0; i < headers.size(); i++) {
            if (headers.get(i).isNamed(name)) {
                return i;
            }
        }
        return -1;
    }

    // -- Round trips --

    @Test
    public void testRoundTripAllAlgorithmsAndCanonicalizations() throws Exception {
        Canonicalization[] canons = Canonicalization.values();
        DKIMSigner.Builder[] signers = { rsaSigner(), ed25519Signer() };
        for (int s = 0; s < signers.length; s++) {
            for (int h = 0; h < canons.length; h++) {
                for (int b = 0; b < canons.length; b++) {
                    DKIMSigner signer = signers[s].canonicalization(canons[h], canons[b]).build();
                    DKIMVerification result = verifyOne(signer.signMessage(message()));
                    String label = signer.getAlgorithm() + " " + canons[h] + "/" + canons[b];
                    assertEquals(label + ": " + result.getDetail(), DKIMResult.PASS, result.getResult());
                    assertNull(result.getFailure());
                    assertEquals(DOMAIN, result.getDomain());
                    assertNotNull(result.getPublicKey());
                }
            }
        }
    }

    @Test
    public void testRoundTripUnderTurkishLocale() throws Exception {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            DKIMSigner signer = rsaSigner().signedHeaders("From", "Message-ID", "Subject").build();
            Message signed = signer.signMessage(message());
            String header = signed.getHeader("DKIM-Signature").asString();
            assertTrue(header, header.contains("h=from:message-id:subject;"));

            DKIMVerification result = verifyOne(signed);
            assertEquals(result.getDetail(), DKIMResult.PASS, result.getResult());

            DKIMVerification failed = verifyOne(signed.withBody("Tampered\r\n".getBytes(StandardCharsets.US_ASCII)));
            String text = failed.toAuthenticationResults();
            assertTrue(text, text.startsWith("dkim=fail (body hash mismatch) header.d=" + DOMAIN));
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    public void testUnsignedMessage() throws Exception {
        List<DKIMVerification> results = verify(verifier, message());
        assertTrue(results.isEmpty());
        assertEquals(DKIMResult.NONE, DKIMResult.summarize(results));
        assertEquals(0, dns.getLookupCount());
    }

    @Test
    public void testReparsedSignedMessage() throws Exception {
        Message signed = rsaSigner().build().signMessage(message());
        Message reparsed = Message.parse(signed.toByteArray());
        assertEquals(DKIMResult.PASS, verifyOne(reparsed).getResult());
    }

    @Test
    public void testFoldedSignatureHeader() throws Exception {
        String header = rsaSigner().headerCanonicalization(Canonicalization.RELAXED).build()
                .sign(message());
        String folded = header.replace("; h=", ";\r\n\th=").replace("; b=", ";\r\n b=");
        assertEquals(DKIMResult.PASS, verifyOne(message().prepend(folded)).getResult());
    }

    @Test
    public void testLegacyRsaSha1Signature() throws Exception {
        Message message = message();
        List<String> headers = Arrays.asList("from", "subject");
        byte[] bodyHash = DKIMHash.bodyHash(message.getBody(), Canonicalization.SIMPLE,
                HashAlgorithm.SHA1, -1);
        DKIMSignature template = new DKIMSignature.Builder(SignatureAlgorithm.RSA_SHA1, DOMAIN, "rsa")
                .signedHeaders(headers)
                .bodyHash(bodyHash)
                .build();
        String field = DKIMSignature.HEADER_NAME + ": " + template.getRawValue();
        byte[] headerHash = DKIMHash.headerHash(message, headers, RawHeader.of(field),
                Canonicalization.SIMPLE, HashAlgorithm.SHA1);
        byte[] signature = SignatureAlgorithm.RSA_SHA1.sign(rsaKeyPair.getPrivate(), headerHash);
        Message signed = message.prepend(field + Base64.getEncoder().encodeToString(signature));

        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.PASS, result.getResult());
        assertEquals(SignatureAlgorithm.RSA_SHA1, result.getSignature().getAlgorithm());
    }

    // -- Tampering --

    @Test
    public void testModifiedBody() throws Exception {
        Message signed = rsaSigner().build().signMessage(message());
        Message tampered = signed.withBody("Hi.\r\n\r\nWe won the game.\r\n".getBytes(StandardCharsets.ISO_8859_1));

        DKIMVerification result = verifyOne(tampered);
        assertEquals(DKIMResult.FAIL, result.getResult());
        assertEquals(DKIMFailure.BODY_HASH_MISMATCH, result.getFailure());
        assertEquals(0, dns.getLookupCount());
    }

    @Test
    public void testModifiedSignedHeader() throws Exception {
        Message signed = ed25519Signer().build().signMessage(message());
        Message tampered = signed.replaceHeader(indexOf(signed, "Subject"), "Subject: Is lunch ready?");

        DKIMVerification result = verifyOne(tampered);
        assertEquals(DKIMResult.FAIL, result.getResult());
        assertEquals(DKIMFailure.SIGNATURE_INVALID, result.getFailure());
    }

    @Test
    public void testUnsignedHeaderMayChange() throws Exception {
        Message signed = rsaSigner().signedHeaders("From", "Subject").build().signMessage(message());
        Message changed = signed.replaceHeader(indexOf(signed, "To"), "To: someone@else.example");
        assertEquals(DKIMResult.PASS, verifyOne(changed).getResult());
    }

    @Test
    public void testAddedHeaderInstanceBreaksOverSignedHeader() throws Exception {
        // Subject is listed twice but occurs once: a second Subject must not appear later
        Message signed = rsaSigner().signedHeaders("From", "Subject", "Subject").build()
                .signMessage(message());
        assertEquals(DKIMResult.PASS, verifyOne(signed).getResult());

        Message added = new Message(appendHeader(signed, "Subject: Free money"), signed.getBody());
        assertEquals(DKIMFailure.SIGNATURE_INVALID, verifyOne(added).getFailure());
    }

    private static List<RawHeader> appendHeader(Message message, String field) {
        List<RawHeader> headers = new ArrayList<RawHeader>(message.getHeaders());
        headers.add(RawHeader.of(field));
        return headers;
    }

    @Test
    public void testModifiedSignatureValue() throws Exception {
        String header = rsaSigner().build().sign(message());
        int pos = header.indexOf("; b=") + 4;
        char c = header.charAt(pos);
        String tampered = header.substring(0, pos) + (c == 'A' ? 'B' : 'A') + header.substring(pos + 1);

        DKIMVerification result = verifyOne(message().prepend(tampered));
        assertEquals(DKIMFailure.SIGNATURE_INVALID, result.getFailure());
    }

    @Test
    public void testRelaxedToleratesWhitespaceChanges() throws Exception {
        Message signed = rsaSigner().canonicalization(Canonicalization.RELAXED, Canonicalization.RELAXED)
                .build().signMessage(message());
        Message rewritten = signed
                .replaceHeader(indexOf(signed, "Subject"), "subject:  Is dinner\r\n\tready?  ")
                .withBody("Hi.  \r\n\r\nWe lost  the game.\tAre you hungry yet?\r\n\r\nJoe.\r\n\r\n\r\n"
                        .getBytes(StandardCharsets.ISO_8859_1));
        assertEquals(DKIMResult.PASS, verifyOne(rewritten).getResult());
    }

    @Test
    public void testSimpleRejectsWhitespaceChanges() throws Exception {
        Message signed = rsaSigner().build().signMessage(message());
        Message rewritten = signed.replaceHeader(indexOf(signed, "Subject"), "Subject:  Is dinner ready?");
        assertEquals(DKIMFailure.SIGNATURE_INVALID, verifyOne(rewritten).getFailure());
    }

    @Test
    public void testBodyLengthAllowsAppendedContent() throws Exception {
        Message message = message();
        Message signed = rsaSigner().bodyLength(message.getBody().length).build().signMessage(message);
        byte[] body = (new String(message.getBody(), StandardCharsets.ISO_8859_1)
                + "--\r\nMailing list footer\r\n").getBytes(StandardCharsets.ISO_8859_1);
        assertEquals(DKIMResult.PASS, verifyOne(signed.withBody(body)).getResult());
    }

    // -- Expiration --

    @Test
    public void testExpiredSignature() throws Exception {
        Instant signingTime = Instant.ofEpochSecond(1700000000L);
        Message signed = rsaSigner().time(signingTime).expiry(Duration.ofHours(1)).build()
                .signMessage(message());

        verifier.setClock(Clock.fixed(signingTime.plusSeconds(1800), ZoneOffset.UTC));
        assertEquals(DKIMResult.PASS, verifyOne(signed).getResult());

        verifier.setClock(Clock.fixed(signingTime.plusSeconds(7200), ZoneOffset.UTC));
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.FAIL, result.getResult());
        assertEquals(DKIMFailure.EXPIRED, result.getFailure());
    }

    // -- Key problems --

    @Test
    public void testKeyNotFound() throws Exception {
        Message signed = rsaSigner().selector("missing").build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.PERMERROR, result.getResult());
        assertEquals(DKIMFailure.KEY_NOT_FOUND, result.getFailure());
    }

    @Test
    public void testDnsFailure() throws Exception {
        dns.putError("broken._domainkey." + DOMAIN, "SERVFAIL");
        Message signed = rsaSigner().selector("broken").build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.TEMPERROR, result.getResult());
        assertEquals(DKIMFailure.KEY_DNS_FAILURE, result.getFailure());
        assertTrue(result.getFailure().isRetryable());
    }

    @Test
    public void testDnsTimeout() throws Exception {
        dns.putSilent("slow._domainkey." + DOMAIN);
        DKIMKeyResolver keyResolver = new DKIMKeyResolver(dns);
        keyResolver.setTimeout(100);
        DKIMVerifier timed = new DKIMVerifier(keyResolver);

        Message signed = rsaSigner().selector("slow").build().signMessage(message());
        List<DKIMVerification> results = verify(timed, signed);
        assertEquals(DKIMFailure.KEY_DNS_FAILURE, results.get(0).getFailure());
    }

    @Test
    public void testRevokedKey() throws Exception {
        dns.put("revoked._domainkey." + DOMAIN, "v=DKIM1; k=rsa; p=");
        Message signed = rsaSigner().selector("revoked").build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.PERMERROR, result.getResult());
        assertEquals(DKIMFailure.KEY_REVOKED, result.getFailure());
    }

    @Test
    public void testMalformedKey() throws Exception {
        dns.put("bad._domainkey." + DOMAIN, "v=DKIM1; k=rsa; p=not base64!");
        Message signed = rsaSigner().selector("bad").build().signMessage(message());
        assertEquals(DKIMFailure.KEY_MALFORMED, verifyOne(signed).getFailure());
    }

    @Test
    public void testKeyTypeMismatch() throws Exception {
        dns.put("swapped._domainkey." + DOMAIN, DKIMPublicKey.format(ed25519KeyPair.getPublic()));
        Message signed = rsaSigner().selector("swapped").build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.PERMERROR, result.getResult());
        assertEquals(DKIMFailure.KEY_ALGORITHM_MISMATCH, result.getFailure());
    }

    @Test
    public void testKeyHashRestriction() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic()).replace("k=rsa;", "k=rsa; h=sha1;");
        dns.put("sha1only._domainkey." + DOMAIN, record);
        Message signed = rsaSigner().selector("sha1only").build().signMessage(message());
        assertEquals(DKIMFailure.KEY_ALGORITHM_MISMATCH, verifyOne(signed).getFailure());
    }

    @Test
    public void testKeyServiceRestriction() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic()).replace("k=rsa;", "k=rsa; s=other;");
        dns.put("other._domainkey." + DOMAIN, record);
        Message signed = rsaSigner().selector("other").build().signMessage(message());
        assertEquals(DKIMFailure.KEY_INAPPLICABLE, verifyOne(signed).getFailure());
    }

    @Test
    public void testStrictKeyFlag() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic()).replace("k=rsa;", "k=rsa; t=s;");
        dns.put("strict._domainkey." + DOMAIN, record);

        Message exact = rsaSigner().selector("strict").identity("joe@" + DOMAIN).build()
                .signMessage(message());
        assertEquals(DKIMResult.PASS, verifyOne(exact).getResult());

        Message subdomain = rsaSigner().selector("strict").identity("joe@mail." + DOMAIN).build()
                .signMessage(message());
        assertEquals(DKIMFailure.KEY_INAPPLICABLE, verifyOne(subdomain).getFailure());
    }

    @Test
    public void testMinimumKeyBits() throws Exception {
        verifier.setMinimumKeyBits(4096);
        Message signed = rsaSigner().build().signMessage(message());
        assertEquals(DKIMFailure.KEY_INAPPLICABLE, verifyOne(signed).getFailure());
    }

    @Test
    public void testTestingKey() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic()).replace("k=rsa;", "k=rsa; t=y;");
        dns.put("testing._domainkey." + DOMAIN, record);
        Message signed = rsaSigner().selector("testing").build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        assertEquals(DKIMResult.PASS, result.getResult());
        assertTrue(result.isTesting());
    }

    @Test
    public void testMultiStringKeyRecord() throws Exception {
        String record = DKIMPublicKey.format(rsaKeyPair.getPublic());
        dns.putStrings("split._domainkey." + DOMAIN, record.substring(0, 100), record.substring(100));
        Message signed = rsaSigner().selector("split").build().signMessage(message());
        assertEquals(DKIMResult.PASS, verifyOne(signed).getResult());
    }

    // -- Several signatures --

    @Test
    public void testMultipleSignaturesInHeaderOrder() throws Exception {
        Message once = rsaSigner().build().signMessage(message());
        Message twice = ed25519Signer().build().signMessage(once);
        Message thrice = twice.prepend("DKIM-Signature: v=1; a=rsa-sha256; garbage");

        List<DKIMVerification> results = verify(verifier, thrice);
        assertEquals(3, results.size());

        assertEquals(DKIMFailure.PARSE_ERROR, results.get(0).getFailure());
        assertEquals(DKIMResult.PERMERROR, results.get(0).getResult());
        assertNull(results.get(0).getSignature());

        assertEquals(DKIMResult.PASS, results.get(1).getResult());
        assertEquals("ed", results.get(1).getSelector());
        assertEquals(DKIMResult.PASS, results.get(2).getResult());
        assertEquals("rsa", results.get(2).getSelector());

        assertTrue(DKIMVerification.anyPass(results));
        assertEquals(DKIMResult.PASS, DKIMResult.summarize(results));
    }

    @Test
    public void testOneFailureDoesNotAffectOthers() throws Exception {
        Message once = rsaSigner().selector("missing").build().signMessage(message());
        Message twice = ed25519Signer().build().signMessage(once);

        List<DKIMVerification> results = verify(verifier, twice);
        assertEquals(DKIMResult.PASS, results.get(0).getResult());
        assertEquals(DKIMFailure.KEY_NOT_FOUND, results.get(1).getFailure());
    }

    @Test
    public void testThrowingResolverFailsOnlyItsSignature() throws Exception {
        DKIMVerifier guarded = new DKIMVerifier(new TXTResolver() {
            @Override
            public void lookupTXT(String name, TXTCallback callback) {
                if (name.startsWith("rsa.")) {
                    throw new IllegalStateException("resolver closed");
                }
                dns.lookupTXT(name, callback);
            }
        });
        Message once = rsaSigner().build().signMessage(message());
        Message twice = ed25519Signer().build().signMessage(once);

        List<DKIMVerification> results = verify(guarded, twice);
        assertEquals(2, results.size());
        assertEquals(DKIMResult.PASS, results.get(0).getResult());
        assertEquals("ed", results.get(0).getSelector());
        assertEquals(DKIMFailure.KEY_DNS_FAILURE, results.get(1).getFailure());
        assertEquals(DKIMResult.TEMPERROR, results.get(1).getResult());
    }

    // -- Reporting --

    @Test
    public void testAuthenticationResults() throws Exception {
        Message signed = rsaSigner().build().signMessage(message());
        DKIMVerification result = verifyOne(signed);
        String b = result.getSignature().getSignature().substring(0, 8);
        assertEquals("dkim=pass header.d=" + DOMAIN + " header.s=rsa header.b=" + b,
                result.toAuthenticationResults());

        Message unknown = rsaSigner().selector("missing").build().signMessage(message());
        String failed = verifyOne(unknown).toAuthenticationResults();
        assertTrue(failed, failed.startsWith("dkim=permerror (key not found) header.d=" + DOMAIN));
    }

    @Test
    public void testSummarize() throws Exception {
        Message expired = rsaSigner().time(Instant.ofEpochSecond(1000000000L))
                .expiry(Duration.ofSeconds(60)).build().signMessage(message());
        Message both = rsaSigner().selector("missing").build().signMessage(expired);

        List<DKIMVerification> results = verify(verifier, both);
        assertEquals(DKIMResult.PERMERROR, results.get(0).getResult());
        assertEquals(DKIMResult.FAIL, results.get(1).getResult());
        assertEquals(DKIMResult.FAIL, DKIMResult.summarize(results));
        assertFalse(DKIMVerification.anyPass(results));
    }

}
