package io.gridmesh.security;

import io.gridmesh.TestPki;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;
import java.util.Set;

final class RevocationPolicyTest {

    @Test
    void parseRevocationPolicyFromLineAndJsonFormats() throws Exception {
        Path root = Files.createTempDirectory("gridmesh-revocation-test-");
        try {
            String linePolicy = """
                    # sample
                    serial:0x1a2b
                    sha256:AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA
                    """;
            Path policy = root.resolve("revocations.txt");
            Files.writeString(policy, linePolicy, StandardCharsets.UTF_8);
            RevocationPolicy parsedLine = RevocationPolicy.load(policy.toString());
            Assertions.assertTrue(parsedLine.revokedSerialNumbers().contains("1A2B"));
            Assertions.assertTrue(parsedLine.revokedSha256Fingerprints().contains(
                    "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA"
            ));

            String jsonPolicy = """
                    {
                      "serialNumbers": ["00ff", "0x10"],
                      "sha256Fingerprints": ["BBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBB"]
                    }
                    """;
            Files.writeString(policy, jsonPolicy, StandardCharsets.UTF_8);
            RevocationPolicy parsedJson = RevocationPolicy.load(policy.toString());
            Assertions.assertTrue(parsedJson.revokedSerialNumbers().contains("FF"));
            Assertions.assertTrue(parsedJson.revokedSerialNumbers().contains("10"));
            Assertions.assertEquals(3, parsedJson.entryCount());
        } finally {
            TestPki.deleteRecursively(root);
        }
    }

    @Test
    void missingFileMeansNothingRevoked() throws Exception {
        RevocationPolicy policy = RevocationPolicy.load("/nonexistent/gridmesh/revocations.txt");
        Assertions.assertEquals(0, policy.entryCount());
        Assertions.assertEquals(-1L, policy.sourceMtimeMs());
    }

    @Test
    void templateMatchesRealCertificateBySerialAndFingerprint() throws Exception {
        Path root = Files.createTempDirectory("gridmesh-revocation-template-");
        try {
            X509Certificate alice = TestPki.credential("alice.pem").leaf().certificate();
            X509Certificate bob = TestPki.credential("bob.pem").leaf().certificate();
            Path out = root.resolve("revoked.txt");

            RevocationPolicy.writeTemplate(out, List.of(alice.getSerialNumber().toString(16)), List.of());
            RevocationPolicy bySerial = RevocationPolicy.load(out.toString());
            Assertions.assertTrue(bySerial.isRevoked(alice));
            Assertions.assertFalse(bySerial.isRevoked(bob));

            RevocationPolicy.writeTemplate(out, List.of(), List.of(RevocationPolicy.fingerprintSha256(bob).toLowerCase()));
            RevocationPolicy byFingerprint = RevocationPolicy.load(out.toString());
            Assertions.assertFalse(byFingerprint.isRevoked(alice));
            Assertions.assertTrue(byFingerprint.isRevoked(bob));
        } finally {
            TestPki.deleteRecursively(root);
        }
    }

    @Test
    void emptyPolicyRevokesNothing() {
        RevocationPolicy none = new RevocationPolicy(Set.of(), Set.of(), "inline", Instant.now().toEpochMilli(), -1L);
        Assertions.assertFalse(none.isRevoked(TestPki.credential("pilot.pem").leaf()));
    }

    @Test
    void invalidFingerprintLengthRejected() {
        Assertions.assertThrows(
                IllegalArgumentException.class,
                () -> RevocationPolicy.normalizeFingerprintToken("ABCDEF")
        );
    }
}
