package io.gridmesh.security;

import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Optional;

public record DelegationLink(
        String subject,
        String issuer,
        String serialHex,
        String fingerprintSha256,
        Instant notBefore,
        Instant notAfter,
        Optional<String> groupAttribute,
        X509Certificate certificate
) {
    public static DelegationLink from(X509Certificate certificate) {
        return new DelegationLink(
                certificate.getSubjectX500Principal().getName(),
                certificate.getIssuerX500Principal().getName(),
                RevocationPolicy.normalizeSerialToken(certificate.getSerialNumber().toString(16)),
                RevocationPolicy.fingerprintSha256(certificate),
                certificate.getNotBefore().toInstant(),
                certificate.getNotAfter().toInstant(),
                GroupAttribute.read(certificate),
                certificate
        );
    }

    public boolean selfIssued() {
        return certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal());
    }

    public boolean validAt(Instant now) {
        return !now.isBefore(notBefore) && !now.isAfter(notAfter);
    }
}
