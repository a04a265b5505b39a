package io.gridmesh.security;

import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.List;

public final class CredentialVerifier {
    private final TrustRoots trustRoots;
    private final RevocationPolicy revocationPolicy;

    public CredentialVerifier(TrustRoots trustRoots, RevocationPolicy revocationPolicy) {
        this.trustRoots = trustRoots;
        this.revocationPolicy = revocationPolicy == null ? RevocationPolicy.empty() : revocationPolicy;
    }

    public static boolean verify(Credential credential, TrustRoots trustRoots) {
        return new CredentialVerifier(trustRoots, null).check(credential, Instant.now()).isOk();
    }

    public static boolean verify(Credential credential, TrustRoots trustRoots, Instant now) {
        return new CredentialVerifier(trustRoots, null).check(credential, now).isOk();
    }

    public Result<Credential> check(Credential credential, Instant now) {
        List<DelegationLink> links = credential.links();
        for (int i = 0; i < links.size(); i++) {
            DelegationLink link = links.get(i);
            if (!link.validAt(now)) {
                return Result.fail(ErrorCode.EXPIRED_CHAIN, "link " + i + " is outside its validity window");
            }
            if (revocationPolicy.isRevoked(link)) {
                return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "link " + i + " is revoked");
            }
        }
        for (int i = 0; i + 1 < links.size(); i++) {
            X509Certificate child = links.get(i).certificate();
            X509Certificate parent = links.get(i + 1).certificate();
            if (!child.getIssuerX500Principal().equals(parent.getSubjectX500Principal())) {
                return Result.fail(ErrorCode.MALFORMED_CHAIN, "link " + i + " is not issued by link " + (i + 1));
            }
            if (!signedBy(child, parent)) {
                return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "link " + i + " signature does not verify");
            }
            if (!parent.getSubjectX500Principal().equals(parent.getIssuerX500Principal())
                    && parent.getBasicConstraints() < 0
                    && !extendsName(links.get(i).subject(), links.get(i + 1).subject())) {
                // Delegation from an end entity may only narrow its own name.
                return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "link " + i + " is not a proxy of its issuer");
            }
        }
        return anchor(links.get(links.size() - 1), now).map(ignored -> credential);
    }

    private Result<Void> anchor(DelegationLink last, Instant now) {
        X509Certificate certificate = last.certificate();
        if (trustRoots.contains(certificate)) {
            return Result.ok();
        }
        List<X509Certificate> candidates = trustRoots.issuedTo(certificate.getIssuerX500Principal());
        if (candidates.isEmpty()) {
            return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "issuer is not a trust root");
        }
        for (X509Certificate root : candidates) {
            if (signedBy(certificate, root) && !now.isBefore(root.getNotBefore().toInstant())
                    && !now.isAfter(root.getNotAfter().toInstant())) {
                return Result.ok();
            }
        }
        return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "chain does not verify against a trust root");
    }

    private static boolean signedBy(X509Certificate child, X509Certificate parent) {
        try {
            child.verify(parent.getPublicKey());
            return true;
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    private static boolean extendsName(String childDn, String parentDn) {
        return childDn.length() > parentDn.length() && childDn.endsWith("," + parentDn);
    }
}
