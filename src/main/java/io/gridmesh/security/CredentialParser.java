package io.gridmesh.security;

import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class CredentialParser {
    private static final String PEM_MARKER = "-----BEGIN CERTIFICATE-----";

    private CredentialParser() {
    }

    public static Result<Credential> parse(byte[] raw) {
        if (raw == null || raw.length == 0) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "empty certificate chain");
        }
        List<X509Certificate> certificates;
        try {
            certificates = decode(raw);
        } catch (CertificateException | RuntimeException e) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "certificate chain is not decodable");
        }
        return fromCertificates(certificates);
    }

    public static Result<Credential> fromCertificates(List<X509Certificate> certificates) {
        if (certificates == null || certificates.isEmpty()) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "empty certificate chain");
        }
        List<DelegationLink> links = new ArrayList<>(certificates.size());
        for (X509Certificate certificate : certificates) {
            if (certificate == null) {
                return Result.fail(ErrorCode.MALFORMED_CHAIN, "certificate chain has a null link");
            }
            links.add(DelegationLink.from(certificate));
        }
        for (int i = 0; i + 1 < links.size(); i++) {
            X509Certificate child = links.get(i).certificate();
            X509Certificate parent = links.get(i + 1).certificate();
            if (!child.getIssuerX500Principal().equals(parent.getSubjectX500Principal())) {
                return Result.fail(
                        ErrorCode.MALFORMED_CHAIN,
                        "link " + i + " is not issued by link " + (i + 1)
                );
            }
        }
        return Result.ok(Credential.fromLinks(links));
    }

    public static Result<Credential> fromCertificates(Certificate[] chain) {
        if (chain == null) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "empty certificate chain");
        }
        List<X509Certificate> certificates = new ArrayList<>(chain.length);
        for (Certificate certificate : chain) {
            if (!(certificate instanceof X509Certificate x509)) {
                return Result.fail(ErrorCode.MALFORMED_CHAIN, "certificate chain has a non-X.509 link");
            }
            certificates.add(x509);
        }
        return fromCertificates(certificates);
    }

    static List<X509Certificate> decode(byte[] raw) throws CertificateException {
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        String text = new String(raw, StandardCharsets.US_ASCII);
        List<X509Certificate> out = new ArrayList<>();
        if (text.contains(PEM_MARKER)) {
            // PEM bundles such as proxy files also contain key blocks; only certificates are read.
            Collection<? extends Certificate> all = factory.generateCertificates(
                    new ByteArrayInputStream(certificateBlocks(text).getBytes(StandardCharsets.US_ASCII)));
            for (Certificate certificate : all) {
                out.add((X509Certificate) certificate);
            }
        } else {
            out.add((X509Certificate) factory.generateCertificate(new ByteArrayInputStream(raw)));
        }
        if (out.isEmpty()) {
            throw new CertificateException("no certificates found");
        }
        return out;
    }

    private static String certificateBlocks(String text) {
        StringBuilder out = new StringBuilder();
        int from = 0;
        while (true) {
            int begin = text.indexOf(PEM_MARKER, from);
            if (begin < 0) {
                break;
            }
            int end = text.indexOf("-----END CERTIFICATE-----", begin);
            if (end < 0) {
                throw new IllegalArgumentException("unterminated PEM certificate block");
            }
            end += "-----END CERTIFICATE-----".length();
            out.append(text, begin, end).append('\n');
            from = end;
        }
        return out.toString();
    }
}
