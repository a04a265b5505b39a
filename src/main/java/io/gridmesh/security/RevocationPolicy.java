package io.gridmesh.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record RevocationPolicy(
        Set<String> revokedSerialNumbers,
        Set<String> revokedSha256Fingerprints,
        String sourcePath,
        long loadedAtMs,
        long sourceMtimeMs
) {
    public static RevocationPolicy empty() {
        return empty(null, -1L);
    }

    static RevocationPolicy empty(String sourcePath, long sourceMtimeMs) {
        return new RevocationPolicy(
                Collections.emptySet(),
                Collections.emptySet(),
                sourcePath,
                Instant.now().toEpochMilli(),
                sourceMtimeMs
        );
    }

    public int entryCount() {
        return revokedSerialNumbers.size() + revokedSha256Fingerprints.size();
    }

    public boolean isRevoked(DelegationLink link) {
        return revokedSerialNumbers.contains(link.serialHex())
                || revokedSha256Fingerprints.contains(link.fingerprintSha256());
    }

    public boolean isRevoked(X509Certificate certificate) {
        if (certificate == null) {
            return false;
        }
        String serial = normalizeSerialToken(certificate.getSerialNumber().toString(16));
        return revokedSerialNumbers.contains(serial)
                || revokedSha256Fingerprints.contains(fingerprintSha256(certificate));
    }

    // Accepts both JSON and line-oriented files; tokens are normalized for deterministic matching.
    public static RevocationPolicy load(String revocationFilePath) throws IOException {
        if (revocationFilePath == null || revocationFilePath.isBlank()) {
            return empty(null, -1L);
        }
        Path path = Path.of(revocationFilePath);
        if (!Files.exists(path)) {
            return empty(path.toString(), -1L);
        }
        long mtimeMs = Files.getLastModifiedTime(path).toMillis();
        String trimmed = stripBom(Files.readString(path, StandardCharsets.UTF_8)).trim();
        if (trimmed.isEmpty()) {
            return empty(path.toString(), mtimeMs);
        }
        LinkedHashSet<String> serials = new LinkedHashSet<>();
        LinkedHashSet<String> fingerprints = new LinkedHashSet<>();
        if (trimmed.startsWith("{")) {
            parseJson(trimmed, serials, fingerprints);
        } else {
            parseLines(trimmed, serials, fingerprints);
        }
        return new RevocationPolicy(
                Collections.unmodifiableSet(serials),
                Collections.unmodifiableSet(fingerprints),
                path.toString(),
                Instant.now().toEpochMilli(),
                mtimeMs
        );
    }

    public static void writeTemplate(Path output, List<String> serials, List<String> fingerprints) throws IOException {
        StringBuilder body = new StringBuilder();
        body.append("# GridMesh revocation list\n");
        body.append("# serial:<HEX_SERIAL>\n");
        body.append("# sha256:<HEX_FINGERPRINT_64>\n");
        LinkedHashSet<String> serialSet = new LinkedHashSet<>();
        for (String serial : serials == null ? List.<String>of() : serials) {
            if (serial != null && !serial.isBlank()) {
                serialSet.add(normalizeSerialToken(serial));
            }
        }
        LinkedHashSet<String> fingerprintSet = new LinkedHashSet<>();
        for (String fp : fingerprints == null ? List.<String>of() : fingerprints) {
            if (fp != null && !fp.isBlank()) {
                fingerprintSet.add(normalizeFingerprintToken(fp));
            }
        }
        serialSet.forEach(s -> body.append("serial:").append(s).append("\n"));
        fingerprintSet.forEach(f -> body.append("sha256:").append(f).append("\n"));
        Files.writeString(
                output,
                body.toString(),
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE
        );
    }

    public static String normalizeSerialToken(String raw) {
        String cleaned = compactHex(raw);
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException("revocation serial token is empty");
        }
        validateHex(cleaned, "serial");
        // BigInteger.toString(16) never has leading zeros; file entries may.
        String stripped = cleaned.replaceFirst("^0+(?=.)", "");
        return stripped;
    }

    public static String normalizeFingerprintToken(String raw) {
        String cleaned = compactHex(raw);
        if (cleaned.length() != 64) {
            throw new IllegalArgumentException("fingerprint must be 64 hex chars (sha256)");
        }
        validateHex(cleaned, "fingerprint");
        return cleaned;
    }

    public static String fingerprintSha256(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (Exception e) {
            throw new IllegalStateException("failed to compute certificate fingerprint", e);
        }
    }

    private static void parseJson(String trimmed, Set<String> serials, Set<String> fingerprints) throws IOException {
        JsonNode root = Jsons.mapper().readTree(trimmed);
        for (JsonNode n : root.path("serialNumbers")) {
            String token = n.asText("");
            if (!token.isBlank()) {
                serials.add(normalizeSerialToken(token));
            }
        }
        for (JsonNode n : root.path("sha256Fingerprints")) {
            String token = n.asText("");
            if (!token.isBlank()) {
                fingerprints.add(normalizeFingerprintToken(token));
            }
        }
    }

    private static void parseLines(String trimmed, Set<String> serials, Set<String> fingerprints) {
        for (String line : trimmed.split("\r?\n")) {
            String raw = stripBom(line).trim();
            if (raw.isEmpty() || raw.startsWith("#")) {
                continue;
            }
            int sep = raw.indexOf(':');
            if (sep > 0) {
                String type = raw.substring(0, sep).trim().toLowerCase(Locale.ROOT);
                String value = raw.substring(sep + 1).trim();
                if (value.isEmpty()) {
                    continue;
                }
                switch (type) {
                    case "serial" -> serials.add(normalizeSerialToken(value));
                    case "sha256", "fingerprint" -> fingerprints.add(normalizeFingerprintToken(value));
                    default -> throw new IllegalArgumentException("unsupported revocation token prefix: " + type);
                }
                continue;
            }
            // Bare tokens: 64 hex chars is a fingerprint, anything else a serial.
            String compact = compactHex(raw);
            if (compact.length() == 64) {
                fingerprints.add(normalizeFingerprintToken(compact));
            } else {
                serials.add(normalizeSerialToken(compact));
            }
        }
    }

    private static String compactHex(String raw) {
        if (raw == null) {
            return "";
        }
        String token = stripBom(raw).trim();
        if (token.toLowerCase(Locale.ROOT).startsWith("0x")) {
            token = token.substring(2);
        }
        return token.replace(":", "")
                .replace("-", "")
                .replace(" ", "")
                .trim()
                .toUpperCase(Locale.ROOT);
    }

    private static void validateHex(String value, String fieldName) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            boolean ok = (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F');
            if (!ok) {
                throw new IllegalArgumentException(fieldName + " must be hex: " + value);
            }
        }
    }

    private static String stripBom(String raw) {
        if (raw == null || raw.isEmpty()) {
            return raw == null ? "" : raw;
        }
        return raw.charAt(0) == '\uFEFF' ? raw.substring(1) : raw;
    }
}
