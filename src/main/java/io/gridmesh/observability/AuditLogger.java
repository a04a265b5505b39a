package io.gridmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.util.Hashing;
import io.gridmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger implements AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String node;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String node, String signingSecret) {
        this(auditFile, node, signingSecret, Clock.systemUTC());
    }

    public AuditLogger(Path auditFile, String node, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.node = node == null || node.isBlank() ? "default" : node.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException raced) {
                    log.debug("Audit file {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void record(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("node", node);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("group", event.group());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("job_id", event.jobId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized int verifyChain() throws IOException {
        String expectedPrev = "";
        int rows = 0;
        for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode node = Jsons.mapper().readTree(line);
            String hash = node.path("hash").asText("");
            if (!expectedPrev.equals(node.path("prev_hash").asText(""))) {
                return -1;
            }
            Map<String, Object> body = new LinkedHashMap<>();
            node.fields().forEachRemaining(entry -> {
                if (!"hash".equals(entry.getKey()) && !"signature".equals(entry.getKey())) {
                    body.put(entry.getKey(), entry.getValue());
                }
            });
            if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(body)))) {
                return -1;
            }
            if (!signingSecret.isBlank()
                    && !Hashing.hmacSha256Hex(signingSecret, hash).equals(node.path("signature").asText(""))) {
                return -1;
            }
            expectedPrev = hash;
            rows++;
        }
        return rows;
    }

    private String loadLastHash() {
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            String last = "";
            for (String line : lines) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit file {} unreadable, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }
}
