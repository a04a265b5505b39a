package io.gridmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class NodePaths {
    public static final String DEFAULT_SETUP = "default";
    public static final String SETUPS_DIR = "setups";

    private final Path rootDir;
    private final String setup;

    private NodePaths(Path rootDir, String setup) {
        this.rootDir = rootDir;
        this.setup = setup;
    }

    public static NodePaths fromRoot(String root) {
        return fromRoot(root, DEFAULT_SETUP);
    }

    public static NodePaths fromRoot(String root, String setup) {
        Path resolved = root == null || root.isBlank() ? Paths.get("data") : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeSetup = sanitizeSetup(setup);
        Path scoped = DEFAULT_SETUP.equals(safeSetup) ? base : base.resolve(SETUPS_DIR).resolve(safeSetup);
        return new NodePaths(scoped, safeSetup);
    }

    static String sanitizeSetup(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_SETUP : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "setup" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public String setup() {
        return setup;
    }

    public Path dbFile() {
        return rootDir.resolve("gridmesh.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.jsonl");
    }
}
