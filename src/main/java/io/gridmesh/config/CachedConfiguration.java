package io.gridmesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

public final class CachedConfiguration implements ConfigurationSource {
    private static final Logger log = LoggerFactory.getLogger(CachedConfiguration.class);

    private final Path file;
    private final long refreshIntervalMs;
    private final Clock clock;
    private volatile JsonConfigurationSource snapshot;
    private volatile long fileMtimeMs;
    private volatile long lastCheckMs;

    private CachedConfiguration(Path file, long refreshIntervalMs, Clock clock) {
        this.file = file;
        this.refreshIntervalMs = Math.max(0L, refreshIntervalMs);
        this.clock = clock;
    }

    public static CachedConfiguration open(Path file, long refreshIntervalMs) {
        return open(file, refreshIntervalMs, Clock.systemUTC());
    }

    public static CachedConfiguration open(Path file, long refreshIntervalMs, Clock clock) {
        CachedConfiguration config = new CachedConfiguration(file, refreshIntervalMs, clock);
        try {
            config.load();
        } catch (IOException e) {
            throw new ConfigurationException(file.toString(), "configuration file is not readable", e);
        }
        return config;
    }

    @Override
    public Optional<JsonNode> node(String path) {
        maybeRefresh();
        return snapshot.node(path);
    }

    public boolean maybeRefresh() {
        long nowMs = clock.millis();
        if (nowMs - lastCheckMs < refreshIntervalMs) {
            return false;
        }
        synchronized (this) {
            if (nowMs - lastCheckMs < refreshIntervalMs) {
                return false;
            }
            lastCheckMs = nowMs;
            return reloadIfChanged();
        }
    }

    public synchronized boolean refresh() {
        lastCheckMs = clock.millis();
        return reloadIfChanged();
    }

    public long fileMtimeMs() {
        return fileMtimeMs;
    }

    private boolean reloadIfChanged() {
        long mtime;
        try {
            mtime = Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            log.warn("Configuration file {} not readable, keeping last snapshot: {}", file, e.getMessage());
            return false;
        }
        if (mtime == fileMtimeMs) {
            return false;
        }
        try {
            load();
            log.info("Configuration reloaded from {} (mtime={})", file, mtime);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Configuration reload from {} failed, keeping last snapshot: {}", file, e.getMessage());
            return false;
        }
    }

    private void load() throws IOException {
        long mtime = Files.getLastModifiedTime(file).toMillis();
        JsonConfigurationSource loaded = JsonConfigurationSource.fromFile(file);
        snapshot = loaded;
        fileMtimeMs = mtime;
        lastCheckMs = clock.millis();
    }
}
