package io.gridmesh.config;

public record GridSettings(
        String bind,
        int port,
        int serverWorkers,
        int dispatcherWorkers,
        long defaultTimeoutMs,
        long fairShareHalfLifeMs,
        long fairShareWindowMs,
        int maxClaimAttempts,
        int tierScanLimit,
        long resourceSilenceMs,
        long configRefreshMs
) {
    public static final long DEFAULT_HALF_LIFE_SECONDS = 900L;
    public static final long DEFAULT_WINDOW_SECONDS = 3600L;
    public static final int DEFAULT_MAX_CLAIM_ATTEMPTS = 5;
    public static final int DEFAULT_TIER_SCAN_LIMIT = 256;
    public static final long DEFAULT_RESOURCE_SILENCE_SECONDS = 600L;

    public static GridSettings defaults() {
        return from(new JsonConfigurationSource(null));
    }

    public static GridSettings from(ConfigurationSource config) {
        long halfLifeSeconds = positive(config, "/Operations/FairShare/HalfLifeSeconds", DEFAULT_HALF_LIFE_SECONDS);
        long windowSeconds = positive(config, "/Operations/FairShare/WindowSeconds", DEFAULT_WINDOW_SECONDS);
        return new GridSettings(
                config.getString("/Server/Bind", "0.0.0.0"),
                (int) config.getLong("/Server/Port", 9135L),
                (int) positive(config, "/Server/Workers", 16L),
                (int) positive(config, "/Server/DispatcherWorkers", 16L),
                positive(config, "/Server/DefaultTimeoutMs", 30_000L),
                halfLifeSeconds * 1000L,
                windowSeconds * 1000L,
                (int) positive(config, "/Operations/Matcher/MaxClaimAttempts", DEFAULT_MAX_CLAIM_ATTEMPTS),
                (int) positive(config, "/Operations/Matcher/TierScanLimit", DEFAULT_TIER_SCAN_LIMIT),
                positive(config, "/Operations/Matcher/ResourceSilenceSeconds", DEFAULT_RESOURCE_SILENCE_SECONDS) * 1000L,
                positive(config, "/Server/ConfigRefreshSeconds", 60L) * 1000L
        );
    }

    private static long positive(ConfigurationSource config, String path, long fallback) {
        long value = config.getLong(path, fallback);
        if (value <= 0) {
            throw new ConfigurationException(path, "value must be positive");
        }
        return value;
    }
}
