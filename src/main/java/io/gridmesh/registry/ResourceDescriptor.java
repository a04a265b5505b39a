package io.gridmesh.registry;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record ResourceDescriptor(
        String resourceId,
        String site,
        String platform,
        Set<String> tags,
        long memoryMb,
        int cpus,
        int capacity,
        int load,
        String agentSubject,
        long lastSeenMs
) {
    public ResourceDescriptor {
        resourceId = trimToNull(resourceId);
        site = trimToNull(site);
        platform = trimToNull(platform);
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        capacity = capacity <= 0 ? 1 : capacity;
        load = Math.max(0, load);
    }

    public static ResourceDescriptor of(String resourceId, String site, String platform, Set<String> tags) {
        return new ResourceDescriptor(resourceId, site, platform, tags, 0L, 1, 1, 0, null, 0L);
    }

    public boolean atCapacity() {
        return load >= capacity;
    }

    public ResourceDescriptor withLoad(int newLoad) {
        return new ResourceDescriptor(resourceId, site, platform, tags, memoryMb, cpus, capacity, newLoad, agentSubject, lastSeenMs);
    }

    public ResourceDescriptor withCapacity(int newCapacity) {
        return new ResourceDescriptor(resourceId, site, platform, tags, memoryMb, cpus, newCapacity, load, agentSubject, lastSeenMs);
    }

    public ResourceDescriptor seen(String subject, long nowMs) {
        return new ResourceDescriptor(resourceId, site, platform, tags, memoryMb, cpus, capacity, load, subject, nowMs);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
