package io.gridmesh.registry;

import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.ToIntFunction;

public final class ResourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ResourceRegistry.class);

    private final Map<String, ResourceDescriptor> resources = new ConcurrentHashMap<>();
    private final List<Consumer<ResourceDescriptor>> evictionListeners = new CopyOnWriteArrayList<>();
    private final LongSupplier silenceMs;
    private final Clock clock;
    private final ToIntFunction<String> heldJobs;

    public ResourceRegistry(LongSupplier silenceMs, Clock clock) {
        this(silenceMs, clock, resourceId -> 0);
    }

    public ResourceRegistry(LongSupplier silenceMs, Clock clock, ToIntFunction<String> heldJobs) {
        this.silenceMs = silenceMs;
        this.clock = clock;
        this.heldJobs = heldJobs;
    }

    public void onEviction(Consumer<ResourceDescriptor> listener) {
        evictionListeners.add(listener);
    }

    public Result<ResourceDescriptor> registerOrRefresh(ResourceDescriptor declared, String agentSubject) {
        if (declared == null || declared.resourceId() == null) {
            return Result.fail(ErrorCode.INVALID_JOB, "resource descriptor needs a resource id");
        }
        if (declared.site() == null) {
            return Result.fail(ErrorCode.INVALID_JOB, "resource descriptor needs a site");
        }
        if (agentSubject == null || agentSubject.isBlank()) {
            return Result.fail(ErrorCode.UNAUTHORIZED, "access denied");
        }
        long nowMs = clock.millis();
        int held = resources.containsKey(declared.resourceId()) ? 0 : heldJobs.applyAsInt(declared.resourceId());
        ResourceDescriptor[] stored = new ResourceDescriptor[1];
        boolean[] foreign = new boolean[1];
        resources.compute(declared.resourceId(), (id, existing) -> {
            if (existing != null && existing.agentSubject() != null && !existing.agentSubject().equals(agentSubject)) {
                foreign[0] = true;
                return existing;
            }
            int load = existing == null ? held : existing.load();
            stored[0] = declared.withLoad(load).seen(agentSubject, nowMs);
            return stored[0];
        });
        if (foreign[0]) {
            log.warn("Agent {} tried to take over resource {} owned by another agent", agentSubject, declared.resourceId());
            return Result.fail(ErrorCode.UNAUTHORIZED, "access denied");
        }
        return Result.ok(stored[0]);
    }

    public Optional<ResourceDescriptor> touch(String resourceId) {
        long nowMs = clock.millis();
        ResourceDescriptor updated = resources.computeIfPresent(resourceId,
                (id, existing) -> existing.seen(existing.agentSubject(), nowMs));
        return Optional.ofNullable(updated);
    }

    public Optional<ResourceDescriptor> get(String resourceId) {
        return resourceId == null ? Optional.empty() : Optional.ofNullable(resources.get(resourceId));
    }

    public List<ResourceDescriptor> findByAgent(String agentSubject) {
        List<ResourceDescriptor> out = new ArrayList<>();
        for (ResourceDescriptor resource : resources.values()) {
            if (resource.agentSubject() != null && resource.agentSubject().equals(agentSubject)) {
                out.add(resource);
            }
        }
        out.sort(Comparator.comparing(ResourceDescriptor::resourceId));
        return out;
    }

    public List<ResourceDescriptor> all() {
        List<ResourceDescriptor> out = new ArrayList<>(resources.values());
        out.sort(Comparator.comparing(ResourceDescriptor::resourceId));
        return out;
    }

    public Optional<ResourceDescriptor> adjustLoad(String resourceId, int delta) {
        if (resourceId == null) {
            return Optional.empty();
        }
        ResourceDescriptor updated = resources.computeIfPresent(resourceId,
                (id, existing) -> existing.withLoad(existing.load() + delta));
        return Optional.ofNullable(updated);
    }

    public List<ResourceDescriptor> evictExpired() {
        return evictExpired(clock.millis());
    }

    public List<ResourceDescriptor> evictExpired(long nowMs) {
        long cutoff = nowMs - Math.max(0L, silenceMs.getAsLong());
        List<ResourceDescriptor> evicted = new ArrayList<>();
        for (ResourceDescriptor resource : resources.values()) {
            if (resource.lastSeenMs() < cutoff && resources.remove(resource.resourceId(), resource)) {
                evicted.add(resource);
            }
        }
        for (ResourceDescriptor resource : evicted) {
            log.info("Evicted resource {} at {} (silent since {})", resource.resourceId(), resource.site(), resource.lastSeenMs());
            for (Consumer<ResourceDescriptor> listener : evictionListeners) {
                try {
                    listener.accept(resource);
                } catch (RuntimeException e) {
                    log.error("Eviction listener failed for resource {}", resource.resourceId(), e);
                }
            }
        }
        return evicted;
    }

    public int size() {
        return resources.size();
    }
}
