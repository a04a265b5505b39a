package io.gridmesh.matching;

import io.gridmesh.jobs.JobDescriptor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Recent matches per group, kept in fixed-width time buckets over a sliding window. A bucket of age
 * {@code a} counts {@code 0.5^(a / halfLife)} per match, so usage fades smoothly rather than
 * dropping off at the window edge.
 */
public final class FairShareTracker {
    static final int BUCKETS = 60;

    private final Clock clock;
    private final long halfLifeMs;
    private final long windowMs;
    private final long bucketMs;
    private final ToDoubleFunction<String> configuredShare;
    private final Map<String, GroupUsage> usage = new ConcurrentHashMap<>();

    public FairShareTracker(Clock clock, long halfLifeMs, long windowMs, ToDoubleFunction<String> configuredShare) {
        if (halfLifeMs <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("half-life and window must be positive");
        }
        this.clock = clock;
        this.halfLifeMs = halfLifeMs;
        this.windowMs = windowMs;
        this.bucketMs = Math.max(1L, windowMs / BUCKETS);
        this.configuredShare = configuredShare;
    }

    public void recordMatch(String group) {
        usage.computeIfAbsent(key(group), g -> new GroupUsage()).add(clock.millis() / bucketMs);
    }

    public double decayedUsage(String group) {
        GroupUsage groupUsage = usage.get(key(group));
        return groupUsage == null ? 0.0 : groupUsage.decayed(clock.millis());
    }

    public Set<String> overShare(Collection<String> competing) {
        long nowMs = clock.millis();
        Map<String, Double> used = new HashMap<>();
        LinkedHashSet<String> universe = new LinkedHashSet<>();
        for (String group : competing) {
            universe.add(key(group));
        }
        for (Map.Entry<String, GroupUsage> entry : usage.entrySet()) {
            double value = entry.getValue().decayed(nowMs);
            if (value > 0.0) {
                used.put(entry.getKey(), value);
                universe.add(entry.getKey());
            }
        }
        double totalUsage = 0.0;
        double totalShare = 0.0;
        Map<String, Double> shares = new HashMap<>();
        for (String group : universe) {
            double share = Math.max(0.0, configuredShare.applyAsDouble(group));
            shares.put(group, share);
            totalShare += share;
            totalUsage += used.getOrDefault(group, 0.0);
        }
        Set<String> over = new LinkedHashSet<>();
        if (totalUsage <= 0.0 || totalShare <= 0.0) {
            return over;
        }
        for (String group : universe) {
            double usageFraction = used.getOrDefault(group, 0.0) / totalUsage;
            double shareFraction = shares.get(group) / totalShare;
            if (usageFraction > shareFraction + 1e-9) {
                over.add(group);
            }
        }
        return over;
    }

    public List<JobDescriptor> reorder(List<JobDescriptor> tier) {
        if (tier.size() < 2) {
            return tier;
        }
        LinkedHashSet<String> groups = new LinkedHashSet<>();
        for (JobDescriptor job : tier) {
            groups.add(key(job.ownerGroup()));
        }
        if (groups.size() < 2) {
            return tier;
        }
        Set<String> over = overShare(groups);
        if (over.isEmpty()) {
            return tier;
        }
        List<JobDescriptor> ahead = new ArrayList<>(tier.size());
        List<JobDescriptor> behind = new ArrayList<>();
        for (JobDescriptor job : tier) {
            if (over.contains(key(job.ownerGroup()))) {
                behind.add(job);
            } else {
                ahead.add(job);
            }
        }
        ahead.addAll(behind);
        return ahead;
    }

    private static String key(String group) {
        return group == null ? "" : group;
    }

    private final class GroupUsage {
        private final Map<Long, Long> buckets = new HashMap<>();

        synchronized void add(long bucket) {
            buckets.merge(bucket, 1L, Long::sum);
        }

        synchronized double decayed(long nowMs) {
            long oldest = (nowMs - windowMs) / bucketMs;
            buckets.keySet().removeIf(bucket -> bucket < oldest);
            double total = 0.0;
            for (Map.Entry<Long, Long> entry : buckets.entrySet()) {
                long ageMs = Math.max(0L, nowMs - entry.getKey() * bucketMs);
                total += entry.getValue() * Math.pow(0.5, (double) ageMs / halfLifeMs);
            }
            return total;
        }
    }
}
