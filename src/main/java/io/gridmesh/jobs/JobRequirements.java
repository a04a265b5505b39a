package io.gridmesh.jobs;

import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record JobRequirements(
        Set<String> platforms,
        Set<String> siteWhitelist,
        Set<String> siteBlacklist,
        Set<String> requiredTags,
        long minMemoryMb,
        int minCpus
) {
    public static final JobRequirements NONE = new JobRequirements(null, null, null, null, 0L, 0);

    public JobRequirements {
        platforms = clean(platforms);
        siteWhitelist = clean(siteWhitelist);
        siteBlacklist = clean(siteBlacklist);
        requiredTags = clean(requiredTags);
    }

    public static JobRequirements platform(String platform) {
        return new JobRequirements(Set.of(platform), null, null, null, 0L, 0);
    }

    public Result<JobRequirements> validate() {
        if (minMemoryMb < 0 || minCpus < 0) {
            return Result.fail(ErrorCode.INVALID_JOB, "resource minimums must not be negative");
        }
        if (!siteWhitelist.isEmpty() && siteBlacklist.containsAll(siteWhitelist)) {
            return Result.fail(ErrorCode.INVALID_JOB, "every whitelisted site is also blacklisted");
        }
        return Result.ok(this);
    }

    public boolean satisfiedBy(ResourceDescriptor resource) {
        if (!platforms.isEmpty() && (resource.platform() == null || !platforms.contains(resource.platform()))) {
            return false;
        }
        String site = resource.site();
        if (!siteWhitelist.isEmpty() && (site == null || !siteWhitelist.contains(site))) {
            return false;
        }
        if (site != null && siteBlacklist.contains(site)) {
            return false;
        }
        if (!resource.tags().containsAll(requiredTags)) {
            return false;
        }
        return resource.memoryMb() >= minMemoryMb && resource.cpus() >= minCpus;
    }

    private static Set<String> clean(Set<String> values) {
        if (values == null || values.isEmpty()) {
            return Set.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return Collections.unmodifiableSet(out);
    }
}
