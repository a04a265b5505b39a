package io.gridmesh.matching;

import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.authz.MethodPolicy;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.security.Credential;
import io.gridmesh.security.Property;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Picks the job a resource should run next. Candidates come from the queue in priority order;
 * within one priority tier the fair-share tracker moves over-share groups to the back, and at most
 * {@code tierScanLimit} jobs of any one group are considered per tier. Claims are
 * optimistic: a claim lost to a concurrent resource moves on to the next candidate, up to a bounded
 * number of attempts, after which the answer is "no work". Never waits for work to appear.
 */
public final class MatchingEngine {
    public static final MethodPolicy REQUEST_WORK = MethodPolicy.anyOf(Property.GENERIC_PILOT);
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private final JobQueue queue;
    private final FairShareTracker fairShare;
    private final AuthorizationEngine authorization;
    private final int maxClaimAttempts;
    private final int tierScanLimit;

    public MatchingEngine(
            JobQueue queue,
            FairShareTracker fairShare,
            AuthorizationEngine authorization,
            int maxClaimAttempts,
            int tierScanLimit
    ) {
        this.queue = queue;
        this.fairShare = fairShare;
        this.authorization = authorization;
        this.maxClaimAttempts = Math.max(1, maxClaimAttempts);
        this.tierScanLimit = Math.max(1, tierScanLimit);
    }

    public Result<MatchOutcome> requestMatch(ResourceDescriptor resource, Credential caller) {
        Result<Void> allowed = authorization.authorize(caller, REQUEST_WORK, "requestMatch");
        if (allowed.isFailure()) {
            return allowed.asFailure();
        }
        if (resource == null || resource.resourceId() == null) {
            return Result.fail(ErrorCode.INVALID_JOB, "match request needs a registered resource");
        }
        if (resource.atCapacity()) {
            return Result.ok(MatchOutcome.noWork("resource is at capacity"));
        }
        int lostClaims = 0;
        Iterator<JobDescriptor> candidates = queue.peekCandidates(resource).iterator();
        JobDescriptor carried = null;
        while (carried != null || candidates.hasNext()) {
            List<JobDescriptor> tier = new ArrayList<>();
            Map<String, Integer> perGroup = new HashMap<>();
            JobDescriptor first = carried != null ? carried : candidates.next();
            carried = null;
            tier.add(first);
            perGroup.put(groupKey(first), 1);
            while (candidates.hasNext()) {
                JobDescriptor next = candidates.next();
                if (next.priority() != first.priority()) {
                    carried = next;
                    break;
                }
                // Bounded per group, not per tier.
                if (perGroup.merge(groupKey(next), 1, Integer::sum) <= tierScanLimit) {
                    tier.add(next);
                }
            }
            for (JobDescriptor candidate : fairShare.reorder(tier)) {
                Result<JobDescriptor> claimed = queue.claim(candidate.jobId(), resource.resourceId());
                if (claimed.isOk()) {
                    fairShare.recordMatch(claimed.value().ownerGroup());
                    log.info("Matched job {} (priority {}, group {}) to resource {} at {}",
                            claimed.value().jobId(), claimed.value().priority(), claimed.value().ownerGroup(),
                            resource.resourceId(), resource.site());
                    return Result.ok(MatchOutcome.of(claimed.value()));
                }
                if (claimed.hasCode(ErrorCode.ALREADY_MATCHED)) {
                    lostClaims++;
                    if (lostClaims >= maxClaimAttempts) {
                        log.debug("Resource {} gave up after {} lost claims", resource.resourceId(), lostClaims);
                        return Result.ok(MatchOutcome.noWork("candidates were claimed concurrently"));
                    }
                    continue;
                }
                return claimed.propagate("claim of " + candidate.jobId() + " failed");
            }
        }
        return Result.ok(MatchOutcome.noWork("no eligible job"));
    }

    private static String groupKey(JobDescriptor job) {
        return job.ownerGroup() == null ? "" : job.ownerGroup();
    }
}
