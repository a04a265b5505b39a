package io.gridmesh.jobs;

import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

public final class JobQueue {
    private static final Logger log = LoggerFactory.getLogger(JobQueue.class);

    static final Comparator<IndexEntry> ORDER = Comparator
            .comparingInt(IndexEntry::priority).reversed()
            .thenComparingLong(IndexEntry::submittedAtMs)
            .thenComparingLong(IndexEntry::sequence)
            .thenComparing(IndexEntry::jobId);

    private final Map<String, AtomicReference<JobDescriptor>> jobs = new ConcurrentHashMap<>();
    private final ConcurrentSkipListSet<IndexEntry> waiting = new ConcurrentSkipListSet<>(ORDER);
    private final Map<String, String> idempotencyTokens = new ConcurrentHashMap<>();
    private final List<JobListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final SiteAccessPolicy siteAccess;
    private final Clock clock;

    public JobQueue(SiteAccessPolicy siteAccess, Clock clock) {
        this.siteAccess = siteAccess == null ? SiteAccessPolicy.OPEN : siteAccess;
        this.clock = clock;
    }

    public void addListener(JobListener listener) {
        listeners.add(listener);
    }

    public Result<JobDescriptor> enqueue(JobDescriptor job) {
        return enqueue(job, null);
    }

    public Result<JobDescriptor> enqueue(JobDescriptor job, String idempotencyToken) {
        if (job == null) {
            return Result.fail(ErrorCode.INVALID_JOB, "job descriptor is missing");
        }
        if (job.owner() == null || job.owner().isBlank()) {
            return Result.fail(ErrorCode.INVALID_JOB, "job has no owner");
        }
        Result<JobRequirements> valid = job.requirements().validate();
        if (valid.isFailure()) {
            return valid.asFailure();
        }
        String id = job.jobId() == null || job.jobId().isBlank() ? UUID.randomUUID().toString() : job.jobId().trim();
        JobDescriptor admitted = job.admitted(id, clock.millis(), sequence.incrementAndGet());
        if (jobs.putIfAbsent(id, new AtomicReference<>(admitted)) != null) {
            return Result.fail(ErrorCode.INVALID_JOB, "job id already in use: " + id);
        }
        if (idempotencyToken != null && !idempotencyToken.isBlank()) {
            String key = tokenKey(job.owner(), idempotencyToken.trim());
            String winner = idempotencyTokens.putIfAbsent(key, id);
            if (winner != null) {
                jobs.remove(id);
                AtomicReference<JobDescriptor> existing = jobs.get(winner);
                log.debug("Idempotent resubmission by {} resolved to job {}", job.owner(), winner);
                return existing == null
                        ? Result.fail(ErrorCode.UNAVAILABLE, "job for idempotency token is being recovered")
                        : Result.ok(existing.get());
            }
        }
        waiting.add(IndexEntry.of(admitted));
        notifyListeners(null, admitted);
        if (idempotencyToken != null && !idempotencyToken.isBlank()) {
            for (JobListener listener : listeners) {
                try {
                    listener.onTokenBound(job.owner(), idempotencyToken.trim(), id);
                } catch (RuntimeException e) {
                    log.error("Job listener {} failed to bind token for {}", listener, id, e);
                }
            }
        }
        return Result.ok(admitted);
    }

    /**
     * Lazy, restartable sequence of Waiting jobs the resource can run, in scheduling order. Each
     * call to {@code iterator()} starts a fresh scan; a job claimed elsewhere mid-scan is skipped.
     */
    public Iterable<JobDescriptor> peekCandidates(ResourceDescriptor resource) {
        Predicate<JobDescriptor> eligible = job -> job.status() == JobStatus.WAITING
                && job.requirements().satisfiedBy(resource)
                && siteAccess.permits(resource.site(), job.ownerGroup());
        return () -> new CandidateIterator(waiting.iterator(), eligible);
    }

    public Result<JobDescriptor> claim(String jobId, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            return Result.fail(ErrorCode.INVALID_JOB, "claim needs a resource id");
        }
        return transition(jobId,
                job -> job.status() == JobStatus.WAITING,
                job -> job.transitioned(JobStatus.MATCHED, resourceId, clock.millis()),
                ErrorCode.ALREADY_MATCHED, "job is no longer waiting");
    }

    public Result<JobDescriptor> release(String jobId) {
        return release(jobId, null);
    }

    public Result<JobDescriptor> release(String jobId, String expectedResource) {
        return transition(jobId,
                job -> job.status() == JobStatus.MATCHED && matches(job, expectedResource),
                job -> job.transitioned(JobStatus.WAITING, null, clock.millis()),
                ErrorCode.INVALID_JOB, "job is not matched to this resource");
    }

    public Result<JobDescriptor> markRunning(String jobId, String expectedResource) {
        return transition(jobId,
                job -> job.status() == JobStatus.MATCHED && matches(job, expectedResource),
                job -> job.transitioned(JobStatus.RUNNING, job.matchedResource(), clock.millis()),
                ErrorCode.INVALID_JOB, "job is not matched to this resource");
    }

    public Result<JobDescriptor> complete(String jobId, JobStatus outcome) {
        return complete(jobId, outcome, null);
    }

    public Result<JobDescriptor> complete(String jobId, JobStatus outcome, String expectedResource) {
        if (outcome != JobStatus.DONE && outcome != JobStatus.FAILED) {
            return Result.fail(ErrorCode.INVALID_JOB, "completion outcome must be DONE or FAILED");
        }
        return transition(jobId,
                job -> (job.status() == JobStatus.MATCHED || job.status() == JobStatus.RUNNING)
                        && matches(job, expectedResource),
                job -> job.transitioned(outcome, job.matchedResource(), clock.millis()),
                ErrorCode.INVALID_JOB, "job is not matched or running");
    }

    public Result<JobDescriptor> cancel(String jobId) {
        return transition(jobId,
                job -> job.status() == JobStatus.WAITING || job.status() == JobStatus.MATCHED,
                job -> job.transitioned(JobStatus.KILLED, job.matchedResource(), clock.millis()),
                ErrorCode.INVALID_JOB, "only waiting or matched jobs can be cancelled");
    }

    // Returns every job Matched to the resource to Waiting; used when the resource is evicted.
    public int releaseAllMatchedTo(String resourceId) {
        int released = 0;
        for (AtomicReference<JobDescriptor> ref : jobs.values()) {
            JobDescriptor job = ref.get();
            if (job.status() == JobStatus.MATCHED && resourceId.equals(job.matchedResource())
                    && release(job.jobId(), resourceId).isOk()) {
                released++;
            }
        }
        if (released > 0) {
            log.info("Released {} job(s) matched to evicted resource {}", released, resourceId);
        }
        return released;
    }

    public Optional<JobDescriptor> get(String jobId) {
        AtomicReference<JobDescriptor> ref = jobId == null ? null : jobs.get(jobId);
        return ref == null ? Optional.empty() : Optional.of(ref.get());
    }

    public int countHeldBy(String resourceId) {
        int held = 0;
        for (AtomicReference<JobDescriptor> ref : jobs.values()) {
            JobDescriptor job = ref.get();
            if ((job.status() == JobStatus.MATCHED || job.status() == JobStatus.RUNNING)
                    && resourceId != null && resourceId.equals(job.matchedResource())) {
                held++;
            }
        }
        return held;
    }

    public Map<JobStatus, Integer> countByStatus() {
        Map<JobStatus, Integer> out = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            out.put(status, 0);
        }
        for (AtomicReference<JobDescriptor> ref : jobs.values()) {
            out.merge(ref.get().status(), 1, Integer::sum);
        }
        return out;
    }

    public int size() {
        return jobs.size();
    }

    public int restore(Collection<JobDescriptor> journaled, Map<String, String> tokensByOwnerAndToken) {
        if (tokensByOwnerAndToken != null) {
            idempotencyTokens.putAll(tokensByOwnerAndToken);
        }
        List<JobDescriptor> sorted = new ArrayList<>(journaled);
        sorted.sort(Comparator.comparingLong(JobDescriptor::sequence));
        int restored = 0;
        for (JobDescriptor job : sorted) {
            JobDescriptor current = job;
            if (job.status() == JobStatus.MATCHED) {
                current = job.transitioned(JobStatus.WAITING, null, clock.millis());
            }
            if (jobs.putIfAbsent(current.jobId(), new AtomicReference<>(current)) != null) {
                continue;
            }
            sequence.accumulateAndGet(current.sequence(), Math::max);
            if (current.status() == JobStatus.WAITING) {
                waiting.add(IndexEntry.of(current));
            }
            restored++;
        }
        return restored;
    }

    private Result<JobDescriptor> transition(
            String jobId,
            Predicate<JobDescriptor> allowed,
            UnaryOperator<JobDescriptor> next,
            ErrorCode rejection,
            String rejectionMessage
    ) {
        AtomicReference<JobDescriptor> ref = jobId == null ? null : jobs.get(jobId);
        if (ref == null) {
            return Result.fail(ErrorCode.INVALID_JOB, "no such job: " + jobId);
        }
        while (true) {
            JobDescriptor current = ref.get();
            if (!allowed.test(current)) {
                return Result.fail(rejection, rejectionMessage + " (" + jobId + " is " + current.status() + ")");
            }
            JobDescriptor updated = next.apply(current);
            if (ref.compareAndSet(current, updated)) {
                reindex(ref, current, updated);
                notifyListeners(current, updated);
                return Result.ok(updated);
            }
        }
    }

    // The index key never changes for a job, so a release racing this removal is repaired by the
    // re-check.
    private void reindex(AtomicReference<JobDescriptor> ref, JobDescriptor before, JobDescriptor after) {
        IndexEntry entry = IndexEntry.of(after);
        if (before.status() == JobStatus.WAITING && after.status() != JobStatus.WAITING) {
            waiting.remove(entry);
            if (ref.get().status() == JobStatus.WAITING) {
                waiting.add(entry);
            }
        } else if (after.status() == JobStatus.WAITING) {
            waiting.add(entry);
        }
    }

    private void notifyListeners(JobDescriptor before, JobDescriptor after) {
        for (JobListener listener : listeners) {
            try {
                listener.onTransition(before, after);
            } catch (RuntimeException e) {
                log.error("Job listener {} failed on {} -> {}", listener, after.jobId(), after.status(), e);
            }
        }
    }

    public static String tokenKey(String owner, String token) {
        return owner + "\n" + token;
    }

    private static boolean matches(JobDescriptor job, String expectedResource) {
        return expectedResource == null || expectedResource.equals(job.matchedResource());
    }

    record IndexEntry(int priority, long submittedAtMs, long sequence, String jobId) {
        static IndexEntry of(JobDescriptor job) {
            return new IndexEntry(job.priority(), job.submittedAtMs(), job.sequence(), job.jobId());
        }
    }

    private final class CandidateIterator implements Iterator<JobDescriptor> {
        private final Iterator<IndexEntry> index;
        private final Predicate<JobDescriptor> eligible;
        private JobDescriptor next;

        CandidateIterator(Iterator<IndexEntry> index, Predicate<JobDescriptor> eligible) {
            this.index = index;
            this.eligible = eligible;
        }

        @Override
        public boolean hasNext() {
            while (next == null && index.hasNext()) {
                AtomicReference<JobDescriptor> ref = jobs.get(index.next().jobId());
                JobDescriptor job = ref == null ? null : ref.get();
                if (job != null && eligible.test(job)) {
                    next = job;
                }
            }
            return next != null;
        }

        @Override
        public JobDescriptor next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            JobDescriptor out = next;
            next = null;
            return out;
        }
    }
}
