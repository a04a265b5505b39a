package io.gridmesh.jobs;

import com.fasterxml.jackson.databind.JsonNode;

public record JobDescriptor(
        String jobId,
        String owner,
        String ownerGroup,
        int priority,
        JobRequirements requirements,
        long submittedAtMs,
        long sequence,
        JobStatus status,
        String matchedResource,
        long updatedAtMs,
        JsonNode payload
) {
    public JobDescriptor {
        requirements = requirements == null ? JobRequirements.NONE : requirements;
        status = status == null ? JobStatus.WAITING : status;
    }

    public static JobDescriptor submission(String owner, String ownerGroup, int priority, JobRequirements requirements, JsonNode payload) {
        return new JobDescriptor(null, owner, ownerGroup, priority, requirements, 0L, 0L, JobStatus.WAITING, null, 0L, payload);
    }

    JobDescriptor admitted(String id, long nowMs, long seq) {
        long submitted = submittedAtMs > 0 ? submittedAtMs : nowMs;
        return new JobDescriptor(id, owner, ownerGroup, priority, requirements, submitted, seq, JobStatus.WAITING, null, nowMs, payload);
    }

    JobDescriptor transitioned(JobStatus next, String resource, long nowMs) {
        return new JobDescriptor(jobId, owner, ownerGroup, priority, requirements, submittedAtMs, sequence, next, resource, nowMs, payload);
    }
}
