package io.gridmesh.jobs;

@FunctionalInterface
public interface JobListener {
    void onTransition(JobDescriptor before, JobDescriptor after);

    default void onTokenBound(String owner, String idempotencyToken, String jobId) {
    }
}
