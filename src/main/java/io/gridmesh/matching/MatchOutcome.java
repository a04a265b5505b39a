package io.gridmesh.matching;

import io.gridmesh.jobs.JobDescriptor;

public record MatchOutcome(boolean matched, JobDescriptor job, String reason) {
    public static MatchOutcome of(JobDescriptor job) {
        return new MatchOutcome(true, job, null);
    }

    public static MatchOutcome noWork(String reason) {
        return new MatchOutcome(false, null, reason);
    }
}
