package io.gridmesh.matching;

import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobListener;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.registry.ResourceRegistry;

public final class ResourceLoadAccounting implements JobListener {
    private final ResourceRegistry registry;

    public ResourceLoadAccounting(ResourceRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onTransition(JobDescriptor before, JobDescriptor after) {
        boolean heldBefore = before != null && held(before.status());
        boolean heldAfter = held(after.status());
        if (!heldBefore && heldAfter) {
            registry.adjustLoad(after.matchedResource(), 1);
        } else if (heldBefore && !heldAfter) {
            registry.adjustLoad(before.matchedResource(), -1);
        }
    }

    private static boolean held(JobStatus status) {
        return status == JobStatus.MATCHED || status == JobStatus.RUNNING;
    }
}
