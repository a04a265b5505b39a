package io.gridmesh.service;

import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.matching.MatchOutcome;
import io.gridmesh.matching.MatchingEngine;
import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.registry.ResourceRegistry;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.CallContext;
import io.gridmesh.rpc.RpcRequest;
import io.gridmesh.rpc.ServiceDispatcher;
import io.gridmesh.security.Credential;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

public final class MatcherService {
    public static final String SYSTEM = "WorkloadManagement";
    public static final String SERVICE = "Matcher";

    public enum ReportedOutcome {
        RUNNING,
        DONE,
        FAILED,
        // Execution failed before the job started; the job goes back to Waiting.
        RELEASED
    }

    private final ResourceRegistry registry;
    private final JobQueue queue;
    private final MatchingEngine engine;

    public MatcherService(ResourceRegistry registry, JobQueue queue, MatchingEngine engine) {
        this.registry = registry;
        this.queue = queue;
        this.engine = engine;
    }

    public void register(ServiceDispatcher dispatcher) {
        dispatcher.setDefaultPolicy(SYSTEM, SERVICE, MatchingEngine.REQUEST_WORK);
        dispatcher.register(SYSTEM, SERVICE, "registerOrRefresh", null, this::registerOrRefresh);
        dispatcher.register(SYSTEM, SERVICE, "requestMatch", null, this::requestMatch);
        dispatcher.register(SYSTEM, SERVICE, "reportStatus", null, this::reportStatus);
    }

    Result<ResourceDescriptor> registerOrRefresh(RpcRequest request, CallContext context) {
        return ServiceArgs.convert(request.arg(0, "resource"), ResourceDescriptor.class, "resource")
                .flatMap(resource -> registry.registerOrRefresh(resource, context.credential().subject()));
    }

    Result<MatchOutcome> requestMatch(RpcRequest request, CallContext context) {
        Credential caller = context.credential();
        Result<ResourceDescriptor> resource = ownedResource(request.textArg(0, "resourceId"), caller);
        if (resource.isFailure()) {
            return resource.asFailure();
        }
        ResourceDescriptor current = registry.touch(resource.value().resourceId()).orElse(resource.value());
        return engine.requestMatch(current, caller);
    }

    Result<JobDescriptor> reportStatus(RpcRequest request, CallContext context) {
        Result<String> jobId = ServiceArgs.requireText(request.textArg(0, "jobId"), "jobId");
        Result<String> rawOutcome = ServiceArgs.requireText(request.textArg(1, "outcome"), "outcome");
        if (jobId.isFailure()) {
            return jobId.asFailure();
        }
        if (rawOutcome.isFailure()) {
            return rawOutcome.asFailure();
        }
        ReportedOutcome outcome;
        try {
            outcome = ReportedOutcome.valueOf(rawOutcome.value().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return Result.fail(ErrorCode.INVALID_JOB, "unknown outcome: " + rawOutcome.value());
        }
        Optional<JobDescriptor> job = queue.get(jobId.value());
        if (job.isEmpty()) {
            return Result.fail(ErrorCode.INVALID_JOB, "no such job: " + jobId.value());
        }
        String resourceId = job.get().matchedResource();
        Optional<ResourceDescriptor> holder = registry.get(resourceId);
        if (resourceId == null || holder.isEmpty() || !context.credential().subject().equals(holder.get().agentSubject())) {
            return Result.fail(ErrorCode.UNAUTHORIZED, "access denied");
        }
        registry.touch(resourceId);
        return switch (outcome) {
            case RUNNING -> queue.markRunning(jobId.value(), resourceId);
            case DONE -> queue.complete(jobId.value(), JobStatus.DONE, resourceId);
            case FAILED -> queue.complete(jobId.value(), JobStatus.FAILED, resourceId);
            case RELEASED -> queue.release(jobId.value(), resourceId);
        };
    }

    private Result<ResourceDescriptor> ownedResource(String resourceId, Credential caller) {
        if (resourceId != null) {
            Optional<ResourceDescriptor> found = registry.get(resourceId);
            if (found.isEmpty()) {
                return Result.fail(ErrorCode.INVALID_JOB, "resource is not registered: " + resourceId);
            }
            if (!caller.subject().equals(found.get().agentSubject())) {
                return Result.fail(ErrorCode.UNAUTHORIZED, "access denied");
            }
            return Result.ok(found.get());
        }
        List<ResourceDescriptor> mine = registry.findByAgent(caller.subject());
        if (mine.isEmpty()) {
            return Result.fail(ErrorCode.INVALID_JOB, "caller has no registered resource");
        }
        if (mine.size() > 1) {
            return Result.fail(ErrorCode.INVALID_JOB, "caller has several resources; name one");
        }
        return Result.ok(mine.get(0));
    }
}
