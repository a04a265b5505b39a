package io.gridmesh.service;

import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.authz.MethodPolicy;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.observability.AuditEvent;
import io.gridmesh.observability.AuditTrail;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.CallContext;
import io.gridmesh.rpc.RpcRequest;
import io.gridmesh.rpc.ServiceDispatcher;
import io.gridmesh.security.Credential;
import io.gridmesh.security.Property;

import java.util.Map;
import java.util.Optional;

public final class JobManagerService {
    public static final String SYSTEM = "WorkloadManagement";
    public static final String SERVICE = "JobManager";
    public static final MethodPolicy SUBMIT = MethodPolicy.anyOf(Property.NORMAL_USER, Property.JOB_ADMINISTRATOR);

    private final JobQueue queue;
    private final AuditTrail audit;

    public JobManagerService(JobQueue queue, AuditTrail audit) {
        this.queue = queue;
        this.audit = audit == null ? AuditTrail.NONE : audit;
    }

    public void register(ServiceDispatcher dispatcher) {
        dispatcher.setDefaultPolicy(SYSTEM, SERVICE, MethodPolicy.authenticated());
        dispatcher.register(SYSTEM, SERVICE, "submit", SUBMIT, this::submit);
        dispatcher.register(SYSTEM, SERVICE, "cancel", null, this::cancel);
        dispatcher.register(SYSTEM, SERVICE, "getJobStatus", null, this::getJobStatus);
    }

    Result<String> submit(RpcRequest request, CallContext context) {
        Credential caller = context.credential();
        Result<JobSubmission> submission = ServiceArgs.convert(request.arg(0, "job"), JobSubmission.class, "job");
        if (submission.isFailure()) {
            return submission.asFailure();
        }
        JobSubmission job = submission.value();
        Result<JobDescriptor> admitted = queue.enqueue(
                JobDescriptor.submission(caller.subject(), caller.primaryGroup(), job.priority(), job.requirements(), job.payload()),
                request.textArg(1, "idempotencyToken"));
        if (admitted.isOk()) {
            audit.record(AuditEvent.of("job.submit", caller, SYSTEM + "/" + SERVICE, "ok",
                    Map.of("priority", admitted.value().priority())).withJob(admitted.value().jobId()));
        }
        return admitted.map(JobDescriptor::jobId);
    }

    Result<JobDescriptor> cancel(RpcRequest request, CallContext context) {
        Result<JobDescriptor> job = visibleJob(request, context.credential(), Property.JOB_ADMINISTRATOR);
        if (job.isFailure()) {
            return job;
        }
        Result<JobDescriptor> cancelled = queue.cancel(job.value().jobId());
        audit.record(AuditEvent.of("job.cancel", context.credential(), SYSTEM + "/" + SERVICE,
                cancelled.isOk() ? "ok" : cancelled.failure().code().wireName(), Map.of()).withJob(job.value().jobId()));
        return cancelled;
    }

    Result<JobDescriptor> getJobStatus(RpcRequest request, CallContext context) {
        return visibleJob(request, context.credential(), Property.JOB_ADMINISTRATOR, Property.OPERATOR);
    }

    // Owners see their own jobs; the listed properties see every job.
    private Result<JobDescriptor> visibleJob(RpcRequest request, Credential caller, Property... overriding) {
        Result<String> jobId = ServiceArgs.requireText(request.textArg(0, "jobId"), "jobId");
        if (jobId.isFailure()) {
            return jobId.asFailure();
        }
        Optional<JobDescriptor> job = queue.get(jobId.value());
        if (job.isEmpty()) {
            return Result.fail(ErrorCode.INVALID_JOB, "no such job: " + jobId.value());
        }
        if (caller.subject().equals(job.get().owner())
                || AuthorizationEngine.permits(caller, MethodPolicy.anyOf(overriding))) {
            return Result.ok(job.get());
        }
        return Result.fail(ErrorCode.UNAUTHORIZED, AuthorizationEngine.DENIED_MESSAGE);
    }
}
