package io.gridmesh.service;

import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.result.ResultCodec;
import io.gridmesh.rpc.RpcClient;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class JobManagerClient {
    private final RpcClient rpc;

    public JobManagerClient(RpcClient rpc) {
        this.rpc = rpc;
    }

    public Result<String> submit(JobSubmission job) {
        return submit(job, UUID.randomUUID().toString());
    }

    public Result<String> submit(JobSubmission job, String idempotencyToken) {
        return rpc.call(JobManagerService.SYSTEM, JobManagerService.SERVICE, "submit", Arrays.asList(job, idempotencyToken), Map.of())
                .<String>flatMap(node -> node != null && node.isTextual()
                        ? Result.ok(node.asText())
                        : Result.fail(ErrorCode.INTERNAL_ERROR, "submit answered without a job id"));
    }

    public Result<JobDescriptor> cancel(String jobId) {
        return rpc.call(JobManagerService.SYSTEM, JobManagerService.SERVICE, "cancel", List.of(jobId), Map.of())
                .flatMap(node -> ResultCodec.convert(node, JobDescriptor.class));
    }

    public Result<JobDescriptor> getJobStatus(String jobId) {
        return rpc.call(JobManagerService.SYSTEM, JobManagerService.SERVICE, "getJobStatus", List.of(jobId), Map.of())
                .flatMap(node -> ResultCodec.convert(node, JobDescriptor.class));
    }
}
