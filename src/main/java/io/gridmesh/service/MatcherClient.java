package io.gridmesh.service;

import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.matching.MatchOutcome;
import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.result.ResultCodec;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.RpcClient;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

public final class MatcherClient {
    private final RpcClient rpc;

    public MatcherClient(RpcClient rpc) {
        this.rpc = rpc;
    }

    public Result<ResourceDescriptor> registerOrRefresh(ResourceDescriptor resource) {
        return rpc.call(MatcherService.SYSTEM, MatcherService.SERVICE, "registerOrRefresh", List.of(resource), Map.of())
                .flatMap(node -> ResultCodec.convert(node, ResourceDescriptor.class));
    }

    public Result<MatchOutcome> requestMatch(String resourceId) {
        return rpc.call(MatcherService.SYSTEM, MatcherService.SERVICE, "requestMatch", Arrays.asList(resourceId), Map.of())
                .flatMap(node -> ResultCodec.convert(node, MatchOutcome.class));
    }

    public Result<JobDescriptor> reportStatus(String jobId, MatcherService.ReportedOutcome outcome) {
        return rpc.call(MatcherService.SYSTEM, MatcherService.SERVICE, "reportStatus", List.of(jobId, outcome.name()), Map.of())
                .flatMap(node -> ResultCodec.convert(node, JobDescriptor.class));
    }
}
