package io.gridmesh.service;

import io.gridmesh.TestClock;
import io.gridmesh.TestPki;
import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.jobs.JobRequirements;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.jobs.SiteAccessPolicy;
import io.gridmesh.matching.FairShareTracker;
import io.gridmesh.matching.MatchOutcome;
import io.gridmesh.matching.MatchingEngine;
import io.gridmesh.matching.ResourceLoadAccounting;
import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.registry.ResourceRegistry;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.CallContext;
import io.gridmesh.rpc.RpcRequest;
import io.gridmesh.security.Credential;
import io.gridmesh.security.Property;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class MatcherServiceTest {
    private static final Credential PILOT = TestPki.credential("pilot-proxy-chain.pem")
            .withGroupsAndProperties(List.of("gridmesh_pilot"), Set.of(Property.GENERIC_PILOT));
    private static final Credential OTHER_PILOT = TestPki.credential("bob.pem")
            .withGroupsAndProperties(List.of("gridmesh_pilot"), Set.of(Property.GENERIC_PILOT));

    private final TestClock clock = new TestClock(1_000_000L);
    private final JobQueue queue = new JobQueue(SiteAccessPolicy.OPEN, clock);
    private final ResourceRegistry registry = new ResourceRegistry(() -> 600_000L, clock, queue::countHeldBy);
    private final MatcherService service = new MatcherService(registry, queue, new MatchingEngine(queue,
            new FairShareTracker(clock, 900_000L, 3_600_000L, group -> 1.0), new AuthorizationEngine(), 5, 256));

    MatcherServiceTest() {
        queue.addListener(new ResourceLoadAccounting(registry));
    }

    @Test
    void registrationStampsTheCallingAgent() {
        ResourceDescriptor stored = register(PILOT, "slot-1").value();
        Assertions.assertEquals("CN=pilot-agent,OU=Pilots,O=GridMesh", stored.agentSubject());
        Assertions.assertEquals(clock.millis(), stored.lastSeenMs());

        Result<ResourceDescriptor> takeover = register(OTHER_PILOT, "slot-1");
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, takeover.code());
    }

    @Test
    void requestMatchNeedsAnOwnedResource() {
        Assertions.assertEquals(ErrorCode.INVALID_JOB, requestMatch(PILOT, null).code());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, requestMatch(PILOT, "slot-unknown").code());

        register(PILOT, "slot-1");
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, requestMatch(OTHER_PILOT, "slot-1").code());
        Assertions.assertFalse(requestMatch(PILOT, null).value().matched());

        register(PILOT, "slot-2");
        Assertions.assertEquals(ErrorCode.INVALID_JOB, requestMatch(PILOT, null).code());
    }

    @Test
    void onlyTheHoldingAgentReportsProgress() {
        String jobId = queue.enqueue(JobDescriptor.submission("CN=alice,OU=Users,O=GridMesh", "gridmesh_user", 1,
                JobRequirements.NONE, null)).value().jobId();
        register(PILOT, "slot-1");
        register(OTHER_PILOT, "slot-2");
        MatchOutcome outcome = requestMatch(PILOT, "slot-1").value();
        Assertions.assertEquals(jobId, outcome.job().jobId());
        Assertions.assertEquals(1, registry.get("slot-1").orElseThrow().load());

        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, report(OTHER_PILOT, jobId, "running").code());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, report(PILOT, jobId, "exploded").code());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, report(PILOT, "no-such-job", "running").code());

        Assertions.assertEquals(JobStatus.RUNNING, report(PILOT, jobId, "running").value().status());
        Assertions.assertEquals(JobStatus.DONE, report(PILOT, jobId, "done").value().status());
        Assertions.assertEquals(0, registry.get("slot-1").orElseThrow().load());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, report(PILOT, jobId, "done").code());
    }

    @Test
    void releasedJobReturnsToTheQueue() {
        String jobId = queue.enqueue(JobDescriptor.submission("CN=alice,OU=Users,O=GridMesh", "gridmesh_user", 1,
                JobRequirements.NONE, null)).value().jobId();
        register(PILOT, "slot-1");
        requestMatch(PILOT, "slot-1");

        Assertions.assertEquals(JobStatus.WAITING, report(PILOT, jobId, "released").value().status());
        Assertions.assertTrue(requestMatch(PILOT, "slot-1").value().matched());
    }

    @Test
    void reRegisteredResourceStillCountsItsRunningJob() {
        String running = queue.enqueue(JobDescriptor.submission("CN=alice,OU=Users,O=GridMesh", "gridmesh_user", 1,
                JobRequirements.NONE, null)).value().jobId();
        register(PILOT, "slot-1");
        requestMatch(PILOT, "slot-1");
        report(PILOT, running, "running");

        registry.evictExpired(clock.millis() + 3_600_000L);
        Assertions.assertTrue(registry.get("slot-1").isEmpty());
        Assertions.assertEquals(JobStatus.RUNNING, queue.get(running).orElseThrow().status());

        Assertions.assertEquals(1, register(PILOT, "slot-1").value().load());
        queue.enqueue(JobDescriptor.submission("CN=alice,OU=Users,O=GridMesh", "gridmesh_user", 1,
                JobRequirements.NONE, null));
        Assertions.assertFalse(requestMatch(PILOT, "slot-1").value().matched());

        Assertions.assertEquals(JobStatus.DONE, report(PILOT, running, "done").value().status());
        Assertions.assertEquals(0, registry.get("slot-1").orElseThrow().load());
        Assertions.assertTrue(requestMatch(PILOT, "slot-1").value().matched());
    }

    private Result<ResourceDescriptor> register(Credential caller, String resourceId) {
        ResourceDescriptor resource = ResourceDescriptor.of(resourceId, "LCG.CERN.ch", "linux64", Set.of());
        return service.registerOrRefresh(RpcRequest.of("registerOrRefresh", List.of(resource), Map.of()),
                CallContext.of(caller, 0L));
    }

    private Result<MatchOutcome> requestMatch(Credential caller, String resourceId) {
        return service.requestMatch(RpcRequest.of("requestMatch", Arrays.asList(resourceId), Map.of()),
                CallContext.of(caller, 0L));
    }

    private Result<JobDescriptor> report(Credential caller, String jobId, String outcome) {
        return service.reportStatus(RpcRequest.of("reportStatus", List.of(jobId, outcome), Map.of()),
                CallContext.of(caller, 0L));
    }
}
