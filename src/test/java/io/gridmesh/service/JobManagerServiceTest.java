package io.gridmesh.service;

import io.gridmesh.TestClock;
import io.gridmesh.TestPki;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.jobs.JobRequirements;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.jobs.SiteAccessPolicy;
import io.gridmesh.observability.AuditEvent;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.CallContext;
import io.gridmesh.rpc.RpcRequest;
import io.gridmesh.security.Credential;
import io.gridmesh.security.Property;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class JobManagerServiceTest {
    private static final Credential ALICE = TestPki.credential("alice.pem")
            .withGroupsAndProperties(List.of("gridmesh_user"), Set.of(Property.NORMAL_USER));
    private static final Credential BOB = TestPki.credential("bob.pem")
            .withGroupsAndProperties(List.of("gridmesh_user"), Set.of(Property.NORMAL_USER));
    private static final Credential ADMIN = TestPki.credential("bob.pem")
            .withGroupsAndProperties(List.of("gridmesh_admin"), Set.of(Property.JOB_ADMINISTRATOR));

    private final List<AuditEvent> events = new ArrayList<>();
    private final JobQueue queue = new JobQueue(SiteAccessPolicy.OPEN, new TestClock(1_000L));
    private final JobManagerService service = new JobManagerService(queue, events::add);

    @Test
    void submitTakesOwnerAndGroupFromTheCredential() {
        String jobId = submit(ALICE, "token-1").value();

        JobDescriptor job = queue.get(jobId).orElseThrow();
        Assertions.assertEquals("CN=alice,OU=Users,O=GridMesh", job.owner());
        Assertions.assertEquals("gridmesh_user", job.ownerGroup());
        Assertions.assertEquals(JobStatus.WAITING, job.status());
        Assertions.assertEquals(1, events.size());
        Assertions.assertEquals("job.submit", events.get(0).action());
        Assertions.assertEquals(jobId, events.get(0).jobId());
    }

    @Test
    void retriedSubmitWithSameTokenYieldsSameJob() {
        String first = submit(ALICE, "token-1").value();
        String retried = submit(ALICE, "token-1").value();
        Assertions.assertEquals(first, retried);
        Assertions.assertEquals(1, queue.size());
    }

    @Test
    void malformedSubmissionIsInvalidJob() {
        Result<String> missing = service.submit(RpcRequest.of("submit", List.of(), Map.of()), CallContext.of(ALICE, 0L));
        Assertions.assertEquals(ErrorCode.INVALID_JOB, missing.code());

        Result<String> wrongShape = service.submit(
                RpcRequest.of("submit", List.of(Map.of("priority", "high")), Map.of()), CallContext.of(ALICE, 0L));
        Assertions.assertEquals(ErrorCode.INVALID_JOB, wrongShape.code());
        Assertions.assertEquals(0, queue.size());
    }

    @Test
    void onlyOwnerOrAdministratorMayCancel() {
        String jobId = submit(ALICE, null).value();

        Result<JobDescriptor> stranger = cancel(BOB, jobId);
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, stranger.code());
        Assertions.assertEquals(JobStatus.WAITING, queue.get(jobId).orElseThrow().status());

        Result<JobDescriptor> admin = cancel(ADMIN, jobId);
        Assertions.assertEquals(JobStatus.KILLED, admin.value().status());

        Result<JobDescriptor> again = cancel(ALICE, jobId);
        Assertions.assertEquals(ErrorCode.INVALID_JOB, again.code());
        Assertions.assertEquals("ok", events.get(events.size() - 2).result());
        Assertions.assertEquals("InvalidJob", events.get(events.size() - 1).result());
    }

    @Test
    void statusIsVisibleToOwnerOnly() {
        String jobId = submit(ALICE, null).value();
        Assertions.assertTrue(status(ALICE, jobId).isOk());
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, status(BOB, jobId).code());
        Assertions.assertTrue(status(ADMIN, jobId).isOk());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, status(ALICE, "no-such-job").code());
        Assertions.assertEquals(ErrorCode.INVALID_JOB, status(ALICE, " ").code());
    }

    private Result<String> submit(Credential caller, String token) {
        JobSubmission job = new JobSubmission(3, JobRequirements.platform("linux64"), null);
        return service.submit(RpcRequest.of("submit", Arrays.asList(job, token), Map.of()), CallContext.of(caller, 0L));
    }

    private Result<JobDescriptor> cancel(Credential caller, String jobId) {
        return service.cancel(RpcRequest.of("cancel", List.of(jobId), Map.of()), CallContext.of(caller, 0L));
    }

    private Result<JobDescriptor> status(Credential caller, String jobId) {
        return service.getJobStatus(RpcRequest.of("getJobStatus", List.of(jobId), Map.of()), CallContext.of(caller, 0L));
    }
}
