package io.gridmesh.runtime;

import io.gridmesh.TestClock;
import io.gridmesh.TestPki;
import io.gridmesh.config.NodePaths;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobRequirements;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.matching.MatchOutcome;
import io.gridmesh.registry.ResourceDescriptor;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.rpc.GridTls;
import io.gridmesh.rpc.RpcClient;
import io.gridmesh.service.JobManagerClient;
import io.gridmesh.service.JobSubmission;
import io.gridmesh.service.MatcherClient;
import io.gridmesh.service.MatcherService;
import io.gridmesh.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class GridMeshNodeTest {
    private final TestClock clock = new TestClock(System.currentTimeMillis());
    private Path root;
    private GridMeshNode node;

    @BeforeEach
    void startNode() throws Exception {
        root = Files.createTempDirectory("gridmesh-node-test-");
        Map<String, Object> security = new LinkedHashMap<>();
        security.put("HostCertificate", TestPki.path("host.pem").toString());
        security.put("HostKey", TestPki.path("host.key").toString());
        security.put("TrustRoots", TestPki.path("ca.pem").toString());
        security.put("AuditSigningSecret", "node-test-secret");
        Map<String, Object> config = Map.of(
                "Server", Map.of("Bind", "127.0.0.1", "Workers", 4, "DispatcherWorkers", 4),
                "Security", security,
                "Registry", Map.of(
                        "Users", Map.of(
                                "pilot", Map.of("DN", "CN=pilot-agent,OU=Pilots,O=GridMesh"),
                                "alice", Map.of("DN", "CN=alice,OU=Users,O=GridMesh")),
                        "Groups", Map.of(
                                "gridmesh_pilot", Map.of("Users", "pilot", "Properties", "GenericPilot"),
                                "gridmesh_user", Map.of("Users", "alice", "Properties", "NormalUser")))
        );
        Path configFile = root.resolve("gridmesh.json");
        Files.writeString(configFile, Jsons.toJson(config), StandardCharsets.UTF_8);
        node = GridMeshNode.create(configFile, NodePaths.fromRoot(root.resolve("data").toString()), 0, clock);
        node.start();
    }

    @AfterEach
    void stopNode() throws Exception {
        if (node != null) {
            node.close();
        }
        TestPki.deleteRecursively(root);
    }

    @Test
    void jobTravelsFromSubmitterToPilotAndBack() throws Exception {
        JobManagerClient alice = new JobManagerClient(client("alice-proxy-chain.pem", "alice-proxy.key", "ca.pem"));
        MatcherClient pilot = new MatcherClient(client("pilot-proxy-chain.pem", "pilot-proxy.key", "ca.pem"));

        Result<String> submitted = alice.submit(new JobSubmission(5, JobRequirements.platform("linux64"), null));
        Assertions.assertTrue(submitted.isOk(), () -> "submit failed: " + submitted);
        String jobId = submitted.value();

        Result<ResourceDescriptor> registered = pilot.registerOrRefresh(
                ResourceDescriptor.of("slot-1", "LCG.CERN.ch", "linux64", Set.of()));
        Assertions.assertTrue(registered.isOk(), () -> "register failed: " + registered);
        Assertions.assertEquals("CN=pilot-agent,OU=Pilots,O=GridMesh", registered.value().agentSubject());

        Result<MatchOutcome> matched = pilot.requestMatch("slot-1");
        Assertions.assertTrue(matched.isOk(), () -> "match failed: " + matched);
        Assertions.assertTrue(matched.value().matched());
        Assertions.assertEquals(jobId, matched.value().job().jobId());
        Assertions.assertEquals("slot-1", matched.value().job().matchedResource());

        Assertions.assertTrue(pilot.reportStatus(jobId, MatcherService.ReportedOutcome.RUNNING).isOk());
        Assertions.assertTrue(pilot.reportStatus(jobId, MatcherService.ReportedOutcome.DONE).isOk());

        Result<JobDescriptor> status = alice.getJobStatus(jobId);
        Assertions.assertTrue(status.isOk(), () -> "status failed: " + status);
        Assertions.assertEquals(JobStatus.DONE, status.value().status());
        Assertions.assertEquals("CN=alice,OU=Users,O=GridMesh", status.value().owner());
    }

    @Test
    void submitterCannotAskForWork() throws Exception {
        MatcherClient alice = new MatcherClient(client("alice-proxy-chain.pem", "alice-proxy.key", "ca.pem"));
        Result<MatchOutcome> denied = alice.requestMatch("slot-1");
        Assertions.assertEquals(ErrorCode.UNAUTHORIZED, denied.code());
    }

    @Test
    void untrustedClientNeverReachesAHandler() throws Exception {
        long before = node.dispatcher().invocationCount();
        JobManagerClient rogue = new JobManagerClient(client("rogue.pem", "rogue.key", "ca.pem"));

        Result<String> rejected = rogue.submit(new JobSubmission(5, JobRequirements.NONE, null));

        Assertions.assertTrue(rejected.isFailure());
        Assertions.assertTrue(Set.of(ErrorCode.UNTRUSTED_ISSUER, ErrorCode.MALFORMED_CHAIN, ErrorCode.EXPIRED_CHAIN,
                ErrorCode.UNAVAILABLE).contains(rejected.code()), () -> "unexpected code " + rejected.code());
        Assertions.assertEquals(before, node.dispatcher().invocationCount());
        Assertions.assertEquals(0, node.queue().size());
    }

    @Test
    void clientRejectsServerOutsideItsTrustRoots() throws Exception {
        JobManagerClient misconfigured = new JobManagerClient(
                client("pilot-proxy-chain.pem", "pilot-proxy.key", "rogue-ca.pem"));
        Result<JobDescriptor> rejected = misconfigured.getJobStatus("missing");
        Assertions.assertEquals(ErrorCode.UNTRUSTED_ISSUER, rejected.code());
    }

    @Test
    void credentialThatExpiresDuringAnOpenConnectionIsRefused() throws Exception {
        JobManagerClient alice = new JobManagerClient(client("alice-proxy-chain.pem", "alice-proxy.key", "ca.pem"));
        Assertions.assertEquals(ErrorCode.INVALID_JOB, alice.getJobStatus("x").code());
        long before = node.dispatcher().invocationCount();

        clock.advance(Instant.parse("2100-06-01T00:00:00Z").toEpochMilli() - clock.millis());
        Result<JobDescriptor> expired = alice.getJobStatus("x");

        Assertions.assertEquals(ErrorCode.EXPIRED_CHAIN, expired.code());
        Assertions.assertEquals(before, node.dispatcher().invocationCount());
    }

    @Test
    void silentResourceEvictionReleasesItsJobs() throws Exception {
        JobManagerClient alice = new JobManagerClient(client("alice-proxy-chain.pem", "alice-proxy.key", "ca.pem"));
        MatcherClient pilot = new MatcherClient(client("pilot-proxy-chain.pem", "pilot-proxy.key", "ca.pem"));
        String jobId = alice.submit(new JobSubmission(1, JobRequirements.NONE, null)).value();
        pilot.registerOrRefresh(ResourceDescriptor.of("slot-9", "S", "linux64", Set.of()));
        Assertions.assertTrue(pilot.requestMatch(null).value().matched());

        node.registry().evictExpired(clock.millis() + 3_600_000L);

        Assertions.assertEquals(JobStatus.WAITING, node.queue().get(jobId).orElseThrow().status());
        Assertions.assertEquals(List.of(), node.registry().findByAgent("CN=pilot-agent,OU=Pilots,O=GridMesh"));
    }

    private RpcClient client(String chain, String key, String trustRoots) throws Exception {
        GridTls.TlsBundle tls = GridTls.build(TestPki.path(chain), TestPki.path(key), TestPki.path(trustRoots), null, clock);
        return new RpcClient(URI.create("https://localhost:" + node.port()), tls.sslContext(),
                Duration.ofSeconds(5), Duration.ofSeconds(10));
    }
}
