package io.gridmesh.rpc;

import io.gridmesh.TestPki;
import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.authz.Combinator;
import io.gridmesh.authz.MethodPolicy;
import io.gridmesh.config.JsonConfigurationSource;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Failure;
import io.gridmesh.result.Result;
import io.gridmesh.security.Credential;
import io.gridmesh.security.Property;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class ServiceDispatcherTest {
    private static final Credential USER = TestPki.credential("alice.pem")
            .withGroupsAndProperties(List.of("gridmesh_user"), Set.of(Property.NORMAL_USER));
    private static final Credential PILOT = TestPki.credential("pilot-proxy-chain.pem")
            .withGroupsAndProperties(List.of("gridmesh_pilot"), Set.of(Property.GENERIC_PILOT));

    @Test
    void deniedCallNeverReachesTheHandler() {
        AtomicInteger calls = new AtomicInteger();
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), null, 2, 1_000L)) {
            dispatcher.register("WorkloadManagement", "JobManager", "submit", MethodPolicy.anyOf(Property.NORMAL_USER),
                    (request, context) -> {
                        calls.incrementAndGet();
                        return Result.ok("job-1");
                    });

            Result<?> denied = dispatcher.dispatch("WorkloadManagement/JobManager/submit",
                    RpcRequest.of("submit", List.of(), Map.of()), CallContext.of(PILOT, 0L));
            Assertions.assertEquals(ErrorCode.UNAUTHORIZED, denied.code());
            Assertions.assertEquals(0, calls.get());
            Assertions.assertEquals(0L, dispatcher.invocationCount());

            Result<?> allowed = dispatcher.dispatch("WorkloadManagement/JobManager/submit",
                    RpcRequest.of("submit", List.of(), Map.of()), CallContext.of(USER, 0L));
            Assertions.assertEquals(Result.ok("job-1"), allowed);
            Assertions.assertEquals(1, calls.get());
        }
    }

    @Test
    void handlerFaultBecomesInternalErrorAndServingContinues() {
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), null, 1, 1_000L)) {
            dispatcher.register("Sys", "Svc", "explode", MethodPolicy.authenticated(), (request, context) -> {
                throw new IllegalStateException("boom: secret detail");
            });
            dispatcher.register("Sys", "Svc", "nothing", MethodPolicy.authenticated(), (request, context) -> null);
            dispatcher.register("Sys", "Svc", "ping", MethodPolicy.authenticated(), (request, context) -> Result.ok("pong"));

            Result<?> failed = dispatcher.dispatch("Sys/Svc/explode", RpcRequest.of("explode", null, null), CallContext.of(USER, 0L));
            Assertions.assertEquals(ErrorCode.INTERNAL_ERROR, failed.code());
            Result<?> wire = ServiceDispatcher.sanitize(failed);
            Assertions.assertEquals("internal error", wire.failure().message());

            Assertions.assertEquals(ErrorCode.INTERNAL_ERROR,
                    dispatcher.dispatch("Sys/Svc/nothing", RpcRequest.of("nothing", null, null), CallContext.of(USER, 0L)).code());
            Assertions.assertEquals(Result.ok("pong"),
                    dispatcher.dispatch("Sys/Svc/ping", RpcRequest.of("ping", null, null), CallContext.of(USER, 0L)));
        }
    }

    @Test
    void slowHandlerTimesOutButRunsToCompletion() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), null, 2, 30_000L)) {
            dispatcher.register("Sys", "Svc", "slow", MethodPolicy.authenticated(), (request, context) -> {
                release.await(5, TimeUnit.SECONDS);
                finished.countDown();
                return Result.ok();
            });

            Result<?> result = dispatcher.dispatch("Sys/Svc/slow", RpcRequest.of("slow", null, null), CallContext.of(USER, 50L));
            Assertions.assertEquals(ErrorCode.TIMEOUT, result.code());
            Assertions.assertTrue(result.code().retryable());

            release.countDown();
            Assertions.assertTrue(finished.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void unknownMethodIsUnavailable() {
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), null, 1, 1_000L)) {
            Result<?> result = dispatcher.dispatch("Sys/Svc/missing", RpcRequest.of("missing", null, null), CallContext.of(USER, 0L));
            Assertions.assertEquals(ErrorCode.UNAVAILABLE, result.code());
        }
    }

    @Test
    void configurationOverridesRegisteredPolicy() {
        JsonConfigurationSource config = JsonConfigurationSource.fromString("""
                {"Systems": {"Sys": {"Services": {"Svc": {"Authorization": {
                  "guarded": "ALL:NormalUser, Operator",
                  "Default": "GenericPilot"
                }}}}}}
                """);
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), config, 1, 1_000L)) {
            dispatcher.setDefaultPolicy("Sys", "Svc", MethodPolicy.authenticated());
            dispatcher.register("Sys", "Svc", "guarded", MethodPolicy.anyOf(Property.NORMAL_USER), (r, c) -> Result.ok());
            dispatcher.register("Sys", "Svc", "defaulted", null, (r, c) -> Result.ok());

            MethodPolicy guarded = dispatcher.effectivePolicy(MethodKey.parse("Sys/Svc/guarded"));
            Assertions.assertEquals(Combinator.ALL, guarded.combinator());
            Assertions.assertEquals(ErrorCode.UNAUTHORIZED,
                    dispatcher.dispatch("Sys/Svc/guarded", RpcRequest.of("guarded", null, null), CallContext.of(USER, 0L)).code());

            Assertions.assertEquals(MethodPolicy.anyOf(Property.GENERIC_PILOT),
                    dispatcher.effectivePolicy(MethodKey.parse("Sys/Svc/defaulted")));
            Assertions.assertTrue(dispatcher.dispatch("Sys/Svc/defaulted",
                    RpcRequest.of("defaulted", null, null), CallContext.of(PILOT, 0L)).isOk());
            Assertions.assertEquals(2, dispatcher.policies().size());
        }
    }

    @Test
    void overrideNamingNoPropertyIsIgnored() {
        JsonConfigurationSource config = JsonConfigurationSource.fromString("""
                {"Systems": {"Sys": {"Services": {"Svc": {"Authorization": {
                  "guarded": "ALL:",
                  "Default": [" ", "ALL:"]
                }}}}}}
                """);
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), config, 1, 1_000L)) {
            dispatcher.setDefaultPolicy("Sys", "Svc", MethodPolicy.anyOf(Property.OPERATOR));
            dispatcher.register("Sys", "Svc", "guarded", MethodPolicy.anyOf(Property.NORMAL_USER), (r, c) -> Result.ok());
            dispatcher.register("Sys", "Svc", "defaulted", null, (r, c) -> Result.ok());

            Assertions.assertEquals(MethodPolicy.anyOf(Property.NORMAL_USER),
                    dispatcher.effectivePolicy(MethodKey.parse("Sys/Svc/guarded")));
            Assertions.assertEquals(ErrorCode.UNAUTHORIZED,
                    dispatcher.dispatch("Sys/Svc/guarded", RpcRequest.of("guarded", null, null), CallContext.of(PILOT, 0L)).code());
            Assertions.assertEquals(MethodPolicy.anyOf(Property.OPERATOR),
                    dispatcher.effectivePolicy(MethodKey.parse("Sys/Svc/defaulted")));
            Assertions.assertEquals(ErrorCode.UNAUTHORIZED,
                    dispatcher.dispatch("Sys/Svc/defaulted", RpcRequest.of("defaulted", null, null), CallContext.of(USER, 0L)).code());
        }
    }

    @Test
    void registrationRejectsDuplicatesAndMissingPolicies() {
        try (ServiceDispatcher dispatcher = new ServiceDispatcher(new AuthorizationEngine(), null, 1, 1_000L)) {
            dispatcher.register("Sys", "Svc", "once", MethodPolicy.authenticated(), (r, c) -> Result.ok());
            Assertions.assertThrows(IllegalStateException.class,
                    () -> dispatcher.register("Sys", "Svc", "once", MethodPolicy.authenticated(), (r, c) -> Result.ok()));
            Assertions.assertThrows(IllegalStateException.class,
                    () -> dispatcher.register("Sys", "Other", "nopolicy", null, (r, c) -> Result.ok()));
            Assertions.assertThrows(IllegalArgumentException.class, () -> MethodKey.parse("Sys/Svc"));
        }
    }

    @Test
    void sanitizeKeepsCallerFixableDetailOnly() {
        Result<Object> invalid = Result.fail(new Failure(ErrorCode.INVALID_JOB, "priority must be a number",
                Failure.of(ErrorCode.INVALID_JOB, "inner")));
        Assertions.assertSame(invalid, ServiceDispatcher.sanitize(invalid));

        Result<Object> denied = Result.fail(new Failure(ErrorCode.UNAUTHORIZED, "requires JobAdministrator",
                Failure.of(ErrorCode.UNAUTHORIZED, "policy detail")));
        Result<?> wire = ServiceDispatcher.sanitize(denied);
        Assertions.assertEquals(AuthorizationEngine.DENIED_MESSAGE, wire.failure().message());
        Assertions.assertNull(wire.failure().cause());
    }
}
