package io.gridmesh.rpc;

import io.gridmesh.authz.AuthorizationEngine;
import io.gridmesh.authz.MethodPolicy;
import io.gridmesh.config.ConfigurationSource;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Failure;
import io.gridmesh.result.Result;
import io.gridmesh.security.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class ServiceDispatcher implements AutoCloseable {
    public static final String DEFAULT_POLICY_KEY = "Default";
    private static final Logger log = LoggerFactory.getLogger(ServiceDispatcher.class);

    private final AuthorizationEngine authorization;
    private final ConfigurationSource config;
    private final long defaultTimeoutMs;
    private final ExecutorService workers;
    private final Map<String, Registration> methods = new ConcurrentHashMap<>();
    private final Map<String, MethodPolicy> serviceDefaults = new ConcurrentHashMap<>();
    private final AtomicLong invocations = new AtomicLong();

    public ServiceDispatcher(AuthorizationEngine authorization, ConfigurationSource config, int workerThreads, long defaultTimeoutMs) {
        this.authorization = authorization;
        this.config = config;
        this.defaultTimeoutMs = defaultTimeoutMs;
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "gridmesh-dispatch-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void setDefaultPolicy(String system, String service, MethodPolicy policy) {
        serviceDefaults.put(system + "/" + service, policy);
    }

    public void register(MethodKey key, MethodPolicy policy, RpcHandler handler) {
        if (policy == null && !serviceDefaults.containsKey(key.servicePath())) {
            throw new IllegalStateException("no policy for " + key + " and no default for " + key.servicePath());
        }
        Registration previous = methods.putIfAbsent(key.toString(), new Registration(key, policy, handler));
        if (previous != null) {
            throw new IllegalStateException("method registered twice: " + key);
        }
    }

    public void register(String system, String service, String method, MethodPolicy policy, RpcHandler handler) {
        register(new MethodKey(system, service, method), policy, handler);
    }

    public boolean isRegistered(String qualifiedMethod) {
        return methods.containsKey(qualifiedMethod);
    }

    public MethodPolicy effectivePolicy(MethodKey key) {
        String base = "/Systems/" + key.system() + "/Services/" + key.service() + "/Authorization/";
        MethodPolicy override = configured(base + key.method());
        if (override != null) {
            return override;
        }
        Registration registration = methods.get(key.toString());
        if (registration != null && registration.policy() != null) {
            return registration.policy();
        }
        MethodPolicy serviceDefault = configured(base + DEFAULT_POLICY_KEY);
        if (serviceDefault != null) {
            return serviceDefault;
        }
        return serviceDefaults.get(key.servicePath());
    }

    // Malformed entries fall back to the registered policy.
    private MethodPolicy configured(String path) {
        if (config == null) {
            return null;
        }
        List<String> tokens = config.getList(path);
        if (tokens.isEmpty()) {
            return null;
        }
        try {
            return MethodPolicy.parse(tokens);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring authorization setting {}: {}", path, e.getMessage());
            return null;
        }
    }

    public Map<String, MethodPolicy> policies() {
        Map<String, MethodPolicy> out = new TreeMap<>();
        for (Registration registration : methods.values()) {
            out.put(registration.key().toString(), effectivePolicy(registration.key()));
        }
        return out;
    }

    public long invocationCount() {
        return invocations.get();
    }

    public Result<?> dispatch(String qualifiedMethod, RpcRequest request, CallContext context) {
        long started = System.nanoTime();
        Credential caller = context.credential();
        String who = caller == null ? "[anonymous]" : caller.formatted();
        log.info("Incoming request {} {} {}", who, qualifiedMethod, traceSuffix(context));
        Result<?> result = route(qualifiedMethod, request, context);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (result.isOk()) {
            log.info("Returning response {} {} ({} ms) OK", who, qualifiedMethod, elapsedMs);
        } else {
            log.info("Returning response {} {} ({} ms) {}", who, qualifiedMethod, elapsedMs, result.failure().code().wireName());
        }
        return result;
    }

    private Result<?> route(String qualifiedMethod, RpcRequest request, CallContext context) {
        Registration registration = methods.get(qualifiedMethod);
        if (registration == null) {
            return Result.fail(ErrorCode.UNAVAILABLE, "no such method: " + qualifiedMethod);
        }
        MethodPolicy policy = effectivePolicy(registration.key());
        if (policy == null) {
            log.error("No effective policy for {}", qualifiedMethod);
            return Result.fail(ErrorCode.UNAUTHORIZED, AuthorizationEngine.DENIED_MESSAGE);
        }
        Result<Void> allowed = authorization.authorize(context.credential(), policy, qualifiedMethod);
        if (allowed.isFailure()) {
            return allowed;
        }
        long timeoutMs = context.timeoutMs() > 0 ? context.timeoutMs() : defaultTimeoutMs;
        Future<Result<?>> pending;
        try {
            pending = workers.submit(() -> {
                invocations.incrementAndGet();
                return registration.handler().handle(request, context);
            });
        } catch (RejectedExecutionException e) {
            return Result.fail(ErrorCode.UNAVAILABLE, "dispatcher is shutting down");
        }
        try {
            Result<?> result = pending.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (result == null) {
                log.error("Handler for {} returned no result", qualifiedMethod);
                return Result.fail(ErrorCode.INTERNAL_ERROR, "handler returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            // The handler is left to finish; its outcome is discarded.
            return Result.fail(ErrorCode.TIMEOUT, qualifiedMethod + " did not complete within " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            log.error("Handler for {} failed", qualifiedMethod, e.getCause());
            return Result.fail(ErrorCode.INTERNAL_ERROR, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.fail(ErrorCode.UNAVAILABLE, "interrupted while waiting for " + qualifiedMethod);
        }
    }

    public static Result<?> sanitize(Result<?> result) {
        if (result.isOk()) {
            return result;
        }
        Failure failure = result.failure();
        if (!failure.code().opaqueOnWire()) {
            return result;
        }
        String message = switch (failure.code()) {
            case UNAUTHORIZED -> AuthorizationEngine.DENIED_MESSAGE;
            case INTERNAL_ERROR -> "internal error";
            default -> "credential rejected";
        };
        return Result.fail(failure.code(), message);
    }

    private static String traceSuffix(CallContext context) {
        return context.traceId() == null ? "" : "trace=" + context.traceId();
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Registration(MethodKey key, MethodPolicy policy, RpcHandler handler) {
    }
}
