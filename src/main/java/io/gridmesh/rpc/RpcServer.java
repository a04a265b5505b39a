package io.gridmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsExchange;
import com.sun.net.httpserver.HttpsParameters;
import com.sun.net.httpserver.HttpsServer;
import io.gridmesh.observability.TraceContext;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.result.ResultCodec;
import io.gridmesh.security.Credential;
import io.gridmesh.security.CredentialParser;
import io.gridmesh.security.CredentialVerifier;
import io.gridmesh.security.GroupRegistry;
import io.gridmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public final class RpcServer implements AutoCloseable {
    public static final String CONTEXT = "/rpc/";
    public static final String TIMEOUT_HEADER = "X-GridMesh-Timeout-Ms";
    public static final String TRACE_HEADER = "X-GridMesh-Trace-Id";
    static final String RESOLVED_CREDENTIAL = "gridmesh.resolved.credential";

    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    private final HttpsServer server;
    private final ExecutorService handlerPool;
    private final AtomicReference<GridTls.TlsBundle> tls;
    private final ServiceDispatcher dispatcher;
    private final GroupRegistry groups;
    private final Clock clock;

    public RpcServer(
            InetSocketAddress bind,
            GridTls.TlsBundle tlsBundle,
            ServiceDispatcher dispatcher,
            GroupRegistry groups,
            int handlerThreads,
            Clock clock
    ) throws IOException {
        this.tls = new AtomicReference<>(tlsBundle);
        this.dispatcher = dispatcher;
        this.groups = groups;
        this.clock = clock;
        this.server = HttpsServer.create(bind, 0);
        this.server.setHttpsConfigurator(configurator());
        this.server.createContext(CONTEXT, this::handle);
        AtomicInteger seq = new AtomicInteger();
        this.handlerPool = Executors.newFixedThreadPool(Math.max(1, handlerThreads), r -> {
            Thread t = new Thread(r, "gridmesh-rpc-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(handlerPool);
    }

    public void start() {
        server.start();
        GridTls.TlsBundle loaded = tls.get();
        log.info("RPC listening on https://{}:{} as {} (trustRoots={}, revokedEntries={})",
                server.getAddress().getHostString(), port(), loaded.hostSubject(),
                loaded.trustRoots().size(), loaded.revocationPolicy().entryCount());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public GridTls.TlsBundle tlsBundle() {
        return tls.get();
    }

    // Swaps in new TLS material; existing connections keep the credential they handshook with.
    public void reloadTls(GridTls.TlsBundle bundle) {
        tls.set(bundle);
        server.setHttpsConfigurator(configurator());
        log.info("RPC TLS reloaded: host={} fingerprintSha256={} revokedEntries={}",
                bundle.hostSubject(), bundle.hostFingerprintSha256(), bundle.revocationPolicy().entryCount());
    }

    public boolean reloadTlsIfChanged(TlsMaterial material) {
        GridTls.TlsBundle current = tls.get();
        if (!material.changedSince(current)) {
            return false;
        }
        try {
            reloadTls(material.load());
            return true;
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            log.warn("RPC TLS reload failed, keeping current material: {}", e.getMessage());
            return false;
        }
    }

    private HttpsConfigurator configurator() {
        SSLContext initial = tls.get().sslContext();
        return new HttpsConfigurator(initial) {
            @Override
            public void configure(HttpsParameters params) {
                SSLParameters sslParams = initial.getDefaultSSLParameters();
                sslParams.setNeedClientAuth(true);
                params.setSSLParameters(sslParams);
            }
        };
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, 405, Result.fail(ErrorCode.UNAVAILABLE, "method not allowed"));
                return;
            }
            String path = exchange.getRequestURI().getPath().substring(CONTEXT.length());
            String[] parts = path.split("/");
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                write(exchange, 404, Result.fail(ErrorCode.UNAVAILABLE, "no such service: " + path));
                return;
            }
            Result<Credential> caller = connectionCredential(exchange);
            if (caller.isFailure()) {
                log.warn("Rejecting call from {}: {}", exchange.getRemoteAddress(), caller.failure());
                write(exchange, 403, caller);
                return;
            }
            RpcRequest request;
            try {
                JsonNode body = Jsons.compact().readTree(exchange.getRequestBody());
                request = RpcRequest.fromNode(body);
            } catch (IOException | IllegalArgumentException e) {
                write(exchange, 400, Result.fail(ErrorCode.INTERNAL_ERROR, "malformed call frame"));
                return;
            }
            CallContext context = new CallContext(
                    caller.value(),
                    parseTimeout(exchange.getRequestHeaders().getFirst(TIMEOUT_HEADER)),
                    TraceContext.orNew(exchange.getRequestHeaders().getFirst(TRACE_HEADER)),
                    String.valueOf(exchange.getRemoteAddress())
            );
            Result<?> result = dispatcher.dispatch(parts[0] + "/" + parts[1] + "/" + request.method(), request, context);
            exchange.getResponseHeaders().set(TRACE_HEADER, context.traceId());
            write(exchange, 200, result);
        } catch (RuntimeException e) {
            log.error("RPC exchange failed", e);
            write(exchange, 500, Result.fail(ErrorCode.INTERNAL_ERROR, "internal error"));
        } finally {
            exchange.close();
        }
    }

    // Built once per TLS session; a resumed session is re-verified from its peer certificates.
    private Result<Credential> connectionCredential(HttpExchange exchange) {
        if (!(exchange instanceof HttpsExchange https)) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "connection is not TLS");
        }
        SSLSession session = https.getSSLSession();
        if (session == null) {
            return Result.fail(ErrorCode.MALFORMED_CHAIN, "no TLS session");
        }
        Object cached = session.getValue(RESOLVED_CREDENTIAL);
        if (cached instanceof Credential credential) {
            return unexpired(credential, session);
        }
        Result<Credential> verified;
        Credential fromHandshake = GridTls.sessionCredential(session);
        if (fromHandshake != null) {
            verified = unexpired(fromHandshake, session);
        } else {
            try {
                GridTls.TlsBundle bundle = tls.get();
                CredentialVerifier verifier = new CredentialVerifier(bundle.trustRoots(), bundle.revocationPolicy());
                verified = CredentialParser.fromCertificates(session.getPeerCertificates())
                        .flatMap(credential -> verifier.check(credential, clock.instant()));
            } catch (SSLPeerUnverifiedException e) {
                return Result.fail(ErrorCode.MALFORMED_CHAIN, "peer presented no certificate");
            }
        }
        if (verified.isFailure()) {
            return verified;
        }
        Credential resolved = groups.resolve(verified.value());
        session.putValue(RESOLVED_CREDENTIAL, resolved);
        log.debug("Connection from {} authenticated as {}", exchange.getRemoteAddress(), resolved.formatted());
        return Result.ok(resolved);
    }

    // Kept-alive and resumed sessions skip the handshake, so the chain's lifetime is checked per call.
    private Result<Credential> unexpired(Credential credential, SSLSession session) {
        if (credential.expiresAt() != null && clock.instant().isAfter(credential.expiresAt())) {
            session.invalidate();
            log.info("Session of {} outlived its credential (expired {})", credential.subject(), credential.expiresAt());
            return Result.fail(ErrorCode.EXPIRED_CHAIN, "credential expired");
        }
        return Result.ok(credential);
    }

    private static long parseTimeout(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static void write(HttpExchange exchange, int status, Result<?> result) throws IOException {
        byte[] bytes = ResultCodec.encode(ServiceDispatcher.sanitize(result)).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        handlerPool.shutdown();
        try {
            handlerPool.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record TlsMaterial(
            Path certificate,
            Path key,
            Path trustRoots,
            Path revocationFile,
            Clock clock
    ) {
        public GridTls.TlsBundle load() throws IOException, GeneralSecurityException {
            return GridTls.build(certificate, key, trustRoots, revocationFile, clock);
        }

        boolean changedSince(GridTls.TlsBundle current) {
            return current == null
                    || GridTls.fileMtimeMs(certificate) != current.certificateMtimeMs()
                    || GridTls.fileMtimeMs(key) != current.keyMtimeMs()
                    || GridTls.fileMtimeMs(trustRoots) != current.trustRootsMtimeMs()
                    || GridTls.fileMtimeMs(revocationFile) != current.revocationMtimeMs();
        }
    }
}
