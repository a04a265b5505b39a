package io.gridmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.result.ResultCodec;
import io.gridmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class RpcClient {
    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);
    // Lets the server answer Timeout itself before the client gives up on the exchange.
    private static final long RESPONSE_GRACE_MS = 2_000L;

    private final URI baseUri;
    private final HttpClient http;
    private final Duration defaultTimeout;

    public RpcClient(URI baseUri, SSLContext sslContext, Duration connectTimeout, Duration defaultTimeout) {
        this.baseUri = baseUri;
        this.defaultTimeout = defaultTimeout;
        this.http = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .sslContext(sslContext)
                .connectTimeout(connectTimeout)
                .build();
    }

    public Result<JsonNode> call(String system, String service, String method, List<?> args, Map<String, ?> kwargs) {
        return call(system, service, RpcRequest.of(method, args, kwargs), defaultTimeout);
    }

    public Result<JsonNode> call(String system, String service, RpcRequest request, Duration timeout) {
        URI target = baseUri.resolve(RpcServer.CONTEXT + system + "/" + service);
        long timeoutMs = Math.max(1L, timeout.toMillis());
        HttpRequest httpRequest = HttpRequest.newBuilder(target)
                .timeout(Duration.ofMillis(timeoutMs + RESPONSE_GRACE_MS))
                .header("Content-Type", "application/json")
                .header(RpcServer.TIMEOUT_HEADER, Long.toString(timeoutMs))
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(request.toNode()), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            Result<JsonNode> mapped = transportFailure(e);
            log.debug("Call {}/{}/{} failed: {}", system, service, request.method(), mapped.failure());
            return mapped;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.fail(ErrorCode.UNAVAILABLE, "interrupted, indeterminate outcome");
        }
        Result<JsonNode> decoded = ResultCodec.decode(response.body());
        if (decoded.isFailure() && response.statusCode() != 200 && decoded.hasCode(ErrorCode.INTERNAL_ERROR)
                && decoded.failure().message().startsWith("result frame")) {
            return Result.fail(ErrorCode.UNAVAILABLE, "server answered HTTP " + response.statusCode());
        }
        return decoded;
    }

    static <T> Result<T> transportFailure(IOException error) {
        CredentialRejectedException rejected = CredentialRejectedException.find(error);
        if (rejected != null) {
            return Result.fail(rejected.failure());
        }
        SSLException ssl = findSsl(error);
        if ((error instanceof HttpConnectTimeoutException || error instanceof ConnectException) && ssl == null) {
            return Result.fail(ErrorCode.UNAVAILABLE, "cannot connect: " + error.getMessage());
        }
        if (error instanceof HttpTimeoutException) {
            return Result.fail(ErrorCode.TIMEOUT, "no response within the call timeout");
        }
        if (ssl != null) {
            String message = String.valueOf(ssl.getMessage()).toLowerCase(Locale.ROOT);
            if (message.contains("certificate_expired")) {
                return Result.fail(ErrorCode.EXPIRED_CHAIN, "peer rejected the credential as expired");
            }
            if (message.contains("alert")) {
                return Result.fail(ErrorCode.UNTRUSTED_ISSUER, "peer rejected the credential: " + ssl.getMessage());
            }
            return Result.fail(ErrorCode.UNAVAILABLE, "TLS failure: " + ssl.getMessage());
        }
        return Result.fail(ErrorCode.UNAVAILABLE, "connection lost, indeterminate outcome: " + error.getMessage());
    }

    private static SSLException findSsl(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SSLException ssl) {
                return ssl;
            }
            current = current.getCause();
        }
        return null;
    }
}
