package io.gridmesh.rpc;

import io.gridmesh.security.Credential;

public record CallContext(
        Credential credential,
        long timeoutMs,
        String traceId,
        String remoteAddress
) {
    public static CallContext of(Credential credential, long timeoutMs) {
        return new CallContext(credential, timeoutMs, null, null);
    }
}
