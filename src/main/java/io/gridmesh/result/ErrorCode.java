package io.gridmesh.result;

public enum ErrorCode {
    MALFORMED_CHAIN("MalformedChain", false, true),
    EXPIRED_CHAIN("ExpiredChain", false, true),
    UNTRUSTED_ISSUER("UntrustedIssuer", false, true),
    UNAUTHORIZED("Unauthorized", false, false),
    INVALID_JOB("InvalidJob", false, false),
    ALREADY_MATCHED("AlreadyMatched", false, false),
    TIMEOUT("Timeout", true, false),
    UNAVAILABLE("Unavailable", true, false),
    INTERNAL_ERROR("InternalError", false, false);

    private final String wireName;
    private final boolean retryable;
    private final boolean connectionFatal;

    ErrorCode(String wireName, boolean retryable, boolean connectionFatal) {
        this.wireName = wireName;
        this.retryable = retryable;
        this.connectionFatal = connectionFatal;
    }

    public String wireName() {
        return wireName;
    }

    public boolean retryable() {
        return retryable;
    }

    public boolean connectionFatal() {
        return connectionFatal;
    }

    // Security failures never carry detail across the trust boundary.
    public boolean opaqueOnWire() {
        return connectionFatal || this == UNAUTHORIZED || this == INTERNAL_ERROR;
    }

    public static ErrorCode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("error code is empty");
        }
        for (ErrorCode value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + raw);
    }
}
