package io.gridmesh.result;

import java.util.Objects;

public record Failure(ErrorCode code, String message, Failure cause) {
    public Failure {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static Failure of(ErrorCode code, String message) {
        return new Failure(code, message, null);
    }

    public Failure rootCause() {
        Failure current = this;
        while (current.cause != null) {
            current = current.cause;
        }
        return current;
    }

    @Override
    public String toString() {
        String base = code.wireName() + ": " + message;
        return cause == null ? base : base + " <- " + cause;
    }
}
