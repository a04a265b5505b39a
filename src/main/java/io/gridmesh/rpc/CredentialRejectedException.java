package io.gridmesh.rpc;

import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Failure;

import java.security.cert.CertificateException;

public final class CredentialRejectedException extends CertificateException {
    private final transient Failure failure;

    public CredentialRejectedException(Failure failure) {
        super(failure.code().wireName() + ": " + failure.message());
        this.failure = failure;
    }

    public Failure failure() {
        return failure;
    }

    public ErrorCode code() {
        return failure.code();
    }

    public static CredentialRejectedException find(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof CredentialRejectedException rejected) {
                return rejected;
            }
            current = current.getCause();
        }
        return null;
    }
}
