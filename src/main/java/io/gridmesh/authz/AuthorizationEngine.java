package io.gridmesh.authz;

import io.gridmesh.observability.AuditEvent;
import io.gridmesh.observability.AuditTrail;
import io.gridmesh.result.ErrorCode;
import io.gridmesh.result.Result;
import io.gridmesh.security.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public final class AuthorizationEngine {
    public static final String DENIED_MESSAGE = "access denied";
    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    private final AuditTrail audit;

    public AuthorizationEngine() {
        this(AuditTrail.NONE);
    }

    public AuthorizationEngine(AuditTrail audit) {
        this.audit = audit == null ? AuditTrail.NONE : audit;
    }

    public static boolean permits(Credential credential, MethodPolicy policy) {
        return credential != null && policy.admits(credential.properties());
    }

    public Result<Void> authorize(Credential credential, MethodPolicy policy) {
        return authorize(credential, policy, null);
    }

    public Result<Void> authorize(Credential credential, MethodPolicy policy, String resource) {
        if (permits(credential, policy)) {
            return Result.ok();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("policy", policy.toString());
        details.put("held", credential == null ? "none" : credential.properties().toString());
        audit.record(AuditEvent.of("authorize", credential, resource, "denied", details));
        log.info("Unauthorized call to {} by {} (requires {})",
                resource == null ? "-" : resource,
                credential == null ? "[anonymous]" : credential.formatted(),
                policy);
        return Result.fail(ErrorCode.UNAUTHORIZED, DENIED_MESSAGE);
    }
}
