package io.gridmesh.observability;

import io.gridmesh.security.Credential;

import java.util.Map;

public record AuditEvent(
        String action,
        String actor,
        String group,
        String resource,
        String result,
        String traceId,
        String jobId,
        Map<String, Object> details
) {
    public AuditEvent {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static AuditEvent of(String action, Credential caller, String resource, String result, Map<String, Object> details) {
        String actor = caller == null ? null : caller.subject();
        String group = caller == null ? null : caller.primaryGroup();
        return new AuditEvent(action, actor, group, resource, result, null, null, details);
    }

    public AuditEvent withTrace(String trace) {
        return new AuditEvent(action, actor, group, resource, result, trace, jobId, details);
    }

    public AuditEvent withJob(String id) {
        return new AuditEvent(action, actor, group, resource, result, traceId, id, details);
    }
}
