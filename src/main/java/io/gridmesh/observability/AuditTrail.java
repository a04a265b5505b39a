package io.gridmesh.observability;

public interface AuditTrail {
    AuditTrail NONE = event -> {
    };

    void record(AuditEvent event);
}
