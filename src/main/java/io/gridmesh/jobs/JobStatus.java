package io.gridmesh.jobs;

public enum JobStatus {
    WAITING,
    MATCHED,
    RUNNING,
    DONE,
    FAILED,
    KILLED;

    public boolean terminal() {
        return this == DONE || this == FAILED || this == KILLED;
    }

    public static JobStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("job status is empty");
        }
        for (JobStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
