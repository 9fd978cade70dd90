package io.zeroledger.model;

public enum JobStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED;

    public boolean terminal() {
        return this == DONE || this == FAILED;
    }

    public static JobStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (JobStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + raw);
    }
}
