package io.zeroledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Unit of work handed to a worker. The payload is opaque to the orchestrator.
 */
public record Job(
        String jobId,
        JsonNode payload,
        JobStatus status,
        long createdAtMs,
        int attempts,
        String lastError
) {
    public Job {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be empty");
        }
        payload = payload == null ? NullNode.getInstance() : payload.deepCopy();
        status = status == null ? JobStatus.PENDING : status;
        attempts = Math.max(0, attempts);
    }

    public static Job pending(String jobId, JsonNode payload, long createdAtMs) {
        return new Job(jobId, payload, JobStatus.PENDING, createdAtMs, 0, null);
    }

    public Job withStatus(JobStatus next) {
        return new Job(jobId, payload, next, createdAtMs, attempts, lastError);
    }

    public Job withFailure(JobStatus next, String error) {
        return new Job(jobId, payload, next, createdAtMs, attempts + 1, error);
    }
}
