package io.zeroledger.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Message travelling from a worker back to the orchestrator through the job queue.
 */
public record WorkerMessage(
        Kind kind,
        String workerId,
        String jobId,
        JsonNode payload,
        String error
) {
    public enum Kind {
        RESULT,
        JOB_FINISHED,
        JOB_FAILED
    }

    public static WorkerMessage result(String workerId, String jobId, JsonNode payload) {
        return new WorkerMessage(Kind.RESULT, workerId, jobId, payload, null);
    }

    public static WorkerMessage finished(String workerId, String jobId) {
        return new WorkerMessage(Kind.JOB_FINISHED, workerId, jobId, null, null);
    }

    public static WorkerMessage failed(String workerId, String jobId, String error) {
        return new WorkerMessage(Kind.JOB_FAILED, workerId, jobId, null, error == null ? "unknown" : error);
    }
}
