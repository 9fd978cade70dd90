package io.zeroledger.contract;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.model.Job;
import io.zeroledger.model.JobStatus;
import io.zeroledger.model.ResultPayload;

/**
 * Validates raw job specs and worker results against their contracts. Stateless.
 */
public final class ContractValidator implements ResultContract {
    private static final int MAX_JOB_ID_LENGTH = 128;

    public Job validateJob(JsonNode spec, long nowMs) {
        if (spec == null || !spec.isObject()) {
            throw new ValidationException(ValidationReason.TYPE_MISMATCH, null, "job spec must be a JSON object");
        }
        JsonNode id = required(spec, "job_id");
        if (!id.isTextual()) {
            throw typeMismatch("job_id", "string");
        }
        String jobId = id.asText().trim();
        if (jobId.isEmpty() || jobId.length() > MAX_JOB_ID_LENGTH) {
            throw new ValidationException(ValidationReason.OUT_OF_RANGE, "job_id",
                    "job_id must be 1.." + MAX_JOB_ID_LENGTH + " characters");
        }

        JsonNode payload = spec.get("payload");
        if (payload != null && !payload.isNull() && !payload.isObject()) {
            throw typeMismatch("payload", "object");
        }

        JobStatus status = JobStatus.PENDING;
        JsonNode statusNode = spec.get("status");
        if (statusNode != null && !statusNode.isNull()) {
            if (!statusNode.isTextual()) {
                throw typeMismatch("status", "string");
            }
            try {
                status = JobStatus.fromString(statusNode.asText());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(ValidationReason.OUT_OF_RANGE, "status", e.getMessage());
            }
        }

        long createdAt = nowMs;
        JsonNode createdNode = spec.get("created_at_ms");
        if (createdNode != null && !createdNode.isNull()) {
            if (!createdNode.isIntegralNumber()) {
                throw typeMismatch("created_at_ms", "integer");
            }
            createdAt = createdNode.asLong();
            if (createdAt < 0L) {
                throw new ValidationException(ValidationReason.OUT_OF_RANGE, "created_at_ms", "created_at_ms must be >= 0");
            }
        }
        return new Job(jobId, payload, status, createdAt, 0, null);
    }

    @Override
    public ResultPayload validate(JsonNode raw) {
        return validateResult(raw);
    }

    public ResultPayload validateResult(JsonNode payload) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new ValidationException(ValidationReason.MISSING_FIELD, null, "result payload is missing");
        }
        if (!payload.isObject()) {
            throw new ValidationException(ValidationReason.TYPE_MISMATCH, null, "result payload must be a JSON object");
        }
        double t = finiteNumber(payload, "t");
        double rootVal = finiteNumber(payload, "root_val");

        ObjectNode meta = null;
        JsonNode metaNode = payload.get("meta");
        if (metaNode != null && !metaNode.isNull()) {
            if (!metaNode.isObject()) {
                throw typeMismatch("meta", "object");
            }
            meta = (ObjectNode) metaNode;
            JsonNode method = meta.get("method");
            if (method != null && !method.isNull() && !method.isTextual()) {
                throw typeMismatch("meta.method", "string");
            }
            JsonNode iters = meta.get("iters");
            if (iters != null && !iters.isNull()) {
                if (!iters.isIntegralNumber()) {
                    throw typeMismatch("meta.iters", "integer");
                }
                if (iters.asLong() < 0L) {
                    throw new ValidationException(ValidationReason.OUT_OF_RANGE, "meta.iters", "meta.iters must be >= 0");
                }
            }
        }
        return new ResultPayload(t, rootVal, meta);
    }

    private static double finiteNumber(JsonNode parent, String field) {
        JsonNode node = required(parent, field);
        if (!node.isNumber()) {
            throw typeMismatch(field, "number");
        }
        double value = node.asDouble();
        if (!Double.isFinite(value)) {
            throw new ValidationException(ValidationReason.OUT_OF_RANGE, field, field + " must be finite");
        }
        return value;
    }

    private static JsonNode required(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new ValidationException(ValidationReason.MISSING_FIELD, field, "missing required field: " + field);
        }
        return node;
    }

    private static ValidationException typeMismatch(String field, String expected) {
        return new ValidationException(ValidationReason.TYPE_MISMATCH, field, field + " must be a " + expected);
    }
}
