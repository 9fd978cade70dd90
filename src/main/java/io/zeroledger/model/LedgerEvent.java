package io.zeroledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One ledger row. {@code seq}, {@code ts} and {@code chain} are assigned by the ledger on
 * append; drafts built by the acceptance gate carry {@code seq = 0} and no chain.
 */
public record LedgerEvent(
        long seq,
        EventKind kind,
        String runId,
        String jobId,
        String workerId,
        String hash,
        ResultPayload payload,
        RejectReason reason,
        String detail,
        String ts,
        String chain
) {
    public static LedgerEvent accepted(String runId, String jobId, String workerId, String hash, ResultPayload payload) {
        return new LedgerEvent(0L, EventKind.ACCEPTED, runId, jobId, workerId, hash, payload, null, null, null, null);
    }

    public static LedgerEvent rejected(
            String runId,
            String jobId,
            String workerId,
            String hash,
            RejectReason reason,
            String detail
    ) {
        return new LedgerEvent(0L, EventKind.REJECTED, runId, jobId, workerId, hash, null, reason, detail, null, null);
    }

    public LedgerEvent sealed(long assignedSeq, String assignedTs, String assignedChain) {
        return new LedgerEvent(assignedSeq, kind, runId, jobId, workerId, hash, payload, reason, detail, assignedTs, assignedChain);
    }

    /**
     * Row content covered by the chaining digest, i.e. everything but {@code chain}.
     * Absent values are omitted so the serialized form stays stable.
     */
    public ObjectNode content() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("seq", seq);
        node.put("kind", kind.name());
        putIfPresent(node, "run_id", runId);
        putIfPresent(node, "job_id", jobId);
        putIfPresent(node, "worker_id", workerId);
        putIfPresent(node, "hash", hash);
        if (payload != null) {
            node.set("payload", payload.toJson());
        }
        if (reason != null) {
            node.put("reason", reason.name());
        }
        putIfPresent(node, "detail", detail);
        putIfPresent(node, "ts", ts);
        return node;
    }

    public static LedgerEvent fromJson(JsonNode node) {
        EventKind kind = EventKind.valueOf(node.path("kind").asText());
        ResultPayload payload = null;
        JsonNode payloadNode = node.get("payload");
        if (payloadNode != null && payloadNode.isObject()) {
            JsonNode meta = payloadNode.get("meta");
            payload = new ResultPayload(
                    payloadNode.path("t").asDouble(),
                    payloadNode.path("root_val").asDouble(),
                    meta != null && meta.isObject() ? (ObjectNode) meta : null
            );
        }
        String reasonRaw = text(node, "reason");
        return new LedgerEvent(
                node.path("seq").asLong(),
                kind,
                text(node, "run_id"),
                text(node, "job_id"),
                text(node, "worker_id"),
                text(node, "hash"),
                payload,
                reasonRaw == null ? null : RejectReason.valueOf(reasonRaw),
                text(node, "detail"),
                text(node, "ts"),
                text(node, "chain")
        );
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
