package io.zeroledger.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Candidate value returned by a worker: position {@code t}, residual {@code rootVal}
 * and free-form metadata (method, iteration count, timings).
 */
public record ResultPayload(double t, double rootVal, ObjectNode meta) {
    public ResultPayload {
        meta = meta == null ? JsonNodeFactory.instance.objectNode() : meta.deepCopy();
    }

    @Override
    public ObjectNode meta() {
        return meta.deepCopy();
    }

    public String method() {
        JsonNode node = meta.get("method");
        return node == null || node.isNull() ? null : node.asText();
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("t", t);
        node.put("root_val", rootVal);
        node.set("meta", meta.deepCopy());
        return node;
    }
}
