package io.zeroledger.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.model.Job;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Stand-in miner for range jobs {@code {"t_start", "t_end", "stride"}}: one candidate per
 * stride step with a tiny pseudo-random residual. Seeded from the job id, so re-running a
 * job reproduces the same candidates.
 */
public final class SyntheticRootWorker implements Worker {
    public static final String ID = "synthetic";
    private static final int MAX_CANDIDATES = 1_000_000;
    private static final double RESIDUAL_SCALE = 1e-11;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<JsonNode> compute(Job job) {
        JsonNode payload = job.payload();
        double start = number(payload, "t_start");
        double end = number(payload, "t_end");
        double stride = number(payload, "stride");
        if (!(stride > 0.0d)) {
            throw new IllegalArgumentException("stride must be > 0 for job " + job.jobId());
        }
        if ((end - start) / stride > MAX_CANDIDATES) {
            throw new IllegalArgumentException("job " + job.jobId() + " spans more than " + MAX_CANDIDATES + " steps");
        }
        Random random = new Random(job.jobId().hashCode());
        List<JsonNode> out = new ArrayList<>();
        for (int i = 0; start + i * stride < end; i++) {
            ObjectNode candidate = JsonNodeFactory.instance.objectNode();
            candidate.put("t", start + i * stride);
            candidate.put("root_val", (random.nextDouble() - 0.5d) * RESIDUAL_SCALE);
            ObjectNode meta = candidate.putObject("meta");
            meta.put("method", "stub");
            meta.put("iters", 12);
            out.add(candidate);
        }
        return out;
    }

    private static double number(JsonNode payload, String field) {
        JsonNode node = payload == null ? null : payload.get(field);
        if (node == null || !node.isNumber()) {
            throw new IllegalArgumentException("job payload needs numeric " + field);
        }
        return node.asDouble();
    }
}
