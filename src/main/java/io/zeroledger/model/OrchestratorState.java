package io.zeroledger.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Snapshot of job statuses and counters. A restart cache derived from the ledger;
 * the ledger wins whenever the two disagree.
 *
 * <p>{@code jobs} keeps registration order, which is also the dispatch order.
 */
public record OrchestratorState(
        String runId,
        Map<String, Job> jobs,
        long acceptedCount,
        long rejectedCount,
        Map<String, Long> rejectedByReason,
        long lastSeq
) {
    public OrchestratorState {
        runId = runId == null ? "" : runId;
        jobs = jobs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(jobs));
        rejectedByReason = rejectedByReason == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(rejectedByReason));
    }

    public static OrchestratorState empty(String runId) {
        return new OrchestratorState(runId, Map.of(), 0L, 0L, Map.of(), 0L);
    }

    public Map<JobStatus, Integer> countByStatus() {
        Map<JobStatus, Integer> out = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            out.put(status, 0);
        }
        for (Job job : jobs.values()) {
            out.merge(job.status(), 1, Integer::sum);
        }
        return out;
    }
}
