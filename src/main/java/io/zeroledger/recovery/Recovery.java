package io.zeroledger.recovery;

import io.zeroledger.ledger.CanonicalHasher;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.model.EventKind;
import io.zeroledger.model.Job;
import io.zeroledger.model.JobStatus;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.model.OrchestratorState;
import io.zeroledger.pipeline.DedupSet;
import io.zeroledger.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Rebuilds derived state from a full ledger replay and reconciles the state snapshot
 * against it. Where the two disagree the ledger-derived view wins and the snapshot is
 * rewritten. Running recovery again over the same ledger yields the same result.
 *
 * <p>When rejections are not retained in the ledger, the snapshot is the only record of
 * them, so its rejection counters are kept unless the ledger shows more.
 */
public final class Recovery {
    private static final Logger log = LoggerFactory.getLogger(Recovery.class);

    private final CanonicalHasher hasher;
    private final boolean retainRejected;

    public Recovery() {
        this(new CanonicalHasher());
    }

    public Recovery(CanonicalHasher hasher) {
        this(hasher, true);
    }

    public Recovery(CanonicalHasher hasher, boolean retainRejected) {
        this.hasher = hasher;
        this.retainRejected = retainRejected;
    }

    public Recovered recover(Ledger ledger, StateStore stateStore, String runId) {
        OrchestratorState loaded = stateStore.load(runId);

        DedupSet dedupSet = new DedupSet();
        Map<String, Long> rejectedByReason = new TreeMap<>();
        Map<String, Long> acceptedJobs = new LinkedHashMap<>();
        long accepted = 0L;
        long rejected = 0L;
        long lastSeq = 0L;
        int events = 0;
        try (Stream<LedgerEvent> replay = ledger.replay()) {
            Iterator<LedgerEvent> it = replay.iterator();
            while (it.hasNext()) {
                LedgerEvent event = it.next();
                events++;
                lastSeq = Math.max(lastSeq, event.seq());
                if (event.kind() == EventKind.ACCEPTED) {
                    accepted++;
                    String hash = event.hash() != null || event.payload() == null
                            ? event.hash()
                            : hasher.hash(event.payload());
                    if (hash != null) {
                        dedupSet.add(hash, event.seq());
                    }
                    if (event.jobId() != null) {
                        acceptedJobs.putIfAbsent(event.jobId(), epochMs(event.ts()));
                    }
                } else {
                    rejected++;
                    String reason = event.reason() == null ? "UNKNOWN" : event.reason().name();
                    rejectedByReason.merge(reason, 1L, Long::sum);
                }
            }
        }

        if (!retainRejected) {
            rejected = Math.max(rejected, loaded.rejectedCount());
            for (Map.Entry<String, Long> entry : loaded.rejectedByReason().entrySet()) {
                rejectedByReason.merge(entry.getKey(), entry.getValue(), Math::max);
            }
        }

        LinkedHashMap<String, Job> jobs = new LinkedHashMap<>();
        for (Job job : loaded.jobs().values()) {
            if (acceptedJobs.containsKey(job.jobId())) {
                jobs.put(job.jobId(), job.status() == JobStatus.DONE ? job : job.withStatus(JobStatus.DONE));
            } else if (job.status() == JobStatus.DONE) {
                log.warn("Job {} is DONE in the snapshot but has no accepted ledger event; reverting to PENDING", job.jobId());
                jobs.put(job.jobId(), job.withStatus(JobStatus.PENDING));
            } else {
                jobs.put(job.jobId(), job);
            }
        }
        for (Map.Entry<String, Long> entry : acceptedJobs.entrySet()) {
            if (!jobs.containsKey(entry.getKey())) {
                jobs.put(entry.getKey(), new Job(entry.getKey(), null, JobStatus.DONE, entry.getValue(), 0, null));
            }
        }

        OrchestratorState rebuilt = new OrchestratorState(runId, jobs, accepted, rejected, rejectedByReason, lastSeq);
        boolean rewritten = false;
        if (!rebuilt.equals(loaded)) {
            stateStore.save(rebuilt);
            rewritten = true;
        }
        log.info("Recovery replayed {} ledger event(s): accepted={}, rejected={}, lastSeq={}, snapshotRewritten={}",
                events, accepted, rejected, lastSeq, rewritten);
        return new Recovered(dedupSet, rebuilt, events, rewritten);
    }

    private static long epochMs(String ts) {
        if (ts == null || ts.isBlank()) {
            return 0L;
        }
        try {
            return Instant.parse(ts).toEpochMilli();
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }

    public record Recovered(
            DedupSet dedupSet,
            OrchestratorState state,
            int ledgerEvents,
            boolean snapshotRewritten
    ) {
    }
}
