package io.zeroledger.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.bus.JobQueue;
import io.zeroledger.config.ZeroLedgerConfig;
import io.zeroledger.contract.ContractValidator;
import io.zeroledger.contract.ResultContract;
import io.zeroledger.ledger.CanonicalHasher;
import io.zeroledger.ledger.ChainVerification;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.lock.LockGuard;
import io.zeroledger.model.AcceptResult;
import io.zeroledger.model.EventKind;
import io.zeroledger.model.Job;
import io.zeroledger.model.JobStatus;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.model.OrchestratorState;
import io.zeroledger.model.WorkerMessage;
import io.zeroledger.pipeline.AbsoluteTolerance;
import io.zeroledger.pipeline.AcceptancePipeline;
import io.zeroledger.pipeline.ToleranceCheck;
import io.zeroledger.recovery.Recovery;
import io.zeroledger.scheduler.Scheduler;
import io.zeroledger.storage.StateStore;
import io.zeroledger.worker.ScriptWorker;
import io.zeroledger.worker.SyntheticRootWorker;
import io.zeroledger.worker.Worker;
import io.zeroledger.worker.WorkerPool;
import io.zeroledger.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * One orchestrator process over a run directory.
 *
 * <p>{@link #start()} takes the single-writer lock before touching the ledger, then
 * replays the ledger to rebuild dedup and job state. From then on every candidate, whether
 * it arrives from the worker pool or through {@link #submit}, passes the acceptance
 * pipeline and is reported to the scheduler. {@link #close()} flushes the snapshot,
 * closes the ledger and releases the lock.
 */
public final class Orchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final long MESSAGE_POLL_MS = 100L;

    private final ZeroLedgerConfig config;
    private final LockGuard lockGuard;
    private final Ledger ledger;
    private final StateStore stateStore;
    private final ContractValidator validator;
    private final ResultContract resultContract;
    private final ToleranceCheck toleranceCheck;
    private final CanonicalHasher hasher;
    private final WorkerRegistry workerRegistry;
    private LockGuard.LockHandle lock;
    private JobQueue queue;
    private AcceptancePipeline pipeline;
    private Scheduler scheduler;

    public Orchestrator(ZeroLedgerConfig config) {
        this(config, null, null);
    }

    /**
     * @param resultContract result schema, or {@code null} for the built-in root-finding contract
     * @param toleranceCheck acceptance criterion, or {@code null} for {@code |root_val| < eps_root}
     */
    public Orchestrator(ZeroLedgerConfig config, ResultContract resultContract, ToleranceCheck toleranceCheck) {
        this.config = config;
        this.lockGuard = new LockGuard(config.lockFile());
        this.ledger = new Ledger(config.ledgerFile());
        this.stateStore = new StateStore(config.stateFile());
        this.validator = new ContractValidator();
        this.resultContract = resultContract == null ? validator : resultContract;
        this.toleranceCheck = toleranceCheck == null ? new AbsoluteTolerance(config.epsRoot()) : toleranceCheck;
        this.hasher = new CanonicalHasher();
        this.workerRegistry = new WorkerRegistry();
        registerDefaultWorkers();
    }

    public synchronized Recovery.Recovered start() {
        if (scheduler != null) {
            throw new IllegalStateException("Orchestrator already started");
        }
        lock = lockGuard.acquire();
        try {
            ledger.openForAppend();
            Recovery.Recovered recovered = new Recovery(hasher, config.retainRejected())
                    .recover(ledger, stateStore, config.runId());
            queue = new JobQueue(config.inFlightLimit());
            pipeline = new AcceptancePipeline(
                    resultContract,
                    toleranceCheck,
                    hasher,
                    recovered.dedupSet(),
                    ledger,
                    config.runId(),
                    config.retainRejected()
            );
            scheduler = new Scheduler(
                    recovered.state(),
                    stateStore,
                    queue,
                    config.inFlightLimit(),
                    config.checkpointEvery(),
                    config.maxAttempts()
            );
            log.info("Orchestrator {} started in {} (seq={}, accepted hashes={})",
                    config.runId(), config.runDir(), recovered.state().lastSeq(), recovered.dedupSet().size());
            return recovered;
        } catch (RuntimeException e) {
            ledger.close();
            lock.close();
            lock = null;
            throw e;
        }
    }

    public void register(Worker worker) {
        workerRegistry.register(worker);
    }

    public Worker worker(String workerId) {
        return workerRegistry.require(workerId);
    }

    /**
     * Validates job specs and registers the ones not seen before.
     *
     * @return number of newly registered jobs
     */
    public int registerJobs(List<JsonNode> specs) {
        requireStarted();
        long now = Instant.now().toEpochMilli();
        List<Job> jobs = new ArrayList<>();
        for (JsonNode spec : specs) {
            jobs.add(validator.validateJob(spec, now));
        }
        int added = scheduler.register(jobs);
        log.info("Registered {} new job(s) of {}", added, jobs.size());
        return added;
    }

    public AcceptResult submit(JsonNode candidate) {
        return submit(candidate, null, null);
    }

    public AcceptResult submit(JsonNode candidate, String jobId, String workerId) {
        requireStarted();
        AcceptResult result = pipeline.accept(candidate, jobId, workerId);
        scheduler.onResult(jobId, result);
        return result;
    }

    /**
     * Dispatches every PENDING job to a pool of the given worker and reduces their messages
     * until no dispatched job is outstanding.
     */
    public RunSummary run(Worker worker) {
        requireStarted();
        try (WorkerPool pool = new WorkerPool(worker, queue, config.workerCount())) {
            pool.start();
            scheduler.dispatchReady();
            long handled = 0L;
            while (scheduler.hasOutstandingWork()) {
                Optional<WorkerMessage> message = queue.nextMessage(MESSAGE_POLL_MS);
                if (message.isPresent()) {
                    handle(message.get());
                    handled++;
                    if (handled % 1_000L == 0L) {
                        log.info("Processed {} worker message(s), in flight={}", handled, scheduler.inFlight());
                    }
                }
                scheduler.dispatchReady();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run interrupted; jobs in flight are abandoned and stay RUNNING");
        }
        scheduler.flush();
        RunSummary summary = summary();
        log.info("Run finished: {}", summary);
        return summary;
    }

    public Job requeue(String jobId) {
        requireStarted();
        return scheduler.requeue(jobId);
    }

    public OrchestratorState state() {
        requireStarted();
        return scheduler.snapshot();
    }

    public RunSummary summary() {
        requireStarted();
        OrchestratorState state = scheduler.snapshot();
        Map<JobStatus, Integer> counts = state.countByStatus();
        return new RunSummary(
                state.acceptedCount(),
                state.rejectedCount(),
                state.rejectedByReason(),
                counts.get(JobStatus.PENDING),
                counts.get(JobStatus.RUNNING),
                counts.get(JobStatus.DONE),
                counts.get(JobStatus.FAILED),
                state.lastSeq(),
                pipeline.acceptedHashes()
        );
    }

    public ChainVerification verify() {
        return ledger.verifyChain();
    }

    /**
     * Read-only view of a run directory. Does not take the lock, so it can be used while
     * another process is running.
     */
    public static StatusReport inspect(ZeroLedgerConfig config) {
        LockGuard guard = new LockGuard(config.lockFile());
        OrchestratorState snapshot = new StateStore(config.stateFile()).load(config.runId());
        long accepted = 0L;
        long rejected = 0L;
        long lastSeq = 0L;
        Map<String, Long> byReason = new TreeMap<>();
        try (Stream<LedgerEvent> events = new Ledger(config.ledgerFile()).replay()) {
            Iterator<LedgerEvent> it = events.iterator();
            while (it.hasNext()) {
                LedgerEvent event = it.next();
                lastSeq = Math.max(lastSeq, event.seq());
                if (event.kind() == EventKind.ACCEPTED) {
                    accepted++;
                } else {
                    rejected++;
                    byReason.merge(event.reason() == null ? "UNKNOWN" : event.reason().name(), 1L, Long::sum);
                }
            }
        }
        Map<JobStatus, Integer> counts = snapshot.countByStatus();
        return new StatusReport(
                config.runId(),
                config.runDir().toString(),
                guard.isLocked(),
                guard.holder().orElse(null),
                accepted,
                rejected,
                byReason,
                lastSeq,
                counts.get(JobStatus.PENDING),
                counts.get(JobStatus.RUNNING),
                counts.get(JobStatus.DONE),
                counts.get(JobStatus.FAILED)
        );
    }

    private void handle(WorkerMessage message) {
        switch (message.kind()) {
            case RESULT -> submit(message.payload(), message.jobId(), message.workerId());
            case JOB_FINISHED -> scheduler.onWorkerFinished(message.jobId());
            case JOB_FAILED -> scheduler.onWorkerFailed(message.jobId(), message.error());
        }
    }

    private void requireStarted() {
        if (scheduler == null) {
            throw new IllegalStateException("Orchestrator not started");
        }
    }

    private void registerDefaultWorkers() {
        workerRegistry.register(new SyntheticRootWorker());
        if (!config.scriptCommand().isEmpty()) {
            workerRegistry.register(new ScriptWorker(config.scriptCommand(), config.scriptTimeoutMs()));
        }
    }

    @Override
    public synchronized void close() {
        try {
            if (scheduler != null) {
                scheduler.flush();
            }
        } finally {
            try {
                ledger.close();
            } finally {
                if (lock != null) {
                    lock.close();
                    lock = null;
                }
                scheduler = null;
            }
        }
    }

    public record StatusReport(
            String runId,
            String runDir,
            boolean locked,
            LockGuard.LockInfo lockHolder,
            long ledgerAccepted,
            long ledgerRejected,
            Map<String, Long> ledgerRejectedByReason,
            long ledgerLastSeq,
            int pending,
            int running,
            int done,
            int failed
    ) {
    }

    public record RunSummary(
            long accepted,
            long rejected,
            Map<String, Long> rejectedByReason,
            int pending,
            int running,
            int done,
            int failed,
            long lastSeq,
            int acceptedHashes
    ) {
    }
}
