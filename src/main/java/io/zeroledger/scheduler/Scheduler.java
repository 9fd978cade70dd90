package io.zeroledger.scheduler;

import io.zeroledger.bus.JobQueue;
import io.zeroledger.model.AcceptResult;
import io.zeroledger.model.Job;
import io.zeroledger.model.JobStatus;
import io.zeroledger.model.OrchestratorState;
import io.zeroledger.storage.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Owns the job lifecycle and is the only writer of the state snapshot.
 *
 * <p>PENDING jobs are dispatched in registration order while fewer than
 * {@code inFlightLimit} dispatched jobs are outstanding. A job becomes DONE on its first
 * accepted ledger event and FAILED on an explicit worker failure once its attempts are
 * used up. Rejected candidates never fail a job.
 *
 * <p>A job that is RUNNING when the process starts stays RUNNING: there is no stale-job
 * detection, only the operator {@link #requeue(String)}.
 */
public final class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final StateStore stateStore;
    private final JobQueue queue;
    private final int inFlightLimit;
    private final int checkpointEvery;
    private final int maxAttempts;
    private final String runId;
    private final LinkedHashMap<String, Job> jobs;
    private final Map<String, Long> rejectedByReason;
    private final Set<String> inFlight;
    private long acceptedCount;
    private long rejectedCount;
    private long lastSeq;
    private int eventsSinceFlush;

    public Scheduler(
            OrchestratorState initial,
            StateStore stateStore,
            JobQueue queue,
            int inFlightLimit,
            int checkpointEvery,
            int maxAttempts
    ) {
        this.stateStore = stateStore;
        this.queue = queue;
        this.inFlightLimit = Math.max(1, inFlightLimit);
        this.checkpointEvery = Math.max(1, checkpointEvery);
        this.maxAttempts = Math.max(1, maxAttempts);
        this.runId = initial.runId();
        this.jobs = new LinkedHashMap<>(initial.jobs());
        this.rejectedByReason = new TreeMap<>(initial.rejectedByReason());
        this.inFlight = new LinkedHashSet<>();
        this.acceptedCount = initial.acceptedCount();
        this.rejectedCount = initial.rejectedCount();
        this.lastSeq = initial.lastSeq();
        List<String> orphaned = orphanedRunning();
        if (!orphaned.isEmpty()) {
            log.warn("{} job(s) left RUNNING by a previous process are not retried automatically: {}",
                    orphaned.size(), orphaned);
        }
    }

    /**
     * Adds jobs not yet known; known job ids keep their current status.
     *
     * @return number of newly registered jobs
     */
    public synchronized int register(List<Job> incoming) {
        int added = 0;
        for (Job job : incoming) {
            if (!jobs.containsKey(job.jobId())) {
                jobs.put(job.jobId(), job);
                added++;
            }
        }
        if (added > 0) {
            flush();
        }
        return added;
    }

    /**
     * Moves PENDING jobs to RUNNING and hands them to workers, oldest first, up to the
     * in-flight limit.
     *
     * @return number of jobs dispatched
     */
    public synchronized int dispatchReady() {
        int dispatched = 0;
        for (Job job : new ArrayList<>(jobs.values())) {
            if (inFlight.size() >= inFlightLimit) {
                break;
            }
            if (job.status() != JobStatus.PENDING) {
                continue;
            }
            Job running = job.withStatus(JobStatus.RUNNING);
            if (!queue.enqueueJob(running)) {
                break;
            }
            jobs.put(running.jobId(), running);
            inFlight.add(running.jobId());
            dispatched++;
        }
        if (dispatched > 0) {
            log.debug("Dispatched {} job(s), in flight={}", dispatched, inFlight.size());
            flush();
        }
        return dispatched;
    }

    public synchronized void onResult(String jobId, AcceptResult result) {
        if (result.seq() > lastSeq) {
            lastSeq = result.seq();
        }
        if (result.accepted()) {
            acceptedCount++;
            Job job = jobId == null ? null : jobs.get(jobId);
            if (job != null && job.status() != JobStatus.DONE) {
                jobs.put(jobId, job.withStatus(JobStatus.DONE));
            }
        } else {
            rejectedCount++;
            rejectedByReason.merge(result.reason().name(), 1L, Long::sum);
        }
        eventsSinceFlush++;
        if (eventsSinceFlush >= checkpointEvery) {
            flush();
        }
    }

    /**
     * The worker returned from the job. The in-flight slot is released; a job with no
     * accepted candidate keeps its RUNNING status.
     */
    public synchronized void onWorkerFinished(String jobId) {
        inFlight.remove(jobId);
        Job job = jobs.get(jobId);
        if (job != null && job.status() == JobStatus.RUNNING) {
            log.debug("Job {} finished without an accepted candidate; it stays RUNNING", jobId);
        }
    }

    public synchronized void onWorkerFailed(String jobId, String error) {
        inFlight.remove(jobId);
        Job job = jobs.get(jobId);
        if (job == null || job.status() != JobStatus.RUNNING) {
            return;
        }
        JobStatus next = job.attempts() + 1 >= maxAttempts ? JobStatus.FAILED : JobStatus.PENDING;
        Job updated = job.withFailure(next, error);
        jobs.put(jobId, updated);
        log.warn("Job {} failed (attempt {} of {}): {} -> {}", jobId, updated.attempts(), maxAttempts, error, next);
        flush();
    }

    /**
     * Operator action: puts a RUNNING or FAILED job back to PENDING.
     */
    public synchronized Job requeue(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new IllegalArgumentException("Unknown job: " + jobId);
        }
        if (job.status() == JobStatus.DONE || job.status() == JobStatus.PENDING) {
            throw new IllegalStateException("Job " + jobId + " is " + job.status() + " and cannot be requeued");
        }
        Job pending = job.withStatus(JobStatus.PENDING);
        jobs.put(jobId, pending);
        inFlight.remove(jobId);
        flush();
        log.info("Job {} requeued from {}", jobId, job.status());
        return pending;
    }

    public synchronized int inFlight() {
        return inFlight.size();
    }

    public synchronized boolean hasOutstandingWork() {
        if (!inFlight.isEmpty()) {
            return true;
        }
        for (Job job : jobs.values()) {
            if (job.status() == JobStatus.PENDING) {
                return true;
            }
        }
        return false;
    }

    public synchronized List<String> orphanedRunning() {
        List<String> out = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (job.status() == JobStatus.RUNNING && !inFlight.contains(job.jobId())) {
                out.add(job.jobId());
            }
        }
        return out;
    }

    public synchronized OrchestratorState snapshot() {
        return new OrchestratorState(runId, jobs, acceptedCount, rejectedCount, rejectedByReason, lastSeq);
    }

    public synchronized void flush() {
        stateStore.save(snapshot());
        eventsSinceFlush = 0;
    }
}
