package io.zeroledger.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.bus.JobQueue;
import io.zeroledger.model.Job;
import io.zeroledger.model.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * N worker loops pulling jobs from the queue. Each job yields its candidates as RESULT
 * messages followed by JOB_FINISHED, or JOB_FAILED if the worker throws, {@link Error}s
 * included. Closing the pool stops claiming new jobs; a computation still in progress is
 * abandoned, not cancelled.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);
    private static final long CLAIM_POLL_MS = 100L;
    private static final long SHUTDOWN_GRACE_MS = 2_000L;

    private final Worker worker;
    private final JobQueue queue;
    private final int size;
    private final ExecutorService executor;
    private volatile boolean running;

    public WorkerPool(Worker worker, JobQueue queue, int size) {
        this.worker = worker;
        this.queue = queue;
        this.size = Math.max(1, size);
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(this.size, r -> {
            Thread thread = new Thread(r, "zeroledger-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        for (int i = 0; i < size; i++) {
            String workerId = worker.id() + "-" + i;
            executor.submit(() -> loop(workerId));
        }
        log.info("Started {} '{}' worker(s)", size, worker.id());
    }

    private void loop(String workerId) {
        try {
            while (running) {
                Optional<Job> claimed = queue.claimJob(CLAIM_POLL_MS);
                if (claimed.isPresent()) {
                    process(workerId, claimed.get());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void process(String workerId, Job job) throws InterruptedException {
        List<JsonNode> candidates;
        try {
            candidates = worker.compute(job);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Worker {} failed on job {}: {}", workerId, job.jobId(), e.toString());
            queue.publish(WorkerMessage.failed(workerId, job.jobId(), e.toString()));
            return;
        } catch (Error e) {
            log.error("Worker {} crashed on job {}", workerId, job.jobId(), e);
            queue.publish(WorkerMessage.failed(workerId, job.jobId(), e.toString()));
            return;
        }
        for (JsonNode candidate : candidates == null ? List.<JsonNode>of() : candidates) {
            queue.publish(WorkerMessage.result(workerId, job.jobId(), candidate));
        }
        queue.publish(WorkerMessage.finished(workerId, job.jobId()));
    }

    @Override
    public synchronized void close() {
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Worker threads still busy after {}ms; abandoning their jobs", SHUTDOWN_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
