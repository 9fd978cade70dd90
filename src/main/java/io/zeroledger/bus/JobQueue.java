package io.zeroledger.bus;

import io.zeroledger.model.Job;
import io.zeroledger.model.WorkerMessage;

import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-process handoff between the orchestrator and its workers: jobs flow out, worker
 * messages flow back. Both directions are bounded; a worker publishing into a full
 * result channel blocks until the reducer catches up.
 */
public final class JobQueue {
    public static final int DEFAULT_RESULT_CAPACITY = 1024;

    private final BlockingQueue<Job> jobs;
    private final BlockingQueue<WorkerMessage> results;

    public JobQueue(int jobCapacity) {
        this(jobCapacity, DEFAULT_RESULT_CAPACITY);
    }

    public JobQueue(int jobCapacity, int resultCapacity) {
        this.jobs = new ArrayBlockingQueue<>(Math.max(1, jobCapacity));
        this.results = new ArrayBlockingQueue<>(Math.max(1, resultCapacity));
    }

    /**
     * @return {@code false} when the job channel is full
     */
    public boolean enqueueJob(Job job) {
        return jobs.offer(job);
    }

    public Optional<Job> claimJob(long timeoutMs) throws InterruptedException {
        return Optional.ofNullable(jobs.poll(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS));
    }

    public void publish(WorkerMessage message) throws InterruptedException {
        results.put(message);
    }

    public Optional<WorkerMessage> nextMessage(long timeoutMs) throws InterruptedException {
        return Optional.ofNullable(results.poll(Math.max(0L, timeoutMs), TimeUnit.MILLISECONDS));
    }

    public int queuedJobs() {
        return jobs.size();
    }

    public int queuedMessages() {
        return results.size();
    }
}
