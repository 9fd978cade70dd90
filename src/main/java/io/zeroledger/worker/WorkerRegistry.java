package io.zeroledger.worker;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class WorkerRegistry {
    private final Map<String, Worker> workers = new ConcurrentHashMap<>();

    public void register(Worker worker) {
        workers.put(worker.id(), worker);
    }

    public Optional<Worker> findById(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public Worker require(String workerId) {
        return findById(workerId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown worker: " + workerId + " (known: " + listWorkerIds() + ")"));
    }

    public Collection<String> listWorkerIds() {
        return workers.keySet();
    }
}
