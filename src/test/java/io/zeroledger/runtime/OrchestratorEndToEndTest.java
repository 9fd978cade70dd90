package io.zeroledger.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.compact.Compactor;
import io.zeroledger.config.ZeroLedgerConfig;
import io.zeroledger.ledger.ChainVerification;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.lock.LockConflictException;
import io.zeroledger.model.AcceptResult;
import io.zeroledger.model.EventKind;
import io.zeroledger.model.Job;
import io.zeroledger.model.JobStatus;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.model.OrchestratorState;
import io.zeroledger.model.RejectReason;
import io.zeroledger.recovery.Recovery;
import io.zeroledger.util.Jsons;
import io.zeroledger.worker.SyntheticRootWorker;
import io.zeroledger.worker.Worker;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class OrchestratorEndToEndTest {

    @Test
    void acceptsRejectsAndDeduplicatesAcrossRestart() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString()).withEpsRoot(1e-10);
            AcceptResult accepted;
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                accepted = orchestrator.submit(json("{\"t\":14.134725,\"root_val\":1e-14,\"meta\":{\"method\":\"stub\",\"iters\":12}}"));
                AcceptResult far = orchestrator.submit(json("{\"t\":14.134725,\"root_val\":5.0}"));
                AcceptResult duplicate = orchestrator.submit(json("{\"t\":14.134725,\"root_val\":1e-14,\"meta\":{\"method\":\"newton\"}}"));

                Assertions.assertTrue(accepted.accepted());
                Assertions.assertEquals(RejectReason.OUT_OF_TOLERANCE, far.reason());
                Assertions.assertEquals(RejectReason.DUPLICATE, duplicate.reason());
                Orchestrator.RunSummary summary = orchestrator.summary();
                Assertions.assertEquals(1L, summary.accepted());
                Assertions.assertEquals(2L, summary.rejected());
                Assertions.assertEquals(3L, summary.lastSeq());
            }
            Assertions.assertFalse(Files.exists(config.lockFile()));

            List<LedgerEvent> events = new Ledger(config.ledgerFile()).readAll();
            Assertions.assertEquals(List.of(EventKind.ACCEPTED, EventKind.REJECTED, EventKind.REJECTED),
                    events.stream().map(LedgerEvent::kind).toList());
            Assertions.assertTrue(new Ledger(config.ledgerFile()).verifyChain().ok());

            try (Orchestrator restarted = new Orchestrator(config)) {
                Recovery.Recovered recovered = restarted.start();
                Assertions.assertTrue(recovered.dedupSet().contains(accepted.hash()));
                Assertions.assertEquals(3, recovered.ledgerEvents());

                AcceptResult again = restarted.submit(json("{\"t\":14.134725,\"root_val\":1e-14}"));
                Assertions.assertEquals(RejectReason.DUPLICATE, again.reason());
                Assertions.assertEquals(4L, again.seq());
                Assertions.assertTrue(restarted.verify().ok());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unretainedRejectionsStayCountedAcrossRestart() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-noretain-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString()).withRetainRejected(false);
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                AcceptResult far = orchestrator.submit(json("{\"t\":2,\"root_val\":5.0}"));
                Assertions.assertEquals(-1L, far.seq());
                Assertions.assertEquals(1L, orchestrator.summary().rejected());
            }
            Assertions.assertEquals(0, new Ledger(config.ledgerFile()).readAll().size());

            try (Orchestrator restarted = new Orchestrator(config)) {
                restarted.start();
                Orchestrator.RunSummary summary = restarted.summary();
                Assertions.assertEquals(1L, summary.rejected());
                Assertions.assertEquals(Map.of("OUT_OF_TOLERANCE", 1L), summary.rejectedByReason());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secondInstanceFailsBeforeTouchingTheLedger() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-lock-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());
            try (Orchestrator first = new Orchestrator(config)) {
                first.start();
                first.submit(json("{\"t\":1.0,\"root_val\":0.0}"));
                byte[] ledgerBefore = Files.readAllBytes(config.ledgerFile());
                boolean stateExisted = Files.exists(config.stateFile());

                Orchestrator second = new Orchestrator(config);
                Assertions.assertThrows(LockConflictException.class, second::start);
                second.close();

                Assertions.assertArrayEquals(ledgerBefore, Files.readAllBytes(config.ledgerFile()));
                Assertions.assertEquals(stateExisted, Files.exists(config.stateFile()));
                Assertions.assertTrue(Files.exists(config.lockFile()));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leftoverLockRequiresOperatorUnlock() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-stale-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());
            Files.writeString(config.lockFile(),
                    "{\"pid\":999999999,\"host\":\"crashed\",\"token\":\"t-0\",\"acquired_at\":\"2020-01-01T00:00:00Z\"}",
                    StandardCharsets.UTF_8);

            Assertions.assertThrows(LockConflictException.class, () -> new Orchestrator(config).start());
            Assertions.assertFalse(Files.exists(config.ledgerFile()));
            Assertions.assertFalse(Files.exists(config.stateFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runsSyntheticJobsToCompletion() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-run-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString()).withWorkerCount(2).withInFlightLimit(2);
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                orchestrator.registerJobs(List.of(
                        json("{\"job_id\":\"range-a\",\"payload\":{\"t_start\":0.0,\"t_end\":1.0,\"stride\":0.25}}"),
                        json("{\"job_id\":\"range-b\",\"payload\":{\"t_start\":1.0,\"t_end\":2.0,\"stride\":0.5}}"),
                        json("{\"job_id\":\"range-c\",\"payload\":{\"t_start\":2.0,\"t_end\":3.0,\"stride\":1.0}}"),
                        json("{\"job_id\":\"broken\",\"payload\":{\"t_start\":0.0}}")
                ));

                Orchestrator.RunSummary summary = orchestrator.run(orchestrator.worker(SyntheticRootWorker.ID));

                Assertions.assertEquals(7L, summary.accepted());
                Assertions.assertEquals(0L, summary.rejected());
                Assertions.assertEquals(3, summary.done());
                Assertions.assertEquals(1, summary.failed());
                Assertions.assertEquals(0, summary.pending());
                Assertions.assertEquals(7, summary.acceptedHashes());
                Assertions.assertEquals(JobStatus.FAILED, orchestrator.state().jobs().get("broken").status());
            }
            ChainVerification verification = new Ledger(config.ledgerFile()).verifyChain();
            Assertions.assertTrue(verification.ok());
            Assertions.assertEquals(7, verification.checkedEvents());

            OrchestratorState persisted;
            try (Orchestrator reopened = new Orchestrator(config)) {
                Recovery.Recovered recovered = reopened.start();
                Assertions.assertFalse(recovered.snapshotRewritten());
                persisted = reopened.state();
                Orchestrator.RunSummary second = reopened.run(reopened.worker(SyntheticRootWorker.ID));
                Assertions.assertEquals(7L, second.accepted());
            }
            Assertions.assertEquals(7L, persisted.acceptedCount());

            Compactor.CompactionReport report = new Compactor().compact(config.ledgerFile(), config.compactedFile());
            Assertions.assertEquals(7, report.kept());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedAndFarCandidatesFromWorkersAreRecordedNotFatal() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-fixed-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString()).withWorkerCount(3);
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.register(new FixedWorker());
                orchestrator.start();
                orchestrator.registerJobs(List.of(
                        json("{\"job_id\":\"one\"}"),
                        json("{\"job_id\":\"two\"}"),
                        json("{\"job_id\":\"misses\"}")
                ));

                Orchestrator.RunSummary summary = orchestrator.run(orchestrator.worker(FixedWorker.ID));

                Assertions.assertEquals(1L, summary.accepted());
                Assertions.assertEquals(5L, summary.rejected());
                Assertions.assertEquals(1L, summary.rejectedByReason().get("DUPLICATE"));
                Assertions.assertEquals(3L, summary.rejectedByReason().get("OUT_OF_TOLERANCE"));
                Assertions.assertEquals(1L, summary.rejectedByReason().get("SCHEMA_INVALID"));
                OrchestratorState state = orchestrator.state();
                JobStatus one = state.jobs().get("one").status();
                JobStatus two = state.jobs().get("two").status();
                Assertions.assertTrue(one == JobStatus.DONE ^ two == JobStatus.DONE);
                Assertions.assertEquals(JobStatus.RUNNING, state.jobs().get("misses").status());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void requeueMovesStrandedJobBackToPending() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-requeue-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.register(new FixedWorker());
                orchestrator.start();
                orchestrator.registerJobs(List.of(json("{\"job_id\":\"misses\"}")));
                orchestrator.run(orchestrator.worker(FixedWorker.ID));
            }
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                Job requeued = orchestrator.requeue("misses");
                Assertions.assertEquals(JobStatus.PENDING, requeued.status());
            }
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                Assertions.assertEquals(JobStatus.PENDING, orchestrator.state().jobs().get("misses").status());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inspectDoesNotTakeTheLock() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-e2e-status-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                orchestrator.submit(json("{\"t\":1.0,\"root_val\":0.0}"));
                orchestrator.submit(json("{\"t\":1.0,\"root_val\":1.0}"));

                Orchestrator.StatusReport status = Orchestrator.inspect(config);
                Assertions.assertTrue(status.locked());
                Assertions.assertEquals(ProcessHandle.current().pid(), status.lockHolder().pid());
                Assertions.assertEquals(1L, status.ledgerAccepted());
                Assertions.assertEquals(1L, status.ledgerRejected());
                Assertions.assertEquals(2L, status.ledgerLastSeq());
            }
            Assertions.assertFalse(Orchestrator.inspect(config).locked());
        } finally {
            deleteRecursively(root);
        }
    }

    /**
     * "one" and "two" both produce the same root; "misses" only produces far and malformed candidates.
     */
    private static final class FixedWorker implements Worker {
        static final String ID = "fixed";

        @Override
        public String id() {
            return ID;
        }

        @Override
        public List<JsonNode> compute(Job job) throws IOException {
            if ("misses".equals(job.jobId())) {
                ObjectNode broken = JsonNodeFactory.instance.objectNode().put("t", 3.0);
                return List.of(json("{\"t\":3.0,\"root_val\":0.5}"), broken);
            }
            return List.of(json("{\"t\":7.5,\"root_val\":-2e-13}"), json("{\"t\":7.5,\"root_val\":0.25}"));
        }
    }

    private static JsonNode json(String raw) throws IOException {
        return Jsons.mapper().readTree(raw);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
