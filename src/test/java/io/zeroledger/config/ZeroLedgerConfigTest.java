package io.zeroledger.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class ZeroLedgerConfigTest {

    @Test
    void defaultsFollowRunDirectory() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-config-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.load(root.toString());

            Assertions.assertEquals(root.toAbsolutePath().normalize(), config.runDir());
            Assertions.assertEquals(root.getFileName().toString(), config.runId());
            Assertions.assertEquals(1e-10, config.epsRoot());
            Assertions.assertTrue(config.workerCount() >= 1 && config.workerCount() <= 4);
            Assertions.assertEquals(config.workerCount() * 2, config.inFlightLimit());
            Assertions.assertEquals(200, config.checkpointEvery());
            Assertions.assertTrue(config.retainRejected());
            Assertions.assertEquals(1, config.maxAttempts());
            Assertions.assertEquals("synthetic", config.worker());
            Assertions.assertEquals(root.resolve("ledger.jsonl").toAbsolutePath().normalize(), config.ledgerFile());
            Assertions.assertEquals("orchestrator.lock", config.lockFile().getFileName().toString());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesDefaults() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-config-settings-");
        try {
            Files.writeString(root.resolve(ZeroLedgerConfig.SETTINGS_FILE), """
                    {
                      "run_id": "zeta-scan",
                      "eps_root": 1e-12,
                      "worker_count": 3,
                      "in_flight_limit": 5,
                      "retain_rejected": false,
                      "max_attempts": 2,
                      "worker": "script",
                      "script_command": ["python3", "miner.py"],
                      "unknown_key": true
                    }
                    """, StandardCharsets.UTF_8);

            ZeroLedgerConfig config = ZeroLedgerConfig.load(root.toString());

            Assertions.assertEquals("zeta-scan", config.runId());
            Assertions.assertEquals(1e-12, config.epsRoot());
            Assertions.assertEquals(3, config.workerCount());
            Assertions.assertEquals(5, config.inFlightLimit());
            Assertions.assertFalse(config.retainRejected());
            Assertions.assertEquals(2, config.maxAttempts());
            Assertions.assertEquals("script", config.worker());
            Assertions.assertEquals(List.of("python3", "miner.py"), config.scriptCommand());
            Assertions.assertEquals(200, config.checkpointEvery());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inFlightLimitFollowsChosenWorkerCount() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-config-inflight-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());

            ZeroLedgerConfig wide = config.withWorkerCount(16);
            Assertions.assertEquals(16, wide.workerCount());
            Assertions.assertEquals(32, wide.inFlightLimit());

            ZeroLedgerConfig pinned = config.withWorkerCount(16).withInFlightLimit(5);
            Assertions.assertEquals(5, pinned.inFlightLimit());
            Assertions.assertEquals(5, pinned.withEpsRoot(1e-12).inFlightLimit());

            Files.writeString(root.resolve(ZeroLedgerConfig.SETTINGS_FILE), "{\"worker_count\": 12}", StandardCharsets.UTF_8);
            ZeroLedgerConfig loaded = ZeroLedgerConfig.load(root.toString());
            Assertions.assertEquals(12, loaded.workerCount());
            Assertions.assertEquals(24, loaded.inFlightLimit());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rejectsInvalidValues() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-config-invalid-");
        try {
            ZeroLedgerConfig config = ZeroLedgerConfig.fromRunDir(root.toString());
            Assertions.assertThrows(IllegalArgumentException.class, () -> config.withEpsRoot(0.0));
            Assertions.assertThrows(IllegalArgumentException.class, () -> config.withEpsRoot(Double.NaN));
            Assertions.assertEquals(1, config.withWorkerCount(0).workerCount());

            Files.writeString(root.resolve(ZeroLedgerConfig.SETTINGS_FILE), "{not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> ZeroLedgerConfig.load(root.toString()));
        } finally {
            deleteRecursively(root);
        }
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
