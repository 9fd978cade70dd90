package io.zeroledger.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.zeroledger.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public final class ZeroLedgerConfig {
    public static final String DEFAULT_RUN_DIR = "run";
    public static final String SETTINGS_FILE = "zeroledger-settings.json";
    public static final double DEFAULT_EPS_ROOT = 1e-10;
    public static final int DEFAULT_CHECKPOINT_EVERY = 200;
    public static final int DEFAULT_MAX_ATTEMPTS = 1;
    public static final long DEFAULT_SCRIPT_TIMEOUT_MS = 60_000L;
    public static final String DEFAULT_WORKER = "synthetic";

    private final Path runDir;
    private final String runId;
    private final double epsRoot;
    private final int workerCount;
    private final int inFlightLimit;
    private final int checkpointEvery;
    private final boolean retainRejected;
    private final int maxAttempts;
    private final String worker;
    private final List<String> scriptCommand;
    private final long scriptTimeoutMs;

    private ZeroLedgerConfig(
            Path runDir,
            String runId,
            double epsRoot,
            int workerCount,
            int inFlightLimit,
            int checkpointEvery,
            boolean retainRejected,
            int maxAttempts,
            String worker,
            List<String> scriptCommand,
            long scriptTimeoutMs
    ) {
        if (!(epsRoot > 0.0d) || !Double.isFinite(epsRoot)) {
            throw new IllegalArgumentException("epsRoot must be a positive finite number: " + epsRoot);
        }
        this.runDir = runDir;
        this.runId = runId == null || runId.isBlank() ? defaultRunId(runDir) : runId.trim();
        this.epsRoot = epsRoot;
        this.workerCount = Math.max(1, workerCount);
        this.inFlightLimit = Math.max(1, inFlightLimit);
        this.checkpointEvery = Math.max(1, checkpointEvery);
        this.retainRejected = retainRejected;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.worker = worker == null || worker.isBlank() ? DEFAULT_WORKER : worker.trim();
        this.scriptCommand = scriptCommand == null ? List.of() : List.copyOf(scriptCommand);
        this.scriptTimeoutMs = Math.max(1_000L, scriptTimeoutMs);
    }

    public static ZeroLedgerConfig fromRunDir(String runDir) {
        Path resolved = runDir == null || runDir.isBlank()
                ? Paths.get(DEFAULT_RUN_DIR)
                : Paths.get(runDir);
        Path base = resolved.toAbsolutePath().normalize();
        int workers = Math.min(4, Math.max(1, Runtime.getRuntime().availableProcessors()));
        return new ZeroLedgerConfig(
                base,
                null,
                DEFAULT_EPS_ROOT,
                workers,
                workers * 2,
                DEFAULT_CHECKPOINT_EVERY,
                true,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_WORKER,
                List.of(),
                DEFAULT_SCRIPT_TIMEOUT_MS
        );
    }

    /**
     * Defaults for the run directory, overridden by {@value #SETTINGS_FILE} when present.
     */
    public static ZeroLedgerConfig load(String runDir) {
        ZeroLedgerConfig config = fromRunDir(runDir);
        Path settingsFile = config.settingsFile();
        if (!Files.exists(settingsFile)) {
            return config;
        }
        try {
            Settings settings = Jsons.mapper().readValue(settingsFile.toFile(), Settings.class);
            return config.apply(settings);
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + settingsFile + " (" + e.getMessage() + ")", e);
        }
    }

    public ZeroLedgerConfig apply(Settings settings) {
        if (settings == null) {
            return this;
        }
        return new ZeroLedgerConfig(
                runDir,
                settings.runId() != null ? settings.runId() : runId,
                settings.epsRoot() != null ? settings.epsRoot() : epsRoot,
                settings.workerCount() != null ? settings.workerCount() : workerCount,
                inFlightLimitFor(settings),
                settings.checkpointEvery() != null ? settings.checkpointEvery() : checkpointEvery,
                settings.retainRejected() != null ? settings.retainRejected() : retainRejected,
                settings.maxAttempts() != null ? settings.maxAttempts() : maxAttempts,
                settings.worker() != null ? settings.worker() : worker,
                settings.scriptCommand() != null ? settings.scriptCommand() : scriptCommand,
                settings.scriptTimeoutMs() != null ? settings.scriptTimeoutMs() : scriptTimeoutMs
        );
    }

    // A new worker count without an explicit limit re-derives the default of two jobs per worker.
    private int inFlightLimitFor(Settings settings) {
        if (settings.inFlightLimit() != null) {
            return settings.inFlightLimit();
        }
        if (settings.workerCount() != null) {
            return Math.max(1, settings.workerCount()) * 2;
        }
        return inFlightLimit;
    }

    public ZeroLedgerConfig withEpsRoot(double value) {
        return apply(new Settings(null, value, null, null, null, null, null, null, null, null));
    }

    public ZeroLedgerConfig withWorkerCount(int value) {
        return apply(new Settings(null, null, value, null, null, null, null, null, null, null));
    }

    public ZeroLedgerConfig withInFlightLimit(int value) {
        return apply(new Settings(null, null, null, value, null, null, null, null, null, null));
    }

    public ZeroLedgerConfig withCheckpointEvery(int value) {
        return apply(new Settings(null, null, null, null, value, null, null, null, null, null));
    }

    public ZeroLedgerConfig withRetainRejected(boolean value) {
        return apply(new Settings(null, null, null, null, null, value, null, null, null, null));
    }

    public ZeroLedgerConfig withMaxAttempts(int value) {
        return apply(new Settings(null, null, null, null, null, null, value, null, null, null));
    }

    public ZeroLedgerConfig withWorker(String value, List<String> command) {
        return apply(new Settings(null, null, null, null, null, null, null, value, command, null));
    }

    public ZeroLedgerConfig withRunId(String value) {
        return apply(new Settings(value, null, null, null, null, null, null, null, null, null));
    }

    private static String defaultRunId(Path runDir) {
        Path name = runDir == null ? null : runDir.getFileName();
        return name == null ? "run" : name.toString();
    }

    public Path runDir() {
        return runDir;
    }

    public String runId() {
        return runId;
    }

    public double epsRoot() {
        return epsRoot;
    }

    public int workerCount() {
        return workerCount;
    }

    public int inFlightLimit() {
        return inFlightLimit;
    }

    public int checkpointEvery() {
        return checkpointEvery;
    }

    public boolean retainRejected() {
        return retainRejected;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public String worker() {
        return worker;
    }

    public List<String> scriptCommand() {
        return scriptCommand;
    }

    public long scriptTimeoutMs() {
        return scriptTimeoutMs;
    }

    public Path ledgerFile() {
        return runDir.resolve("ledger.jsonl");
    }

    public Path stateFile() {
        return runDir.resolve("state.json");
    }

    public Path lockFile() {
        return runDir.resolve("orchestrator.lock");
    }

    public Path compactedFile() {
        return runDir.resolve("merged_clean.jsonl");
    }

    public Path settingsFile() {
        return runDir.resolve(SETTINGS_FILE);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Settings(
            @JsonProperty("run_id") String runId,
            @JsonProperty("eps_root") Double epsRoot,
            @JsonProperty("worker_count") Integer workerCount,
            @JsonProperty("in_flight_limit") Integer inFlightLimit,
            @JsonProperty("checkpoint_every") Integer checkpointEvery,
            @JsonProperty("retain_rejected") Boolean retainRejected,
            @JsonProperty("max_attempts") Integer maxAttempts,
            @JsonProperty("worker") String worker,
            @JsonProperty("script_command") List<String> scriptCommand,
            @JsonProperty("script_timeout_ms") Long scriptTimeoutMs
    ) {
    }
}
