package io.zeroledger.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.config.ZeroLedgerConfig;
import io.zeroledger.compact.Compactor;
import io.zeroledger.ledger.ChainVerification;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.ledger.LedgerCorruptedException;
import io.zeroledger.ledger.LedgerIoException;
import io.zeroledger.lock.LockConflictException;
import io.zeroledger.lock.LockGuard;
import io.zeroledger.model.Job;
import io.zeroledger.runtime.Orchestrator;
import io.zeroledger.util.Jsons;
import io.zeroledger.worker.ScriptWorker;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "zeroledger",
        mixinStandardHelpOptions = true,
        description = "Single-writer job orchestrator with a hash-chained result ledger",
        subcommands = {
                ZeroLedgerCommand.RunCommand.class,
                ZeroLedgerCommand.StatusCommand.class,
                ZeroLedgerCommand.VerifyCommand.class,
                ZeroLedgerCommand.CompactCommand.class,
                ZeroLedgerCommand.UnlockCommand.class,
                ZeroLedgerCommand.RequeueCommand.class
        }
)
public final class ZeroLedgerCommand implements Runnable {
    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_CHAIN_MISMATCH = 2;
    public static final int EXIT_LOCK_CONFLICT = 3;
    public static final int EXIT_LEDGER_IO = 4;

    @Option(names = {"--run-dir"}, description = "Run directory holding ledger, state and lock", defaultValue = ZeroLedgerConfig.DEFAULT_RUN_DIR)
    String runDir;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | status | verify | compact | unlock | requeue");
    }

    public static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new ZeroLedgerCommand());
        cli.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            commandLine.getErr().println("ERROR " + ex.getMessage());
            return exitCodeFor(ex);
        });
        return cli;
    }

    static int exitCodeFor(Throwable error) {
        if (error instanceof LockConflictException) {
            return EXIT_LOCK_CONFLICT;
        }
        if (error instanceof LedgerIoException || error instanceof LedgerCorruptedException) {
            return EXIT_LEDGER_IO;
        }
        return EXIT_USAGE;
    }

    ZeroLedgerConfig config() {
        return ZeroLedgerConfig.load(runDir);
    }

    @Command(name = "run", description = "Register jobs and process every PENDING job")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Option(names = {"--jobs"}, description = "JSON file with an array of job specs")
        String jobs;

        @Option(names = {"--worker"}, description = "Worker id: synthetic | script")
        String worker;

        @Option(names = {"--script"}, arity = "1..*", description = "Command line for the script worker")
        List<String> script;

        @Option(names = {"--workers"}, description = "Worker thread count")
        Integer workers;

        @Option(names = {"--in-flight"}, description = "Max dispatched jobs outstanding")
        Integer inFlight;

        @Option(names = {"--eps-root"}, description = "Acceptance tolerance for |root_val|")
        Double epsRoot;

        @Override
        public Integer call() throws Exception {
            ZeroLedgerConfig config = parent.config();
            if (epsRoot != null) {
                config = config.withEpsRoot(epsRoot);
            }
            if (workers != null) {
                config = config.withWorkerCount(workers);
            }
            if (inFlight != null) {
                config = config.withInFlightLimit(inFlight);
            }
            if (worker != null || script != null) {
                String workerId = worker == null ? ScriptWorker.ID : worker;
                config = config.withWorker(workerId, script);
            }
            try (Orchestrator orchestrator = new Orchestrator(config)) {
                orchestrator.start();
                if (jobs != null) {
                    JsonNode specs = Jsons.mapper().readTree(Path.of(jobs).toFile());
                    if (specs == null || !specs.isArray()) {
                        throw new IllegalArgumentException("Jobs file must contain a JSON array: " + jobs);
                    }
                    List<JsonNode> list = new ArrayList<>();
                    specs.forEach(list::add);
                    orchestrator.registerJobs(list);
                }
                Orchestrator.RunSummary summary = orchestrator.run(orchestrator.worker(config.worker()));
                System.out.println(Jsons.toJson(summary));
            }
            return EXIT_OK;
        }
    }

    @Command(name = "status", description = "Show ledger, job and lock status without taking the lock")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(Orchestrator.inspect(parent.config())));
            return EXIT_OK;
        }
    }

    @Command(name = "verify", description = "Verify the ledger hash chain")
    static final class VerifyCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Override
        public Integer call() {
            ChainVerification out = new Ledger(parent.config().ledgerFile()).verifyChain();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? EXIT_OK : EXIT_CHAIN_MISMATCH;
        }
    }

    @Command(name = "compact", description = "Write accepted, deduplicated results to a clean file")
    static final class CompactCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Option(names = {"--out"}, description = "Output path (default: <run-dir>/merged_clean.jsonl)")
        String out;

        @Override
        public Integer call() {
            ZeroLedgerConfig config = parent.config();
            Path output = out == null || out.isBlank() ? config.compactedFile() : Path.of(out);
            Compactor.CompactionReport report = new Compactor().compact(config.ledgerFile(), output);
            System.out.println(Jsons.toJson(report));
            return EXIT_OK;
        }
    }

    @Command(name = "unlock", description = "Remove a lock marker left by a crashed process")
    static final class UnlockCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Override
        public Integer call() {
            LockGuard guard = new LockGuard(parent.config().lockFile());
            Optional<LockGuard.LockInfo> removed = guard.forceRelease();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("lockFile", guard.lockFile().toString());
            out.put("removed", removed.isPresent());
            out.put("locked", guard.isLocked());
            out.put("previousHolder", removed.orElse(null));
            System.out.println(Jsons.toJson(out));
            return EXIT_OK;
        }
    }

    @Command(name = "requeue", description = "Put a RUNNING or FAILED job back to PENDING")
    static final class RequeueCommand implements Callable<Integer> {
        @ParentCommand
        ZeroLedgerCommand parent;

        @Option(names = {"--job"}, required = true, description = "Job id")
        String job;

        @Override
        public Integer call() {
            try (Orchestrator orchestrator = new Orchestrator(parent.config())) {
                orchestrator.start();
                Job requeued = orchestrator.requeue(job);
                System.out.println(Jsons.toJson(requeued));
            }
            return EXIT_OK;
        }
    }
}
