package io.zeroledger.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.zeroledger.model.Job;
import io.zeroledger.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs a co-located process per job. The job is written to stdin as
 * {@code {"job_id": ..., "payload": ...}}; every non-blank stdout line is one candidate.
 * Lines that are not JSON are passed on as text and rejected by validation.
 */
public final class ScriptWorker implements Worker {
    public static final String ID = "script";
    private static final int MAX_ERROR_CHARS = 512;

    private final List<String> command;
    private final long timeoutMs;

    public ScriptWorker(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script worker command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public List<JsonNode> compute(Job job) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process = pb.start();
        try {
            CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(jobInput(job).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            String output = new String(stdout.get(), StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(output));
            }
            return parseOutput(output);
        } catch (ExecutionException e) {
            throw new IOException("failed to read script output", e.getCause());
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    static String jobInput(Job job) {
        ObjectNode input = JsonNodeFactory.instance.objectNode();
        input.put("job_id", job.jobId());
        input.set("payload", job.payload());
        return Jsons.toCompactJson(input) + "\n";
    }

    static List<JsonNode> parseOutput(String output) {
        List<JsonNode> out = new ArrayList<>();
        for (String line : output.split("\\R")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                out.add(Jsons.compact().readTree(trimmed));
            } catch (IOException e) {
                out.add(TextNode.valueOf(trimmed));
            }
        }
        return out;
    }

    private static byte[] readAll(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("failed to read script output", e);
        }
    }

    private static String truncate(String raw) {
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
