package io.zeroledger.storage;

import io.zeroledger.model.OrchestratorState;
import io.zeroledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * JSON snapshot of {@link OrchestratorState}. Saves write a sibling temp file, force it and
 * move it over the previous snapshot, so a reader sees either the old or the new document.
 *
 * <p>The snapshot is a cache. An unreadable file loads as an empty state and recovery
 * rebuilds it from the ledger.
 */
public final class StateStore {
    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    private final Path file;

    public StateStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public OrchestratorState load(String runId) {
        if (!Files.exists(file)) {
            return OrchestratorState.empty(runId);
        }
        try {
            OrchestratorState state = Jsons.mapper().readValue(file.toFile(), OrchestratorState.class);
            return state == null ? OrchestratorState.empty(runId) : state;
        } catch (IOException | RuntimeException e) {
            log.warn("State snapshot {} is unreadable, continuing with an empty state: {}", file, e.getMessage());
            return OrchestratorState.empty(runId);
        }
    }

    public void save(OrchestratorState state) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        byte[] bytes = Jsons.toJson(state).getBytes(StandardCharsets.UTF_8);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel channel = FileChannel.open(
                    tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE
            )) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to save state snapshot: " + file, e);
        }
    }
}
