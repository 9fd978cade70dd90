package io.zeroledger.lock;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.zeroledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Single-writer guard backed by a marker file created with {@code CREATE_NEW}.
 *
 * <p>An existing marker always blocks acquisition, even when its recorded process is gone.
 * Removing a marker left by a crash is an explicit operator action ({@link #forceRelease()}).
 */
public final class LockGuard {
    private static final Logger log = LoggerFactory.getLogger(LockGuard.class);

    private final Path lockFile;

    public LockGuard(Path lockFile) {
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }

    public LockHandle acquire() {
        LockInfo info = new LockInfo(ProcessHandle.current().pid(), hostName(), UUID.randomUUID().toString(), Instant.now().toString());
        try {
            Path parent = lockFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(lockFile, Jsons.toJson(info), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            String holder = holder()
                    .map(h -> "pid=" + h.pid() + " host=" + h.host() + " since=" + h.acquiredAt()
                            + (h.aliveOnThisHost() ? " (process alive)" : " (process not found on this host)"))
                    .orElse("unknown holder");
            throw new LockConflictException(lockFile,
                    "Lock exists (" + lockFile + ", " + holder + "). Another orchestrator is running or a previous run"
                            + " crashed; remove the lock only if no other instance is active.");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create lock marker: " + lockFile, e);
        }
        log.info("Acquired orchestrator lock {}", lockFile);
        return new LockHandle(this, info.token());
    }

    /**
     * Deletes the marker if it still carries this handle's token.
     */
    public void release(LockHandle handle) {
        if (handle == null) {
            return;
        }
        Optional<LockInfo> current = holder();
        if (current.isEmpty()) {
            log.warn("Lock marker {} already removed", lockFile);
            return;
        }
        if (!current.get().token().equals(handle.token())) {
            log.warn("Lock marker {} belongs to another holder (pid={}); leaving it in place", lockFile, current.get().pid());
            return;
        }
        try {
            Files.deleteIfExists(lockFile);
            log.info("Released orchestrator lock {}", lockFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to remove lock marker: " + lockFile, e);
        }
    }

    /**
     * Operator action for a marker left behind by an unclean shutdown.
     *
     * @return the removed holder, if a readable marker existed
     */
    public Optional<LockInfo> forceRelease() {
        Optional<LockInfo> previous = holder();
        try {
            if (Files.deleteIfExists(lockFile)) {
                log.warn("Lock marker {} removed by operator", lockFile);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to remove lock marker: " + lockFile, e);
        }
        return previous;
    }

    public boolean isLocked() {
        return Files.exists(lockFile);
    }

    public Optional<LockInfo> holder() {
        if (!Files.exists(lockFile)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().readValue(lockFile.toFile(), LockInfo.class));
        } catch (IOException e) {
            log.warn("Lock marker {} is unreadable: {}", lockFile, e.getMessage());
            return Optional.empty();
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }

    public record LockInfo(
            @JsonProperty("pid") long pid,
            @JsonProperty("host") String host,
            @JsonProperty("token") String token,
            @JsonProperty("acquired_at") String acquiredAt
    ) {
        public boolean aliveOnThisHost() {
            return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
        }
    }

    public static final class LockHandle implements AutoCloseable {
        private final LockGuard guard;
        private final String token;
        private boolean released;

        private LockHandle(LockGuard guard, String token) {
            this.guard = guard;
            this.token = token;
        }

        public String token() {
            return token;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                guard.release(this);
            }
        }
    }
}
