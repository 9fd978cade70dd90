package io.zeroledger.lock;

import java.nio.file.Path;

/**
 * Another orchestrator holds, or held, the write lock for this run directory.
 */
public final class LockConflictException extends IllegalStateException {
    private final Path lockFile;

    public LockConflictException(Path lockFile, String message) {
        super(message);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
