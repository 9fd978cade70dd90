package io.zeroledger.lock;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

final class LockGuardTest {

    @Test
    void secondAcquireFailsFastUntilReleased() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-lock-");
        try {
            LockGuard guard = new LockGuard(root.resolve("orchestrator.lock"));
            LockGuard other = new LockGuard(root.resolve("orchestrator.lock"));

            try (LockGuard.LockHandle handle = guard.acquire()) {
                Assertions.assertTrue(guard.isLocked());
                LockConflictException e = Assertions.assertThrows(LockConflictException.class, other::acquire);
                Assertions.assertEquals(root.resolve("orchestrator.lock"), e.lockFile());
                Assertions.assertTrue(e.getMessage().contains("process alive"));
                Assertions.assertEquals(handle.token(), guard.holder().orElseThrow().token());
                Assertions.assertEquals(ProcessHandle.current().pid(), guard.holder().orElseThrow().pid());
            }

            Assertions.assertFalse(guard.isLocked());
            try (LockGuard.LockHandle again = other.acquire()) {
                Assertions.assertNotNull(again.token());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleMarkerStillBlocksUntilOperatorRemovesIt() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-lock-stale-");
        try {
            Path lockFile = root.resolve("orchestrator.lock");
            Files.writeString(lockFile,
                    "{\"pid\":999999999,\"host\":\"elsewhere\",\"token\":\"t-1\",\"acquired_at\":\"2020-01-01T00:00:00Z\"}",
                    StandardCharsets.UTF_8);
            LockGuard guard = new LockGuard(lockFile);

            Assertions.assertThrows(LockConflictException.class, guard::acquire);
            Assertions.assertFalse(guard.holder().orElseThrow().aliveOnThisHost());

            Optional<LockGuard.LockInfo> removed = guard.forceRelease();
            Assertions.assertEquals("t-1", removed.orElseThrow().token());
            Assertions.assertFalse(guard.isLocked());
            guard.acquire().close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releaseLeavesForeignMarkerInPlace() throws Exception {
        Path root = Files.createTempDirectory("zeroledger-lock-foreign-");
        try {
            Path lockFile = root.resolve("orchestrator.lock");
            LockGuard guard = new LockGuard(lockFile);
            LockGuard.LockHandle handle = guard.acquire();
            guard.forceRelease();
            LockGuard.LockHandle successor = guard.acquire();

            handle.close();

            Assertions.assertTrue(guard.isLocked());
            Assertions.assertEquals(successor.token(), guard.holder().orElseThrow().token());
            successor.close();
            Assertions.assertFalse(guard.isLocked());
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
