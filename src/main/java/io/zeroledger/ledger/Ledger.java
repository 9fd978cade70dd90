package io.zeroledger.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.model.EventKind;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.util.Hashing;
import io.zeroledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Append-only JSON-lines ledger. Each row carries a chaining digest over the previous
 * row's digest and its own content, so any retroactive edit breaks the chain from that
 * row onwards.
 *
 * <p>Appends are not internally ordered against each other beyond this object's monitor;
 * callers serialize them through the acceptance gate. An append returns only after the
 * row has been forced to the storage device.
 */
public final class Ledger implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(Ledger.class);
    private static final String GENESIS = "";
    private static final int SCAN_CHUNK = 8192;

    private final Path file;
    private final Clock clock;
    private final CanonicalHasher hasher;
    private FileChannel channel;
    private long lastSeq;
    private String lastChain;
    private boolean failed;

    public Ledger(Path file) {
        this(file, Clock.systemUTC());
    }

    public Ledger(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
        this.hasher = new CanonicalHasher();
        this.lastSeq = 0L;
        this.lastChain = GENESIS;
    }

    public Path file() {
        return file;
    }

    public static String chainDigest(String previousChain, String contentJson) {
        return Hashing.sha256Tagged((previousChain == null ? GENESIS : previousChain) + "\n" + contentJson);
    }

    /**
     * Prepares the ledger for writing: creates the file if needed, cuts away a torn
     * trailing record and positions the chain at the last stored row.
     *
     * @throws LedgerCorruptedException if any newline-terminated row, the last one
     *         included, cannot be read; nothing is truncated in that case
     */
    public synchronized void openForAppend() {
        if (channel != null) {
            return;
        }
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(file)) {
                Files.createFile(file);
            }
            repairTail();
            LedgerEvent last = null;
            try (Stream<LedgerEvent> events = replay()) {
                Iterator<LedgerEvent> it = events.iterator();
                while (it.hasNext()) {
                    last = it.next();
                }
            }
            if (last != null) {
                lastSeq = last.seq();
                lastChain = last.chain() == null ? GENESIS : last.chain();
            }
            channel = FileChannel.open(file, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            log.info("Ledger opened for append: {} (last seq={})", file, lastSeq);
        } catch (IOException e) {
            throw new LedgerIoException("Failed to open ledger for append: " + file, e);
        }
    }

    /**
     * Seals the draft with the next sequence number, timestamp and chaining digest and
     * durably appends it.
     *
     * @return the assigned sequence number
     */
    public synchronized long append(LedgerEvent draft) {
        if (failed) {
            throw new LedgerIoException("Ledger is unusable after an earlier write failure: " + file);
        }
        if (channel == null) {
            throw new IllegalStateException("Ledger is not open for append: " + file);
        }
        long seq = lastSeq + 1L;
        LedgerEvent event = draft.sealed(seq, Instant.now(clock).toString(), null);
        ObjectNode row = normalized(event.content());
        String chain = chainDigest(lastChain, Jsons.toCompactJson(row));
        row.put("chain", chain);
        byte[] line = (Jsons.toCompactJson(row) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(false);
        } catch (IOException e) {
            failed = true;
            log.error("Ledger append failed at seq={} in {}", seq, file, e);
            throw new LedgerIoException("Failed to append ledger event seq=" + seq, e);
        }
        lastSeq = seq;
        lastChain = chain;
        return seq;
    }

    public synchronized long lastSeq() {
        return lastSeq;
    }

    public synchronized String lastChain() {
        return lastChain;
    }

    /**
     * Lazily streams all complete rows in order. Every call starts from the beginning of
     * the file; the stream must be closed. Bytes after the last newline are a torn write and
     * are skipped; an unreadable newline-terminated row raises {@link LedgerCorruptedException}.
     */
    public Stream<LedgerEvent> replay() {
        LineCursor cursor;
        try {
            cursor = LineCursor.open(file);
        } catch (IOException e) {
            throw new LedgerIoException("Failed to open ledger for replay: " + file, e);
        }
        if (cursor.partialTail()) {
            log.warn("Ignoring partial trailing record in {}", file);
        }
        Iterator<LedgerEvent> iterator = new Iterator<>() {
            private LedgerEvent next;
            private boolean exhausted;

            @Override
            public boolean hasNext() {
                if (next == null && !exhausted) {
                    advance();
                }
                return next != null;
            }

            @Override
            public LedgerEvent next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                LedgerEvent out = next;
                next = null;
                return out;
            }

            private void advance() {
                try {
                    String line;
                    while ((line = cursor.next()) != null) {
                        if (line.isBlank()) {
                            continue;
                        }
                        try {
                            next = LedgerEvent.fromJson(Jsons.compact().readTree(line));
                            return;
                        } catch (Exception e) {
                            throw new LedgerCorruptedException(
                                    cursor.lineNumber(),
                                    "Ledger parse failed at line " + cursor.lineNumber()
                                            + " (possible corruption); fix the ledger before resuming",
                                    e
                            );
                        }
                    }
                    exhausted = true;
                } catch (IOException e) {
                    throw new LedgerIoException("Failed to read ledger: " + file, e);
                }
            }
        };
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                        false
                )
                .onClose(() -> {
                    try {
                        cursor.close();
                    } catch (IOException e) {
                        throw new LedgerIoException("Failed to close ledger reader: " + file, e);
                    }
                });
    }

    public List<LedgerEvent> readAll() {
        try (Stream<LedgerEvent> events = replay()) {
            return events.toList();
        }
    }

    /**
     * Recomputes the chain from the first row and reports the first row whose stored digest,
     * sequence number or content hash does not match.
     */
    public ChainVerification verifyChain() {
        if (!Files.exists(file)) {
            return new ChainVerification(true, 0, 0, 0L, "", GENESIS, GENESIS);
        }
        String expectedPrev = GENESIS;
        String storedTail = GENESIS;
        long expectedSeq = 1L;
        int checked = 0;
        try (LineCursor cursor = LineCursor.open(file)) {
            String line;
            while ((line = cursor.next()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                int lineNo = cursor.lineNumber();
                ObjectNode row;
                try {
                    JsonNode parsed = Jsons.compact().readTree(line);
                    if (parsed == null || !parsed.isObject()) {
                        return broken(checked, lineNo, -1L, "invalid_json", expectedPrev, storedTail);
                    }
                    row = (ObjectNode) parsed;
                } catch (JsonProcessingException e) {
                    return broken(checked, lineNo, -1L, "invalid_json", expectedPrev, storedTail);
                }
                long seq = row.path("seq").asLong(-1L);
                String storedChain = row.path("chain").asText("");
                ObjectNode content = row.deepCopy();
                content.remove("chain");
                String recomputed = chainDigest(expectedPrev, Jsons.toCompactJson(content));
                if (!recomputed.equals(storedChain)) {
                    return broken(checked, lineNo, seq, "chain_mismatch", expectedPrev, storedTail);
                }
                if (seq != expectedSeq) {
                    return broken(checked, lineNo, seq, "sequence_gap", expectedPrev, storedTail);
                }
                if (!contentHashMatches(row)) {
                    return broken(checked, lineNo, seq, "hash_mismatch", expectedPrev, storedTail);
                }
                checked++;
                expectedSeq++;
                expectedPrev = recomputed;
                storedTail = storedChain;
            }
            if (cursor.partialTail()) {
                return broken(checked, cursor.lineNumber() + 1, -1L, "partial_tail", expectedPrev, storedTail);
            }
        } catch (IOException e) {
            throw new LedgerIoException("Failed to verify ledger: " + file, e);
        }
        return new ChainVerification(true, checked, 0, 0L, "", expectedPrev, storedTail);
    }

    @Override
    public synchronized void close() {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            throw new LedgerIoException("Failed to close ledger: " + file, e);
        } finally {
            channel = null;
        }
    }

    private boolean contentHashMatches(ObjectNode row) {
        if (!EventKind.ACCEPTED.name().equals(row.path("kind").asText())) {
            return true;
        }
        try {
            LedgerEvent event = LedgerEvent.fromJson(row);
            return event.payload() != null && hasher.hash(event.payload()).equals(event.hash());
        } catch (RuntimeException e) {
            return false;
        }
    }

    private static ChainVerification broken(
            int checked,
            int line,
            long seq,
            String reason,
            String tailDigest,
            String storedTail
    ) {
        return new ChainVerification(false, checked, line, seq, reason, tailDigest, storedTail);
    }

    // Re-reads the row the way a verifier will, so number formatting cannot drift.
    private static ObjectNode normalized(ObjectNode row) {
        try {
            return (ObjectNode) Jsons.compact().readTree(Jsons.toCompactJson(row));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to normalize ledger row", e);
        }
    }

    // Only bytes after the last newline are a torn write; complete rows are never cut.
    private void repairTail() throws IOException {
        try (FileChannel rw = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = rw.size();
            long complete = lastLineEnd(rw, size);
            if (complete < size) {
                log.warn("Discarding partial ledger tail of {} bytes at offset {} in {}", size - complete, complete, file);
                rw.truncate(complete);
                rw.force(true);
            }
        }
    }

    /**
     * Offset just past the last {@code '\n'} strictly before {@code limit}, or 0.
     */
    static long lastLineEnd(FileChannel channel, long limit) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(SCAN_CHUNK);
        long pos = limit;
        while (pos > 0L) {
            int len = (int) Math.min(SCAN_CHUNK, pos);
            pos -= len;
            buffer.clear();
            buffer.limit(len);
            while (buffer.hasRemaining() && channel.read(buffer, pos + buffer.position()) > 0) {
                // fill
            }
            for (int i = buffer.position() - 1; i >= 0; i--) {
                if (buffer.get(i) == '\n') {
                    return pos + i + 1;
                }
            }
        }
        return 0L;
    }

    private static final class LineCursor implements Closeable {
        private final BufferedReader reader;
        private final boolean partialTail;
        private String lookahead;
        private int lineNumber;

        private LineCursor(BufferedReader reader, boolean partialTail) throws IOException {
            this.reader = reader;
            this.partialTail = partialTail;
            try {
                this.lookahead = reader == null ? null : reader.readLine();
            } catch (IOException e) {
                reader.close();
                throw e;
            }
        }

        static LineCursor open(Path file) throws IOException {
            if (!Files.exists(file)) {
                return new LineCursor(null, false);
            }
            long size;
            long complete;
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                size = channel.size();
                complete = lastLineEnd(channel, size);
            }
            InputStream in = new LimitedInputStream(Files.newInputStream(file), complete);
            return new LineCursor(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), complete < size);
        }

        String next() throws IOException {
            String current = lookahead;
            if (current != null) {
                lineNumber++;
                lookahead = reader.readLine();
            }
            return current;
        }

        int lineNumber() {
            return lineNumber;
        }

        boolean partialTail() {
            return partialTail;
        }

        @Override
        public void close() throws IOException {
            if (reader != null) {
                reader.close();
            }
        }
    }

    private static final class LimitedInputStream extends FilterInputStream {
        private long remaining;

        LimitedInputStream(InputStream in, long limit) {
            super(in);
            this.remaining = limit;
        }

        @Override
        public int read() throws IOException {
            if (remaining <= 0L) {
                return -1;
            }
            int b = super.read();
            if (b >= 0) {
                remaining--;
            }
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (remaining <= 0L) {
                return -1;
            }
            int n = super.read(b, off, (int) Math.min(len, remaining));
            if (n > 0) {
                remaining -= n;
            }
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(Math.min(n, remaining));
            remaining -= skipped;
            return skipped;
        }

        @Override
        public int available() throws IOException {
            return (int) Math.min(super.available(), remaining);
        }
    }
}
