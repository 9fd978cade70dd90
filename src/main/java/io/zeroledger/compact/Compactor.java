package io.zeroledger.compact;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.zeroledger.ledger.CanonicalHasher;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.model.EventKind;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Offline ledger polisher: writes one line per distinct accepted result, in ledger order.
 * Hashes are recomputed from the payload rather than trusted from the row. The ledger is
 * only read; the output is produced in a temp file and moved into place.
 */
public final class Compactor {
    private static final Logger log = LoggerFactory.getLogger(Compactor.class);

    private final CanonicalHasher hasher;

    public Compactor() {
        this(new CanonicalHasher());
    }

    public Compactor(CanonicalHasher hasher) {
        this.hasher = hasher;
    }

    public CompactionReport compact(Path ledgerPath, Path outputPath) {
        Path ledgerAbs = ledgerPath.toAbsolutePath().normalize();
        Path outAbs = outputPath.toAbsolutePath().normalize();
        if (ledgerAbs.equals(outAbs)) {
            throw new IllegalArgumentException("Compaction output must differ from the ledger: " + outputPath);
        }
        Path tmp = outAbs.resolveSibling(outAbs.getFileName() + ".tmp");
        Set<String> seen = new HashSet<>();
        int kept = 0;
        int duplicates = 0;
        int rejected = 0;
        try {
            Path parent = outAbs.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 Stream<LedgerEvent> events = new Ledger(ledgerAbs).replay()) {
                Iterator<LedgerEvent> it = events.iterator();
                while (it.hasNext()) {
                    LedgerEvent event = it.next();
                    if (event.kind() != EventKind.ACCEPTED || event.payload() == null) {
                        rejected++;
                        continue;
                    }
                    String hash = hasher.hash(event.payload());
                    if (!seen.add(hash)) {
                        duplicates++;
                        continue;
                    }
                    writer.write(Jsons.toCompactJson(row(event, hash)));
                    writer.write('\n');
                    kept++;
                }
            }
            try {
                Files.move(tmp, outAbs, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, outAbs, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to compact " + ledgerPath + " into " + outputPath, e);
        }
        log.info("Compacted {} into {}: kept={}, duplicates={}, skipped={}", ledgerAbs, outAbs, kept, duplicates, rejected);
        return new CompactionReport(outAbs.toString(), kept, duplicates, rejected);
    }

    private static ObjectNode row(LedgerEvent event, String hash) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("seq", event.seq());
        node.put("hash", hash);
        if (event.jobId() != null) {
            node.put("job_id", event.jobId());
        }
        node.set("payload", event.payload().toJson());
        return node;
    }

    public record CompactionReport(String outputPath, int kept, int droppedDuplicates, int skippedNonAccepted) {
    }
}
