package io.zeroledger.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.contract.ContractValidator;
import io.zeroledger.contract.ResultContract;
import io.zeroledger.contract.ValidationException;
import io.zeroledger.ledger.CanonicalHasher;
import io.zeroledger.ledger.Ledger;
import io.zeroledger.model.AcceptResult;
import io.zeroledger.model.LedgerEvent;
import io.zeroledger.model.RejectReason;
import io.zeroledger.model.ResultPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * The single gate every candidate passes before it is recorded: the result contract,
 * the tolerance check, then deduplication by canonical hash. Contract and tolerance are
 * pluggable so other result shapes go through the same gate. Calls are serialized on this
 * object, so two concurrent submissions of the same hash cannot both pass the duplicate check.
 *
 * <p>An acceptance is reported only after the ledger append has been forced to disk. A
 * {@link io.zeroledger.ledger.LedgerIoException} from the append propagates unchanged and
 * leaves the dedup set untouched.
 */
public final class AcceptancePipeline {
    private static final Logger log = LoggerFactory.getLogger(AcceptancePipeline.class);

    private final ResultContract contract;
    private final ToleranceCheck tolerance;
    private final CanonicalHasher hasher;
    private final DedupSet dedupSet;
    private final Ledger ledger;
    private final String runId;
    private final boolean retainRejected;

    public AcceptancePipeline(
            ContractValidator validator,
            CanonicalHasher hasher,
            DedupSet dedupSet,
            Ledger ledger,
            String runId,
            double epsRoot,
            boolean retainRejected
    ) {
        this(validator, new AbsoluteTolerance(epsRoot), hasher, dedupSet, ledger, runId, retainRejected);
    }

    public AcceptancePipeline(
            ResultContract contract,
            ToleranceCheck tolerance,
            CanonicalHasher hasher,
            DedupSet dedupSet,
            Ledger ledger,
            String runId,
            boolean retainRejected
    ) {
        this.contract = contract;
        this.tolerance = tolerance;
        this.hasher = hasher;
        this.dedupSet = dedupSet;
        this.ledger = ledger;
        this.runId = runId;
        this.retainRejected = retainRejected;
    }

    public AcceptResult accept(JsonNode raw) {
        return accept(raw, null, null);
    }

    public synchronized AcceptResult accept(JsonNode raw, String jobId, String workerId) {
        ResultPayload payload;
        try {
            payload = contract.validate(raw);
        } catch (ValidationException e) {
            return reject(RejectReason.SCHEMA_INVALID, e.code(), null, jobId, workerId);
        }

        String hash = hasher.hash(payload);
        Optional<String> violation = tolerance.violation(payload);
        if (violation.isPresent()) {
            return reject(RejectReason.OUT_OF_TOLERANCE, violation.get(), hash, jobId, workerId);
        }
        if (dedupSet.contains(hash)) {
            return reject(RejectReason.DUPLICATE, "first accepted at seq " + dedupSet.firstSeq(hash), hash, jobId, workerId);
        }

        long seq = ledger.append(LedgerEvent.accepted(runId, jobId, workerId, hash, payload));
        dedupSet.add(hash, seq);
        log.debug("Accepted {} at seq={} (job={}, worker={})", hash, seq, jobId, workerId);
        return AcceptResult.accepted(hash, seq);
    }

    public synchronized int acceptedHashes() {
        return dedupSet.size();
    }

    private AcceptResult reject(RejectReason reason, String detail, String hash, String jobId, String workerId) {
        long seq = -1L;
        if (retainRejected) {
            seq = ledger.append(LedgerEvent.rejected(runId, jobId, workerId, hash, reason, detail));
        }
        log.debug("Rejected candidate (job={}, worker={}): {} {}", jobId, workerId, reason, detail);
        return AcceptResult.rejected(reason, detail, hash, seq);
    }
}
