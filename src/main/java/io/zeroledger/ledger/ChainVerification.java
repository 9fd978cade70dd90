package io.zeroledger.ledger;

/**
 * Outcome of recomputing the chaining digest over the ledger.
 *
 * @param brokenLine 1-based line of the first divergence, 0 when the chain holds
 * @param reason     {@code invalid_json}, {@code chain_mismatch}, {@code sequence_gap},
 *                   {@code hash_mismatch} or {@code partial_tail}; empty when the chain holds
 * @param tailDigest recomputed digest up to the last verified event
 */
public record ChainVerification(
        boolean ok,
        int checkedEvents,
        int brokenLine,
        long brokenSeq,
        String reason,
        String tailDigest,
        String storedTailDigest
) {
}
