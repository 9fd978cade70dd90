package io.zeroledger.model;

/**
 * Verdict of the acceptance gate for one candidate.
 *
 * <p>{@code seq} is the ledger sequence number of the recorded event, or {@code -1}
 * when the verdict was not written (rejections with retention disabled).
 * {@code hash} is absent for candidates that failed structural validation.
 */
public record AcceptResult(
        EventKind status,
        RejectReason reason,
        String detail,
        String hash,
        long seq
) {
    public static AcceptResult accepted(String hash, long seq) {
        return new AcceptResult(EventKind.ACCEPTED, null, null, hash, seq);
    }

    public static AcceptResult rejected(RejectReason reason, String detail, String hash, long seq) {
        return new AcceptResult(EventKind.REJECTED, reason, detail, hash, seq);
    }

    public boolean accepted() {
        return status == EventKind.ACCEPTED;
    }
}
