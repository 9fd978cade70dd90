package io.zeroledger.ledger;

/**
 * A ledger line other than the torn tail could not be parsed. Resume is refused until the
 * ledger is inspected by an operator.
 */
public final class LedgerCorruptedException extends RuntimeException {
    private final int lineNumber;

    public LedgerCorruptedException(int lineNumber, String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
