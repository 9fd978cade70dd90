package io.zeroledger.ledger;

/**
 * Durable write to the ledger failed. Fatal: the orchestrator must stop rather than
 * continue with an ambiguous ledger.
 */
public final class LedgerIoException extends RuntimeException {
    public LedgerIoException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerIoException(String message) {
        super(message);
    }
}
