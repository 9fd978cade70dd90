package io.zeroledger.contract;

/**
 * Structural or domain violation of the job/result contract.
 */
public final class ValidationException extends RuntimeException {
    private final ValidationReason reason;
    private final String field;

    public ValidationException(ValidationReason reason, String field, String message) {
        super(message);
        this.reason = reason;
        this.field = field;
    }

    public ValidationReason reason() {
        return reason;
    }

    public String field() {
        return field;
    }

    /**
     * Machine-readable form recorded with rejected ledger events, e.g. {@code MISSING_FIELD:root_val}.
     */
    public String code() {
        return field == null || field.isBlank() ? reason.name() : reason.name() + ":" + field;
    }
}
