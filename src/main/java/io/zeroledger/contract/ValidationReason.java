package io.zeroledger.contract;

public enum ValidationReason {
    MISSING_FIELD,
    TYPE_MISMATCH,
    OUT_OF_RANGE
}
