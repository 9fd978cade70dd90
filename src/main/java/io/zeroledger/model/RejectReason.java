package io.zeroledger.model;

public enum RejectReason {
    SCHEMA_INVALID,
    OUT_OF_TOLERANCE,
    DUPLICATE
}
