package io.zeroledger.model;

public enum EventKind {
    ACCEPTED,
    REJECTED
}
