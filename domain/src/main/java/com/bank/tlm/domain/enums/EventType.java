package com.bank.tlm.domain.enums;

/**
 * Business event kinds recorded by the ledger
 */
public enum EventType {
    EXECUTION,
    RESET,
    TRANSFER,
    TERMINATION
}
