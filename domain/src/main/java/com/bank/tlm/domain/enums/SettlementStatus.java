package com.bank.tlm.domain.enums;

/**
 * Settlement sub-state of a transfer.
 * PENDING -> INITIATED -> SETTLED | FAILED | CANCELLED
 */
public enum SettlementStatus {
    PENDING,
    INITIATED,
    SETTLED,
    FAILED,
    CANCELLED
}
