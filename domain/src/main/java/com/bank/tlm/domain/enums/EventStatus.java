package com.bank.tlm.domain.enums;

/**
 * Processing status of a generic event record.
 * PROCESSED and FAILED are terminal.
 */
public enum EventStatus {
    PENDING,
    PROCESSED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
