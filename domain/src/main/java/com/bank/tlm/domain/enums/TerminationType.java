package com.bank.tlm.domain.enums;

/**
 * Reason category for an early termination
 */
public enum TerminationType {
    MUTUAL_AGREEMENT,
    OPTIONAL_EARLY_TERMINATION,
    EVENT_OF_DEFAULT,
    TERMINATION_EVENT,
    COMPRESSION
}
