package com.bank.tlm.domain.enums;

/**
 * Status of a termination record.
 * PENDING -> CONFIRMED -> SETTLED, or any -> DISPUTED
 */
public enum TerminationStatus {
    PENDING,
    CONFIRMED,
    SETTLED,
    DISPUTED
}
