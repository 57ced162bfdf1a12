package com.bank.tlm.domain.enums;

/**
 * Lifecycle state of a trade
 */
public enum TradeState {
    CREATED,     // Booked, awaiting execution
    PENDING,     // Awaiting counterparty confirmation
    CONFIRMED,   // Executed and confirmed by both sides
    ACTIVE,      // Live, accruing and paying
    MATURED,     // Reached scheduled maturity
    TERMINATED,  // Ended early
    SETTLED      // All obligations discharged (terminal)
}
