package com.bank.tlm.domain.exception;

/**
 * Coarse failure taxonomy shared by every ledger operation.
 * Callers and the REST layer branch on the category, not on the individual code.
 */
public enum ErrorCategory {
    NOT_FOUND,
    ALREADY_EXISTS,
    INVALID_INPUT,
    ILLEGAL_TRANSITION,
    WRONG_LIFECYCLE_STAGE,
    ALREADY_TERMINAL
}
