package com.bank.tlm.domain.exception;

/**
 * Named failure conditions raised by the trade lifecycle ledger
 */
public enum ErrorCode {

    // ---- Lookup ----
    TRADE_NOT_FOUND(ErrorCategory.NOT_FOUND),
    EVENT_NOT_FOUND(ErrorCategory.NOT_FOUND),

    // ---- Uniqueness ----
    TRADE_ALREADY_EXISTS(ErrorCategory.ALREADY_EXISTS),
    DUPLICATE_EVENT_ID(ErrorCategory.ALREADY_EXISTS),
    ALREADY_EXECUTED(ErrorCategory.ALREADY_EXISTS),
    RESET_ALREADY_EXISTS(ErrorCategory.ALREADY_EXISTS),
    DUPLICATE_REFERENCE(ErrorCategory.ALREADY_EXISTS),
    TRADE_ALREADY_TERMINATED(ErrorCategory.ALREADY_EXISTS),

    // ---- Input ----
    INVALID_INPUT(ErrorCategory.INVALID_INPUT),
    INVALID_PRODUCT_TYPE(ErrorCategory.INVALID_INPUT),
    INVALID_PARTIES(ErrorCategory.INVALID_INPUT),
    INVALID_DATES(ErrorCategory.INVALID_INPUT),
    INVALID_NOTIONAL(ErrorCategory.INVALID_INPUT),
    INVALID_AMOUNT(ErrorCategory.INVALID_INPUT),
    INVALID_RESET_NUMBER(ErrorCategory.INVALID_INPUT),
    INVALID_OBSERVATION_DATE(ErrorCategory.INVALID_INPUT),
    INVALID_PERIOD_DATES(ErrorCategory.INVALID_INPUT),
    INVALID_AVERAGING_DATA(ErrorCategory.INVALID_INPUT),
    INVALID_TERMINATION_DATE(ErrorCategory.INVALID_INPUT),
    INVALID_PAYMENT_DETAILS(ErrorCategory.INVALID_INPUT),
    TRANSFER_TRADE_MISMATCH(ErrorCategory.INVALID_INPUT),

    // ---- State machine ----
    INVALID_TRANSITION(ErrorCategory.ILLEGAL_TRANSITION),

    // ---- Lifecycle stage ----
    WRONG_TRADE_STATE(ErrorCategory.WRONG_LIFECYCLE_STAGE),
    TRADE_NOT_ACTIVE(ErrorCategory.WRONG_LIFECYCLE_STAGE),
    INVALID_SETTLEMENT_STATE(ErrorCategory.WRONG_LIFECYCLE_STAGE),
    INVALID_TERMINATION_STATUS(ErrorCategory.WRONG_LIFECYCLE_STAGE),

    // ---- Finalized records ----
    ALREADY_SETTLED(ErrorCategory.ALREADY_TERMINAL),
    TRANSFER_CANCELLED(ErrorCategory.ALREADY_TERMINAL),
    EVENT_ALREADY_FINALIZED(ErrorCategory.ALREADY_TERMINAL);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
