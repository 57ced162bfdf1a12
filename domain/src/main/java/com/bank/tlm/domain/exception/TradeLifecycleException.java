package com.bank.tlm.domain.exception;

/**
 * Raised when a ledger operation is rejected.
 * The operation that throws it has written nothing.
 */
public class TradeLifecycleException extends RuntimeException {

    private final ErrorCode errorCode;

    public TradeLifecycleException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public static TradeLifecycleException of(ErrorCode errorCode, String format, Object... args) {
        return new TradeLifecycleException(errorCode, String.format(format, args));
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.category();
    }
}
