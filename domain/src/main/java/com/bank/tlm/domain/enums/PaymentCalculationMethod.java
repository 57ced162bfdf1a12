package com.bank.tlm.domain.enums;

/**
 * Method used to determine the early termination amount
 */
public enum PaymentCalculationMethod {
    MARKET_QUOTATION,
    LOSS,
    CLOSE_OUT_AMOUNT,
    AGREED_AMOUNT,
    ZERO // No payment due
}
