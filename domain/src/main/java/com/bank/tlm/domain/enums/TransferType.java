package com.bank.tlm.domain.enums;

/**
 * Nature of a recorded payment obligation
 */
public enum TransferType {
    COUPON,
    PRINCIPAL_EXCHANGE,
    FEE,
    UPFRONT_PAYMENT,
    TERMINATION_PAYMENT,
    OTHER
}
