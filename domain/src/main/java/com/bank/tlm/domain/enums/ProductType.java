package com.bank.tlm.domain.enums;

/**
 * Product classification of a bilateral trade
 */
public enum ProductType {
    IRS,          // Interest rate swap
    BASIS_SWAP,
    CCS,          // Cross currency swap
    FRA,
    FX_FORWARD,
    FX_SWAP,
    CDS,
    EQUITY_SWAP,
    SWAPTION,
    OTHER
}
