package com.bank.tlm.domain.enums;

/**
 * How a reset rate was derived from raw observations
 */
public enum AveragingMethod {
    NONE,
    SIMPLE,
    WEIGHTED,
    COMPOUNDED
}
