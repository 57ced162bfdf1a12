package com.bank.tlm.domain.enums;

/**
 * How an execution was confirmed between the parties
 */
public enum ConfirmationMethod {
    ELECTRONIC,
    PLATFORM,
    MANUAL,
    VOICE
}
