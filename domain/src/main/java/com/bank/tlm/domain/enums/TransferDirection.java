package com.bank.tlm.domain.enums;

/**
 * Direction of a transfer from the recording party's point of view
 */
public enum TransferDirection {
    PAY,
    RECEIVE
}
