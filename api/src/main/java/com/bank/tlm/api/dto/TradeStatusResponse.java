package com.bank.tlm.api.dto;

import com.bank.tlm.domain.enums.TradeState;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Derived lifecycle flags of a trade as of {@code asOf}
 */
@Value
@Builder
public class TradeStatusResponse {
    String tradeId;
    TradeState state;
    LocalDate asOf;
    boolean active;
    boolean terminated;
    boolean settled;
    boolean effective;
    boolean maturityReached;
    long daysToMaturity;
    long ageSeconds;
    boolean snapshotChainValid;
}
