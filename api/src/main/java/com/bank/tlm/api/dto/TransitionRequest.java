package com.bank.tlm.api.dto;

import com.bank.tlm.domain.enums.TradeState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual target state change. Lifecycle events drive most transitions; this covers
 * the ones no event records (activation, maturity, settlement).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {
    private TradeState targetState;
    private String causingEventId;
    private String initiator;
}
