package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.TradeState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit record of one state change
 */
@Value
@Builder
public class StateTransition {
    String transitionId;
    String tradeId;
    int sequence;
    TradeState fromState;
    TradeState toState;
    String eventId;
    Instant timestamp;
    String initiator;
    boolean valid;
}
