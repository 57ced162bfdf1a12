package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One line of a trade's audit timeline: either a recorded business event or a state change
 */
@Value
@Builder
public class AuditEntry {

    public enum Kind {
        TRADE_CREATED,
        EVENT_RECORDED,
        STATE_CHANGED
    }

    Instant timestamp;
    Kind kind;
    String eventId;
    EventType eventType;
    TradeState fromState;
    TradeState toState;
    String actor;
    String description;
}
