package com.bank.tlm.domain.event;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outbound message telling downstream consumers (portfolio, netting) that a trade's
 * lifecycle record changed. Published after the change is committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeLifecycleNotification {

    public enum Kind {
        TRADE_CREATED,
        EVENT_RECORDED,
        STATE_CHANGED,
        EVENT_UPDATED
    }

    private String tradeId;
    private Kind kind;
    private String eventId;
    private EventType eventType;
    private TradeState fromState;
    private TradeState toState;
    private String snapshotId;
    private String detail;
    private Instant occurredAt;
    private String correlationId;
}
