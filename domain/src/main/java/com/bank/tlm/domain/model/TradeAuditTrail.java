package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.TradeState;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to explain why a trade is in its current state
 */
@Value
@Builder
public class TradeAuditTrail {
    String tradeId;
    TradeState currentState;
    String currentSnapshotId;
    List<TradeStateSnapshot> snapshots;   // Creation first
    List<StateTransition> transitions;
    List<EventRecord> events;
    List<AuditEntry> timeline;
    boolean chainConsistent;
}
