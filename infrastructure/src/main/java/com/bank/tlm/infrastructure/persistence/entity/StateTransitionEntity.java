package com.bank.tlm.infrastructure.persistence.entity;

import com.bank.tlm.domain.enums.TradeState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "state_transitions")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateTransitionEntity {

    @Id
    @Column(name = "transition_id", length = 36)
    private String transitionId;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private int sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_state", nullable = false, updatable = false, length = 20)
    private TradeState fromState;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_state", nullable = false, updatable = false, length = 20)
    private TradeState toState;

    @Column(name = "event_id", nullable = false, updatable = false)
    private String eventId;

    @Column(name = "transition_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "initiator", nullable = false, updatable = false)
    private String initiator;

    @Column(name = "valid", nullable = false, updatable = false)
    private boolean valid;
}
