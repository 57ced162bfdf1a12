package com.bank.tlm.infrastructure.persistence.entity;

import com.bank.tlm.domain.enums.TerminationStatus;
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

/**
 * Termination payload, at most one per trade
 */
@Entity
@Table(name = "termination_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminationEventEntity {

    @Id
    @Column(name = "event_id")
    private String eventId;

    @Column(name = "trade_id", nullable = false, unique = true, updatable = false)
    private String tradeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TerminationStatus status;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
