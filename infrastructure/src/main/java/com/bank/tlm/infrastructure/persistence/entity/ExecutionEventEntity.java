package com.bank.tlm.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Execution payload, unique per trade
 */
@Entity
@Table(name = "execution_events")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionEventEntity {

    @Id
    @Column(name = "event_id")
    private String eventId;

    @Column(name = "trade_id", nullable = false, unique = true, updatable = false)
    private String tradeId;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
