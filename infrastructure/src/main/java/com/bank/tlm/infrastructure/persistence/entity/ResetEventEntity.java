package com.bank.tlm.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reset payload keyed by (trade_id, reset_number)
 */
@Entity
@Table(name = "reset_events",
       uniqueConstraints = @UniqueConstraint(name = "uk_reset_trade_number", columnNames = {"trade_id", "reset_number"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResetEventEntity {

    @Id
    @Column(name = "event_id")
    private String eventId;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Column(name = "reset_number", nullable = false, updatable = false)
    private int resetNumber;

    @Column(name = "rate_verified", nullable = false)
    private boolean rateVerified;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
