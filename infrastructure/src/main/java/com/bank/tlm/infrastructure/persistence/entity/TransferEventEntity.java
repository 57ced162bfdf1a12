package com.bank.tlm.infrastructure.persistence.entity;

import com.bank.tlm.domain.enums.SettlementStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Transfer payload. payment_reference is globally unique when present.
 */
@Entity
@Table(name = "transfer_events",
       uniqueConstraints = @UniqueConstraint(name = "uk_transfer_trade_sequence", columnNames = {"trade_id", "sequence_number"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferEventEntity {

    @Id
    @Column(name = "event_id")
    private String eventId;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private int sequenceNumber;

    @Column(name = "payment_reference", unique = true, updatable = false)
    private String paymentReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "settlement_status", nullable = false, length = 20)
    private SettlementStatus settlementStatus;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;
}
