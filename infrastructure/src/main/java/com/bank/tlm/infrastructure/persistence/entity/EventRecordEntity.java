package com.bank.tlm.infrastructure.persistence.entity;

import com.bank.tlm.domain.enums.EventStatus;
import com.bank.tlm.domain.enums.EventType;
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
import java.time.LocalDate;

/**
 * Generic event envelope. Only status, afterStateId, valid and failureReason change after insert.
 */
@Entity
@Table(name = "event_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventRecordEntity {

    @Id
    @Column(name = "event_id")
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 20)
    private EventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "effective_date", updatable = false)
    private LocalDate effectiveDate;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private int sequence;

    @Column(name = "involved_parties_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String involvedPartiesJson;

    @Column(name = "initiator", updatable = false)
    private String initiator;

    @Column(name = "before_state_id", length = 36, updatable = false)
    private String beforeStateId;

    @Column(name = "after_state_id", length = 36)
    private String afterStateId;

    @Column(name = "previous_event_id", updatable = false)
    private String previousEventId;

    @Column(name = "valid", nullable = false)
    private boolean valid;

    @Column(name = "message", columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "correlation_id", updatable = false)
    private String correlationId;
}
