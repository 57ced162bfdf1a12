package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.EventStatus;
import com.bank.tlm.domain.enums.EventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Generic envelope shared by every business event kind.
 *
 * beforeStateId/afterStateId reference snapshot ids; they are equal for events that do not move
 * the trade. previousEventId links to the trade's preceding event.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EventRecord {
    private String eventId;
    private EventType eventType;
    private EventStatus status;
    private Instant timestamp;
    private LocalDate effectiveDate;
    private String tradeId;
    private int sequence;
    private List<String> involvedParties;
    private String initiator;
    private String beforeStateId;
    private String afterStateId;
    private String previousEventId;
    private boolean valid;
    private String message;
    private String failureReason;
    private String correlationId;
}
