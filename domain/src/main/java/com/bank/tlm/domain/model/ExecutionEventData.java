package com.bank.tlm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Inception event payload. Exactly one per executed trade.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionEventData {
    private String eventId;
    private String tradeId;
    private ExecutionDetails executionDetails;
    private EconomicTerms economicTerms;
    private String buyer;
    private String seller;
    private String broker;
    private LocalDate tradeDate;
    private Instant recordedAt;
}
