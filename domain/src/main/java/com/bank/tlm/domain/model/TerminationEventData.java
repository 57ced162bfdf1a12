package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.TerminationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Early termination of a trade. At most one per trade.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TerminationEventData {
    private String eventId;
    private String tradeId;
    private TerminationDetails details;
    private TerminationPayment payment;
    private TerminationStatus status;
    private String settlementTransferEventId;
    private String initiator;
    private Instant recordedAt;
    private Instant confirmedAt;
    private Instant settledAt;
}
