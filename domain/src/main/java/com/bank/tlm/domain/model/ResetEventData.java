package com.bank.tlm.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Floating rate reset for one calculation period, keyed by (tradeId, resetNumber)
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ResetEventData {
    private String eventId;
    private String tradeId;
    private String payoutReference;
    private int resetNumber;
    private RateObservation observation;
    private ResetCalculation calculation;
    private AveragingData averaging;
    private String previousResetEventId;
    private Instant recordedAt;
    private boolean rateVerified;
    private String verifiedBy;
    private Instant verifiedAt;
}
