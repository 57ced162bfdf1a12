package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.SettlementStatus;
import com.bank.tlm.domain.enums.TransferType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Recorded payment obligation and its settlement progress
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TransferEventData {
    private String eventId;
    private String tradeId;
    private int sequenceNumber;
    private TransferType transferType;
    private PaymentDetails payment;
    private TransferParties parties;
    private SettlementStatus settlementStatus;
    private LocalDate settlementDate;
    private String settlementReference;
    private String failureReason;
    private String previousTransferEventId;
    private String initiator;
    private Instant recordedAt;
    private Instant initiatedAt;
    private Instant settledAt;
    private boolean verified;
    private String verifiedBy;
    private Instant verifiedAt;
}
