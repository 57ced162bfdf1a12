package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.SettlementStatus;
import com.bank.tlm.domain.enums.TransferType;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.PaymentDetails;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.model.TransferEventData;
import com.bank.tlm.domain.model.TransferParties;
import com.bank.tlm.domain.store.TransferEventStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static com.bank.tlm.application.service.LedgerPreconditions.isBlank;
import static com.bank.tlm.application.service.LedgerPreconditions.isPositive;
import static com.bank.tlm.application.service.LedgerPreconditions.requirePresent;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Records payment obligations of a trade and tracks their settlement.
 *
 * Transfers are numbered per trade in insertion order. Recording an obligation is not settlement:
 * the event is processed at once while the transfer stays PENDING until settled.
 */
@Service
public class TransferService extends AbstractEventRecorder {

    private final TransferEventStore transferEventStore;

    public TransferService(TransferEventStore transferEventStore,
                           TradeStateService tradeStateService,
                           EventLedgerService eventLedgerService,
                           TradeWriteScope writeScope,
                           MetricsService metricsService,
                           LifecycleNotificationService notificationService,
                           Clock clock) {
        super(tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
        this.transferEventStore = transferEventStore;
    }

    public EventRecord recordTransfer(String eventId,
                                      String tradeId,
                                      TransferType transferType,
                                      PaymentDetails payment,
                                      TransferParties parties,
                                      String initiator) {
        requireText(eventId, "eventId");
        requireText(tradeId, "tradeId");
        requireText(initiator, "initiator");
        requirePresent(transferType, "transferType");
        requirePresent(payment, "payment");
        requirePresent(parties, "parties");

        return recordEvent("recordTransfer", tradeId, () -> {
            Optional<TradeStateSnapshot> locked = tradeStateService.lockIfPresent(tradeId);

            if (eventLedgerService.eventExists(eventId)) {
                throw TradeLifecycleException.of(ErrorCode.DUPLICATE_EVENT_ID, "Event %s already recorded", eventId);
            }
            String reference = isBlank(payment.getPaymentReference()) ? null : payment.getPaymentReference();
            if (reference != null && transferEventStore.existsByPaymentReference(reference)) {
                throw TradeLifecycleException.of(ErrorCode.DUPLICATE_REFERENCE,
                        "Payment reference %s already used", reference);
            }
            TradeStateSnapshot current = locked.orElseThrow(() ->
                    TradeLifecycleException.of(ErrorCode.TRADE_NOT_FOUND, "Trade %s not found", tradeId));
            if (!isPositive(payment.getNetAmount())) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_AMOUNT,
                        "Net amount must be positive, was %s", payment.getNetAmount());
            }
            if (isBlank(parties.getPayer()) || isBlank(parties.getReceiver())) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES, "Payer and receiver are required");
            }
            if (parties.getPayer().equals(parties.getReceiver())) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES,
                        "Payer and receiver must differ, both are %s", parties.getPayer());
            }
            if (payment.getValueDate() == null) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_DATES, "Value date is required");
            }

            Optional<TransferEventData> previous = transferEventStore.findLastByTradeId(tradeId);
            int sequenceNumber = transferEventStore.countByTradeId(tradeId) + 1;
            transferEventStore.save(TransferEventData.builder()
                    .eventId(eventId)
                    .tradeId(tradeId)
                    .sequenceNumber(sequenceNumber)
                    .transferType(transferType)
                    .payment(payment.toBuilder().paymentReference(reference).build())
                    .parties(parties)
                    .settlementStatus(SettlementStatus.PENDING)
                    .previousTransferEventId(previous.map(TransferEventData::getEventId).orElse(null))
                    .initiator(initiator)
                    .recordedAt(clock.instant())
                    .build());

            eventLedgerService.append(EventRecord.builder()
                    .eventId(eventId)
                    .eventType(EventType.TRANSFER)
                    .effectiveDate(payment.getValueDate())
                    .tradeId(tradeId)
                    .involvedParties(List.of(parties.getPayer(), parties.getReceiver()))
                    .initiator(initiator)
                    .beforeStateId(current.getSnapshotId())
                    .message(String.format("Transfer %d (%s): %s pays %s %s %s", sequenceNumber, transferType,
                            parties.getPayer(), parties.getReceiver(), payment.getNetAmount(), payment.getCurrency()))
                    .build());
            return eventLedgerService.finalizeProcessed(eventId, current.getSnapshotId());
        });
    }

    /**
     * PENDING -> INITIATED, once the payment instruction has been released
     */
    public TransferEventData initiateTransfer(String eventId) {
        return updateTransfer("initiateTransfer", eventId, "initiated", transfer -> {
            if (transfer.getSettlementStatus() != SettlementStatus.PENDING) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_SETTLEMENT_STATE,
                        "Transfer %s cannot be initiated from %s", eventId, transfer.getSettlementStatus());
            }
            transfer.setSettlementStatus(SettlementStatus.INITIATED);
            transfer.setInitiatedAt(clock.instant());
        });
    }

    /**
     * PENDING, INITIATED or FAILED -> SETTLED
     *
     * @param settlementDate defaults to today when null
     */
    public TransferEventData settleTransfer(String eventId, LocalDate settlementDate, String settlementReference) {
        return updateTransfer("settleTransfer", eventId, "settled", transfer -> {
            rejectFinal(transfer);
            transfer.setSettlementStatus(SettlementStatus.SETTLED);
            transfer.setSettlementDate(settlementDate != null ? settlementDate : LocalDate.now(clock));
            transfer.setSettlementReference(settlementReference);
            transfer.setFailureReason(null);
            transfer.setSettledAt(clock.instant());
        });
    }

    public TransferEventData failTransfer(String eventId, String reason) {
        requireText(reason, "reason");
        return updateTransfer("failTransfer", eventId, "failed: " + reason, transfer -> {
            rejectFinal(transfer);
            transfer.setSettlementStatus(SettlementStatus.FAILED);
            transfer.setFailureReason(reason);
        });
    }

    public TransferEventData cancelTransfer(String eventId, String reason) {
        requireText(reason, "reason");
        return updateTransfer("cancelTransfer", eventId, "cancelled: " + reason, transfer -> {
            rejectFinal(transfer);
            transfer.setSettlementStatus(SettlementStatus.CANCELLED);
            transfer.setFailureReason(reason);
        });
    }

    /**
     * Independent confirmation flag, allowed in any settlement status
     */
    public TransferEventData verifyTransfer(String eventId, String verifier) {
        requireText(verifier, "verifier");
        return updateTransfer("verifyTransfer", eventId, "verified by " + verifier, transfer -> {
            transfer.setVerified(true);
            transfer.setVerifiedBy(verifier);
            transfer.setVerifiedAt(clock.instant());
        });
    }

    private static void rejectFinal(TransferEventData transfer) {
        if (transfer.getSettlementStatus() == SettlementStatus.SETTLED) {
            throw TradeLifecycleException.of(ErrorCode.ALREADY_SETTLED,
                    "Transfer %s is already settled", transfer.getEventId());
        }
        if (transfer.getSettlementStatus() == SettlementStatus.CANCELLED) {
            throw TradeLifecycleException.of(ErrorCode.TRANSFER_CANCELLED,
                    "Transfer %s is cancelled", transfer.getEventId());
        }
    }

    private TransferEventData updateTransfer(String operation, String eventId, String detail,
                                             Consumer<TransferEventData> change) {
        String tradeId = getTransfer(eventId).getTradeId();
        TransferEventData updated = inWriteScope(operation, tradeId, () -> {
            tradeStateService.lockCurrent(tradeId);
            TransferEventData transfer = getTransfer(eventId);
            change.accept(transfer);
            return transferEventStore.save(transfer);
        });
        log.info("Transfer {} of trade {} {} (status {})", eventId, tradeId, detail, updated.getSettlementStatus());
        notificationService.eventUpdated(eventLedgerService.getEvent(eventId), "transfer " + detail);
        return updated;
    }

    // ---- Queries ----

    public TransferEventData getTransfer(String eventId) {
        return findTransfer(eventId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "Transfer event %s not found", eventId));
    }

    public Optional<TransferEventData> findTransfer(String eventId) {
        if (eventId == null) {
            return Optional.empty();
        }
        return transferEventStore.findByEventId(eventId);
    }

    /**
     * Transfers of a trade in sequence order
     */
    public List<TransferEventData> getTransfers(String tradeId) {
        return transferEventStore.findByTradeId(tradeId);
    }

    public boolean isSettled(String eventId) {
        return getTransfer(eventId).getSettlementStatus() == SettlementStatus.SETTLED;
    }

    /**
     * Transfers still expected to move money: neither settled nor cancelled
     */
    public List<TransferEventData> getOutstandingTransfers(String tradeId) {
        return getTransfers(tradeId).stream()
                .filter(t -> t.getSettlementStatus() != SettlementStatus.SETTLED
                        && t.getSettlementStatus() != SettlementStatus.CANCELLED)
                .collect(Collectors.toList());
    }
}
