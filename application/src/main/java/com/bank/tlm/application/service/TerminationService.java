package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.PaymentCalculationMethod;
import com.bank.tlm.domain.enums.TerminationStatus;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.TerminationDetails;
import com.bank.tlm.domain.model.TerminationEventData;
import com.bank.tlm.domain.model.TerminationPayment;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.model.TransferEventData;
import com.bank.tlm.domain.store.TerminationEventStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static com.bank.tlm.application.service.LedgerPreconditions.isBlank;
import static com.bank.tlm.application.service.LedgerPreconditions.requirePresent;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Records the early termination of a trade (ACTIVE or CONFIRMED -> TERMINATED) and follows
 * the termination payment through confirmation, dispute and settlement.
 *
 * Linking the settling transfer marks the termination SETTLED only. Moving the trade itself to
 * SETTLED is a separate {@link TradeStateService#transitionState} call.
 */
@Service
public class TerminationService extends AbstractEventRecorder {

    private final TerminationEventStore terminationEventStore;
    private final TransferService transferService;

    public TerminationService(TerminationEventStore terminationEventStore,
                              TransferService transferService,
                              TradeStateService tradeStateService,
                              EventLedgerService eventLedgerService,
                              TradeWriteScope writeScope,
                              MetricsService metricsService,
                              LifecycleNotificationService notificationService,
                              Clock clock) {
        super(tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
        this.terminationEventStore = terminationEventStore;
        this.transferService = transferService;
    }

    public EventRecord terminateTrade(String eventId,
                                      String tradeId,
                                      TerminationDetails details,
                                      TerminationPayment payment,
                                      String initiator) {
        requireText(eventId, "eventId");
        requireText(tradeId, "tradeId");
        requireText(initiator, "initiator");
        requirePresent(details, "details");
        requirePresent(details.getTerminationType(), "terminationType");
        requirePresent(payment, "payment");

        return recordEvent("terminateTrade", tradeId, () -> {
            Optional<TradeStateSnapshot> locked = tradeStateService.lockIfPresent(tradeId);

            if (terminationEventStore.existsByTradeId(tradeId)) {
                throw TradeLifecycleException.of(ErrorCode.TRADE_ALREADY_TERMINATED,
                        "Trade %s already has a termination", tradeId);
            }
            LocalDate terminationDate = details.getTerminationDate();
            if (terminationDate == null) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_TERMINATION_DATE, "Termination date is required");
            }
            List<String> tradeParties = locked.map(TradeStateSnapshot::getParties).orElse(List.of());
            eventLedgerService.validateBasics(eventId, tradeId, terminationDate, tradeParties, false);

            TradeStateSnapshot current = locked.orElseGet(() -> tradeStateService.lockCurrent(tradeId));
            if (current.getState() != TradeState.ACTIVE && current.getState() != TradeState.CONFIRMED) {
                throw TradeLifecycleException.of(ErrorCode.TRADE_NOT_ACTIVE,
                        "Trade %s must be ACTIVE or CONFIRMED to terminate, is %s", tradeId, current.getState());
            }
            validateDates(details);
            validatePayment(payment);

            terminationEventStore.save(TerminationEventData.builder()
                    .eventId(eventId)
                    .tradeId(tradeId)
                    .details(details)
                    .payment(payment)
                    .status(TerminationStatus.PENDING)
                    .initiator(initiator)
                    .recordedAt(clock.instant())
                    .build());

            eventLedgerService.append(EventRecord.builder()
                    .eventId(eventId)
                    .eventType(EventType.TERMINATION)
                    .effectiveDate(terminationDate)
                    .tradeId(tradeId)
                    .involvedParties(tradeParties)
                    .initiator(initiator)
                    .beforeStateId(current.getSnapshotId())
                    .message(String.format("%s termination on %s, %s %s %s", details.getTerminationType(),
                            terminationDate, payment.getMethod(), payment.getAmount(), payment.getCurrency()))
                    .build());

            TradeStateSnapshot terminated = tradeStateService.advance(current, TradeState.TERMINATED, eventId, initiator);
            return eventLedgerService.finalizeProcessed(eventId, terminated.getSnapshotId());
        });
    }

    private void validateDates(TerminationDetails details) {
        LocalDate terminationDate = details.getTerminationDate();
        if (terminationDate.isBefore(LocalDate.now(clock))) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_TERMINATION_DATE,
                    "Termination date %s is in the past", terminationDate);
        }
        if (details.getNotificationDate() != null && details.getNotificationDate().isAfter(terminationDate)) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_TERMINATION_DATE,
                    "Notification date %s is after termination date %s", details.getNotificationDate(), terminationDate);
        }
    }

    private void validatePayment(TerminationPayment payment) {
        if (payment.getMethod() == null) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PAYMENT_DETAILS, "Payment calculation method is required");
        }
        if (payment.getAmount() != null && payment.getAmount().signum() < 0) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PAYMENT_DETAILS,
                    "Termination amount must not be negative, was %s", payment.getAmount());
        }
        if (payment.getMethod() == PaymentCalculationMethod.ZERO) {
            return;
        }
        if (isBlank(payment.getPayer()) || isBlank(payment.getReceiver())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PAYMENT_DETAILS,
                    "%s payment needs a payer and a receiver", payment.getMethod());
        }
        if (payment.getPayer().equals(payment.getReceiver())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES,
                    "Payer and receiver must differ, both are %s", payment.getPayer());
        }
    }

    /**
     * PENDING -> CONFIRMED
     */
    public TerminationEventData confirmTermination(String eventId) {
        return updateTermination("confirmTermination", eventId, "confirmed", termination -> {
            if (termination.getStatus() == TerminationStatus.SETTLED) {
                throw TradeLifecycleException.of(ErrorCode.ALREADY_SETTLED, "Termination %s is already settled", eventId);
            }
            if (termination.getStatus() != TerminationStatus.PENDING) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_TERMINATION_STATUS,
                        "Termination %s cannot be confirmed from %s", eventId, termination.getStatus());
            }
            termination.setStatus(TerminationStatus.CONFIRMED);
            termination.setConfirmedAt(clock.instant());
        });
    }

    /**
     * Any status -> DISPUTED; flags the payment as disputed
     */
    public TerminationEventData disputeTermination(String eventId, String disputingParty, String reason) {
        requireText(disputingParty, "disputingParty");
        return updateTermination("disputeTermination", eventId, "disputed by " + disputingParty, termination -> {
            termination.setStatus(TerminationStatus.DISPUTED);
            TerminationPayment payment = termination.getPayment();
            payment.setDisputed(true);
            payment.setDisputingParty(disputingParty);
            payment.setDisputeReason(reason);
        });
    }

    /**
     * Record the transfer that pays the termination amount and mark the termination SETTLED
     */
    public TerminationEventData linkSettlementTransfer(String eventId, String transferEventId) {
        requireText(transferEventId, "transferEventId");
        return updateTermination("linkSettlementTransfer", eventId, "settled by transfer " + transferEventId,
                termination -> {
                    if (termination.getStatus() == TerminationStatus.SETTLED) {
                        throw TradeLifecycleException.of(ErrorCode.ALREADY_SETTLED,
                                "Termination %s is already settled by transfer %s",
                                eventId, termination.getSettlementTransferEventId());
                    }
                    TransferEventData transfer = transferService.getTransfer(transferEventId);
                    if (!transfer.getTradeId().equals(termination.getTradeId())) {
                        throw TradeLifecycleException.of(ErrorCode.TRANSFER_TRADE_MISMATCH,
                                "Transfer %s belongs to trade %s, not %s",
                                transferEventId, transfer.getTradeId(), termination.getTradeId());
                    }
                    termination.setSettlementTransferEventId(transferEventId);
                    termination.setStatus(TerminationStatus.SETTLED);
                    termination.setSettledAt(clock.instant());
                });
    }

    private TerminationEventData updateTermination(String operation, String eventId, String detail,
                                                   Consumer<TerminationEventData> change) {
        String tradeId = getTerminationByEvent(eventId).getTradeId();
        TerminationEventData updated = inWriteScope(operation, tradeId, () -> {
            tradeStateService.lockCurrent(tradeId);
            TerminationEventData termination = getTerminationByEvent(eventId);
            change.accept(termination);
            return terminationEventStore.save(termination);
        });
        log.info("Termination {} of trade {} {}", eventId, tradeId, detail);
        notificationService.eventUpdated(eventLedgerService.getEvent(eventId), "termination " + detail);
        return updated;
    }

    // ---- Queries ----

    public boolean hasTermination(String tradeId) {
        return tradeId != null && terminationEventStore.existsByTradeId(tradeId);
    }

    public Optional<TerminationEventData> findTermination(String tradeId) {
        return terminationEventStore.findByTradeId(tradeId);
    }

    public TerminationEventData getTermination(String tradeId) {
        return findTermination(tradeId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "No termination recorded for trade %s", tradeId));
    }

    public TerminationEventData getTerminationByEvent(String eventId) {
        return terminationEventStore.findByEventId(eventId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "Termination event %s not found", eventId));
    }
}
