package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EconomicTerms;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.ExecutionDetails;
import com.bank.tlm.domain.model.ExecutionEventData;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.store.ExecutionEventStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.bank.tlm.application.service.LedgerPreconditions.isBlank;
import static com.bank.tlm.application.service.LedgerPreconditions.isPositive;
import static com.bank.tlm.application.service.LedgerPreconditions.requirePresent;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Records the single inception event of a trade and confirms it (CREATED -> CONFIRMED)
 */
@Service
public class ExecutionService extends AbstractEventRecorder {

    private final ExecutionEventStore executionEventStore;

    public ExecutionService(ExecutionEventStore executionEventStore,
                            TradeStateService tradeStateService,
                            EventLedgerService eventLedgerService,
                            TradeWriteScope writeScope,
                            MetricsService metricsService,
                            LifecycleNotificationService notificationService,
                            Clock clock) {
        super(tradeStateService, eventLedgerService, writeScope, metricsService, notificationService, clock);
        this.executionEventStore = executionEventStore;
    }

    public EventRecord executeTrade(String eventId,
                                    String tradeId,
                                    ExecutionDetails executionDetails,
                                    EconomicTerms economicTerms,
                                    String buyer,
                                    String seller,
                                    String broker,
                                    LocalDate tradeDate) {
        requireText(eventId, "eventId");
        requireText(tradeId, "tradeId");
        requirePresent(executionDetails, "executionDetails");
        requirePresent(economicTerms, "economicTerms");

        return recordEvent("executeTrade", tradeId, () -> {
            Optional<TradeStateSnapshot> locked = tradeStateService.lockIfPresent(tradeId);

            if (executionEventStore.existsByTradeId(tradeId)) {
                throw TradeLifecycleException.of(ErrorCode.ALREADY_EXECUTED, "Trade %s is already executed", tradeId);
            }
            if (isBlank(buyer) || isBlank(seller)) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES, "Buyer and seller are required");
            }
            if (buyer.equals(seller)) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES,
                        "Buyer and seller must differ, both are %s", buyer);
            }

            List<String> parties = new ArrayList<>(List.of(buyer, seller));
            if (!isBlank(broker)) {
                parties.add(broker);
            }
            LocalDate effectiveDate = economicTerms.getEffectiveDate();
            eventLedgerService.validateBasics(eventId, tradeId, effectiveDate, parties);
            validateTerms(executionDetails, economicTerms);

            TradeStateSnapshot current = locked.orElseGet(() -> tradeStateService.lockCurrent(tradeId));
            if (current.getState() != TradeState.CREATED) {
                throw TradeLifecycleException.of(ErrorCode.WRONG_TRADE_STATE,
                        "Trade %s must be CREATED to execute, is %s", tradeId, current.getState());
            }

            executionEventStore.save(ExecutionEventData.builder()
                    .eventId(eventId)
                    .tradeId(tradeId)
                    .executionDetails(executionDetails)
                    .economicTerms(economicTerms)
                    .buyer(buyer)
                    .seller(seller)
                    .broker(isBlank(broker) ? null : broker)
                    .tradeDate(tradeDate)
                    .recordedAt(clock.instant())
                    .build());

            eventLedgerService.append(EventRecord.builder()
                    .eventId(eventId)
                    .eventType(EventType.EXECUTION)
                    .effectiveDate(effectiveDate)
                    .tradeId(tradeId)
                    .involvedParties(parties)
                    .initiator(buyer)
                    .beforeStateId(current.getSnapshotId())
                    .message(String.format("Executed %s %s on %s", economicTerms.getNotional(),
                            economicTerms.getCurrency(), executionDetails.getVenue()))
                    .build());

            TradeStateSnapshot confirmed = tradeStateService.advance(current, TradeState.CONFIRMED, eventId, buyer);
            return eventLedgerService.finalizeProcessed(eventId, confirmed.getSnapshotId());
        });
    }

    private void validateTerms(ExecutionDetails executionDetails, EconomicTerms terms) {
        if (terms.getMaturityDate() == null || !terms.getMaturityDate().isAfter(terms.getEffectiveDate())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_DATES,
                    "Maturity date %s must be after effective date %s", terms.getMaturityDate(), terms.getEffectiveDate());
        }
        if (executionDetails.getExecutionTimestamp() == null) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_DATES, "Execution timestamp is required");
        }
        LocalDate executedOn = executionDetails.getExecutionTimestamp().atZone(ZoneOffset.UTC).toLocalDate();
        if (executedOn.isAfter(terms.getEffectiveDate())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_DATES,
                    "Execution on %s is after effective date %s", executedOn, terms.getEffectiveDate());
        }
        if (!isPositive(terms.getNotional())) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_NOTIONAL,
                    "Notional must be positive, was %s", terms.getNotional());
        }
    }

    // ---- Queries ----

    public boolean hasExecution(String tradeId) {
        return tradeId != null && executionEventStore.existsByTradeId(tradeId);
    }

    public Optional<ExecutionEventData> findExecution(String tradeId) {
        return executionEventStore.findByTradeId(tradeId);
    }

    public ExecutionEventData getExecution(String tradeId) {
        return findExecution(tradeId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "No execution recorded for trade %s", tradeId));
    }

    public ExecutionEventData getExecutionByEvent(String eventId) {
        return executionEventStore.findByEventId(eventId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "Execution event %s not found", eventId));
    }
}
