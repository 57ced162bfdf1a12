package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.EventStatus;
import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.store.EventRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static com.bank.tlm.application.service.LedgerPreconditions.hasBlankEntry;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Generic event envelope store shared by all event kinds.
 *
 * Events are appended in per-trade order and linked backwards through previousEventId. An event
 * starts PENDING and ends PROCESSED or FAILED; a finalized event cannot change status again.
 */
@Service
public class EventLedgerService {

    private static final Logger log = LoggerFactory.getLogger(EventLedgerService.class);

    private final EventRecordStore eventRecordStore;
    private final TradeStateService tradeStateService;
    private final TradeWriteScope writeScope;
    private final CorrelationIdService correlationIdService;
    private final LifecycleNotificationService notificationService;
    private final Clock clock;

    public EventLedgerService(EventRecordStore eventRecordStore,
                              TradeStateService tradeStateService,
                              TradeWriteScope writeScope,
                              CorrelationIdService correlationIdService,
                              LifecycleNotificationService notificationService,
                              Clock clock) {
        this.eventRecordStore = eventRecordStore;
        this.tradeStateService = tradeStateService;
        this.writeScope = writeScope;
        this.correlationIdService = correlationIdService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * Checks shared by forward-dated business events: unused event id, known trade, effective
     * date not in the past, at least one party
     */
    public void validateBasics(String eventId, String tradeId, LocalDate effectiveDate, List<String> parties) {
        validateBasics(eventId, tradeId, effectiveDate, parties, true);
    }

    /**
     * @param forwardDated when false the effective date may lie in the past
     */
    public void validateBasics(String eventId, String tradeId, LocalDate effectiveDate,
                               List<String> parties, boolean forwardDated) {
        requireText(eventId, "eventId");
        requireText(tradeId, "tradeId");
        if (eventRecordStore.exists(eventId)) {
            throw TradeLifecycleException.of(ErrorCode.DUPLICATE_EVENT_ID, "Event %s already recorded", eventId);
        }
        if (!tradeStateService.tradeExists(tradeId)) {
            throw TradeLifecycleException.of(ErrorCode.TRADE_NOT_FOUND, "Trade %s not found", tradeId);
        }
        if (effectiveDate == null) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_DATES, "Event %s has no effective date", eventId);
        }
        if (forwardDated && effectiveDate.isBefore(LocalDate.now(clock))) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_DATES,
                    "Event %s effective date %s is in the past", eventId, effectiveDate);
        }
        if (parties == null || parties.isEmpty() || hasBlankEntry(parties)) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES, "Event %s has no involved parties", eventId);
        }
    }

    /**
     * Append an event record to the global table and the trade's ordered list
     *
     * @return the stored record with its per-trade sequence and back link
     */
    public EventRecord store(EventRecord record) {
        requireText(record.getEventId(), "eventId");
        requireText(record.getTradeId(), "tradeId");
        EventRecord stored = writeScope.execute(record.getTradeId(), () -> append(record));
        log.info("Stored {} event {} for trade {}", stored.getEventType(), stored.getEventId(), stored.getTradeId());
        notificationService.eventRecorded(stored);
        return stored;
    }

    EventRecord append(EventRecord record) {
        if (record.getEventType() == null) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_INPUT, "Event %s has no type", record.getEventId());
        }
        if (eventRecordStore.exists(record.getEventId())) {
            throw TradeLifecycleException.of(ErrorCode.DUPLICATE_EVENT_ID,
                    "Event %s already recorded", record.getEventId());
        }
        if (!tradeStateService.tradeExists(record.getTradeId())) {
            throw TradeLifecycleException.of(ErrorCode.TRADE_NOT_FOUND, "Trade %s not found", record.getTradeId());
        }

        Optional<EventRecord> last = eventRecordStore.findLastByTradeId(record.getTradeId());
        EventRecord toStore = record.toBuilder()
                .status(EventStatus.PENDING)
                .timestamp(record.getTimestamp() != null ? record.getTimestamp() : clock.instant())
                .sequence(last.map(EventRecord::getSequence).orElse(0) + 1)
                .previousEventId(last.map(EventRecord::getEventId).orElse(null))
                .involvedParties(record.getInvolvedParties() == null
                        ? List.of() : List.copyOf(record.getInvolvedParties()))
                .valid(true)
                .correlationId(correlationIdService.getCurrentCorrelationId())
                .build();
        return eventRecordStore.save(toStore);
    }

    /**
     * Finalize an event as processed, pointing it at the snapshot the trade is in afterwards
     */
    public EventRecord markProcessed(String eventId, String afterStateId) {
        requireText(afterStateId, "afterStateId");
        String tradeId = getEvent(eventId).getTradeId();
        EventRecord updated = writeScope.execute(tradeId, () -> {
            tradeStateService.lockCurrent(tradeId);
            return finalizeProcessed(eventId, afterStateId);
        });
        log.info("Event {} marked PROCESSED", eventId);
        notificationService.eventUpdated(updated, "processed");
        return updated;
    }

    /**
     * Finalize an event as failed
     */
    public EventRecord markFailed(String eventId, String reason) {
        requireText(reason, "reason");
        String tradeId = getEvent(eventId).getTradeId();
        EventRecord updated = writeScope.execute(tradeId, () -> {
            tradeStateService.lockCurrent(tradeId);
            EventRecord record = loadPending(eventId);
            record.setStatus(EventStatus.FAILED);
            record.setValid(false);
            record.setFailureReason(reason);
            return eventRecordStore.save(record);
        });
        log.warn("Event {} marked FAILED: {}", eventId, reason);
        notificationService.eventUpdated(updated, "failed: " + reason);
        return updated;
    }

    EventRecord finalizeProcessed(String eventId, String afterStateId) {
        EventRecord record = loadPending(eventId);
        record.setStatus(EventStatus.PROCESSED);
        record.setAfterStateId(afterStateId);
        return eventRecordStore.save(record);
    }

    private EventRecord loadPending(String eventId) {
        EventRecord record = getEvent(eventId);
        if (record.getStatus().isTerminal()) {
            throw TradeLifecycleException.of(ErrorCode.EVENT_ALREADY_FINALIZED,
                    "Event %s is already %s", eventId, record.getStatus());
        }
        return record;
    }

    // ---- Queries ----

    public EventRecord getEvent(String eventId) {
        return findEvent(eventId).orElseThrow(() ->
                TradeLifecycleException.of(ErrorCode.EVENT_NOT_FOUND, "Event %s not found", eventId));
    }

    public Optional<EventRecord> findEvent(String eventId) {
        if (eventId == null) {
            return Optional.empty();
        }
        return eventRecordStore.findById(eventId);
    }

    public boolean eventExists(String eventId) {
        return eventId != null && eventRecordStore.exists(eventId);
    }

    public List<EventRecord> getEventsForTrade(String tradeId) {
        return eventRecordStore.findByTradeId(tradeId);
    }

    public List<EventRecord> getEventsForTrade(String tradeId, EventType eventType) {
        if (eventType == null) {
            return getEventsForTrade(tradeId);
        }
        return eventRecordStore.findByTradeId(tradeId).stream()
                .filter(record -> record.getEventType() == eventType)
                .collect(Collectors.toList());
    }

    public Optional<EventRecord> getLastEvent(String tradeId) {
        return eventRecordStore.findLastByTradeId(tradeId);
    }

    public boolean isProcessed(String eventId) {
        return findEvent(eventId)
                .map(record -> record.getStatus() == EventStatus.PROCESSED)
                .orElse(false);
    }

    /**
     * Events reached by walking previousEventId back from the trade's last event, oldest first
     */
    public List<EventRecord> getEventChain(String tradeId) {
        List<EventRecord> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        EventRecord cursor = eventRecordStore.findLastByTradeId(tradeId).orElse(null);
        while (cursor != null && visited.add(cursor.getEventId())) {
            chain.add(cursor);
            String previousId = cursor.getPreviousEventId();
            cursor = previousId == null ? null : eventRecordStore.findById(previousId).orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }
}
