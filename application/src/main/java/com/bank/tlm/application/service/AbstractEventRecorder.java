package com.bank.tlm.application.service;

import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Common write path of the business event recorders.
 *
 * Each recorder validates, stores its payload and event record, and optionally advances the
 * trade, all inside one {@link TradeWriteScope}. Metrics, logging and notifications follow the
 * commit.
 */
abstract class AbstractEventRecorder {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final TradeStateService tradeStateService;
    protected final EventLedgerService eventLedgerService;
    protected final TradeWriteScope writeScope;
    protected final MetricsService metricsService;
    protected final LifecycleNotificationService notificationService;
    protected final Clock clock;

    protected AbstractEventRecorder(TradeStateService tradeStateService,
                                    EventLedgerService eventLedgerService,
                                    TradeWriteScope writeScope,
                                    MetricsService metricsService,
                                    LifecycleNotificationService notificationService,
                                    Clock clock) {
        this.tradeStateService = tradeStateService;
        this.eventLedgerService = eventLedgerService;
        this.writeScope = writeScope;
        this.metricsService = metricsService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * Run a new-event write and publish its outcome after commit
     *
     * @return the processed event record
     */
    protected EventRecord recordEvent(String operation, String tradeId, Supplier<EventRecord> work) {
        Timer.Sample sample = metricsService.startEventRecording();
        EventRecord record;
        try {
            record = inWriteScope(operation, tradeId, work);
        } finally {
            metricsService.recordEventRecording(sample);
        }

        metricsService.recordEventRecorded(record.getEventType());
        log.info("Recorded {} event {} for trade {} (sequence {})",
                record.getEventType(), record.getEventId(), record.getTradeId(), record.getSequence());
        notificationService.eventRecorded(record);

        if (!Objects.equals(record.getBeforeStateId(), record.getAfterStateId())) {
            TradeStateSnapshot before = tradeStateService.getSnapshot(record.getBeforeStateId());
            TradeStateSnapshot after = tradeStateService.getSnapshot(record.getAfterStateId());
            tradeStateService.afterTransition(before.getState(), after, record.getInitiator());
        }
        return record;
    }

    /**
     * Run ledger work for one trade, counting and logging a rejection before rethrowing it
     */
    protected <T> T inWriteScope(String operation, String tradeId, Supplier<T> work) {
        try {
            return writeScope.execute(tradeId, work);
        } catch (TradeLifecycleException e) {
            metricsService.recordEventRejected(operation, e.getErrorCode());
            log.warn("{} rejected for trade {}: [{}] {}", operation, tradeId, e.getErrorCode(), e.getMessage());
            throw e;
        }
    }
}
