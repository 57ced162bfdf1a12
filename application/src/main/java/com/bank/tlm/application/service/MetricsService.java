package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.exception.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording ledger metrics
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter tradesCreatedCounter;
    private final Counter notificationFailuresCounter;

    private final Timer eventRecordingTimer;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tradesCreatedCounter = Counter.builder("trades.created")
                .description("Total number of trades created")
                .register(meterRegistry);

        this.notificationFailuresCounter = Counter.builder("notifications.failed")
                .description("Lifecycle notifications that could not be published")
                .register(meterRegistry);

        this.eventRecordingTimer = Timer.builder("events.recording.time")
                .description("Time to validate and record a business event")
                .register(meterRegistry);
    }

    public void recordTradeCreated() {
        tradesCreatedCounter.increment();
    }

    public void recordEventRecorded(EventType eventType) {
        meterRegistry.counter("events.recorded", "type", eventType.name()).increment();
    }

    public void recordEventRejected(String operation, ErrorCode errorCode) {
        meterRegistry.counter("events.rejected", "operation", operation, "code", errorCode.name()).increment();
    }

    public void recordTransition(TradeState from, TradeState to) {
        meterRegistry.counter("trades.transitions", "from", from.name(), "to", to.name()).increment();
    }

    public void recordNotificationFailure() {
        notificationFailuresCounter.increment();
    }

    public Timer.Sample startEventRecording() {
        return Timer.start(meterRegistry);
    }

    public void recordEventRecording(Timer.Sample sample) {
        sample.stop(eventRecordingTimer);
    }
}
