package com.bank.tlm.application.service;

import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.event.TradeLifecycleNotification;
import com.bank.tlm.domain.messaging.MessageProducer;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Publishes lifecycle notifications for downstream consumers (portfolio, netting).
 *
 * Called only after the ledger write has committed. A failed send is logged and counted and
 * never fails the caller.
 */
@Service
public class LifecycleNotificationService {

    private static final Logger log = LoggerFactory.getLogger(LifecycleNotificationService.class);

    private final Optional<MessageProducer> messageProducer;
    private final CircuitBreaker circuitBreaker;
    private final CorrelationIdService correlationIdService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String topic;

    public LifecycleNotificationService(Optional<MessageProducer> messageProducer,
                                        @Qualifier("notificationCircuitBreaker") CircuitBreaker circuitBreaker,
                                        CorrelationIdService correlationIdService,
                                        MetricsService metricsService,
                                        Clock clock,
                                        @Value("${app.messaging.topics.trade-lifecycle:trade-lifecycle-events}") String topic) {
        this.messageProducer = messageProducer;
        this.circuitBreaker = circuitBreaker;
        this.correlationIdService = correlationIdService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.topic = topic;
    }

    public void tradeCreated(TradeStateSnapshot snapshot) {
        publish(TradeLifecycleNotification.builder()
                .tradeId(snapshot.getTradeId())
                .kind(TradeLifecycleNotification.Kind.TRADE_CREATED)
                .toState(snapshot.getState())
                .snapshotId(snapshot.getSnapshotId())
                .build());
    }

    public void stateChanged(TradeState fromState, TradeStateSnapshot snapshot) {
        publish(TradeLifecycleNotification.builder()
                .tradeId(snapshot.getTradeId())
                .kind(TradeLifecycleNotification.Kind.STATE_CHANGED)
                .eventId(snapshot.getCausingEventId())
                .fromState(fromState)
                .toState(snapshot.getState())
                .snapshotId(snapshot.getSnapshotId())
                .build());
    }

    public void eventRecorded(EventRecord record) {
        publish(TradeLifecycleNotification.builder()
                .tradeId(record.getTradeId())
                .kind(TradeLifecycleNotification.Kind.EVENT_RECORDED)
                .eventId(record.getEventId())
                .eventType(record.getEventType())
                .snapshotId(record.getAfterStateId())
                .detail(record.getMessage())
                .build());
    }

    public void eventUpdated(EventRecord record, String detail) {
        publish(TradeLifecycleNotification.builder()
                .tradeId(record.getTradeId())
                .kind(TradeLifecycleNotification.Kind.EVENT_UPDATED)
                .eventId(record.getEventId())
                .eventType(record.getEventType())
                .detail(detail)
                .build());
    }

    private void publish(TradeLifecycleNotification notification) {
        if (messageProducer.isEmpty()) {
            log.debug("No message producer configured; skipping {} notification for trade {}",
                    notification.getKind(), notification.getTradeId());
            return;
        }
        notification.setOccurredAt(clock.instant());
        notification.setCorrelationId(correlationIdService.getCurrentCorrelationId());
        try {
            circuitBreaker.executeRunnable(() ->
                    messageProducer.get().send(topic, notification.getTradeId(), notification));
            log.debug("Published {} notification for trade {}", notification.getKind(), notification.getTradeId());
        } catch (Exception e) {
            metricsService.recordNotificationFailure();
            log.warn("Failed to publish {} notification for trade {}: {}",
                    notification.getKind(), notification.getTradeId(), e.getMessage());
        }
    }
}
