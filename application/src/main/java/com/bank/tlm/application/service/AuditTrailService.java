package com.bank.tlm.application.service;

import com.bank.tlm.domain.model.AuditEntry;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.StateTransition;
import com.bank.tlm.domain.model.TradeAuditTrail;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Reconstructs why a trade is in its current state from snapshots, transitions and events
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final TradeStateService tradeStateService;
    private final EventLedgerService eventLedgerService;

    public AuditTrailService(TradeStateService tradeStateService, EventLedgerService eventLedgerService) {
        this.tradeStateService = tradeStateService;
        this.eventLedgerService = eventLedgerService;
    }

    public TradeAuditTrail getAuditTrail(String tradeId) {
        TradeStateSnapshot current = tradeStateService.getCurrentState(tradeId);
        List<TradeStateSnapshot> snapshots = tradeStateService.getSnapshotChain(tradeId);
        List<StateTransition> transitions = tradeStateService.getTransitionHistory(tradeId);
        List<EventRecord> events = eventLedgerService.getEventsForTrade(tradeId);
        boolean consistent = tradeStateService.verifySnapshotChain(tradeId);

        log.debug("Built audit trail for trade {}: {} snapshots, {} events", tradeId, snapshots.size(), events.size());
        return TradeAuditTrail.builder()
                .tradeId(tradeId)
                .currentState(current.getState())
                .currentSnapshotId(current.getSnapshotId())
                .snapshots(snapshots)
                .transitions(transitions)
                .events(events)
                .timeline(buildTimeline(snapshots.get(0), transitions, events))
                .chainConsistent(consistent)
                .build();
    }

    /**
     * Creation first, then each event followed by the transitions it caused. Transitions made
     * directly by a caller keep their own position. The result is ordered by time, ties keeping
     * this order.
     */
    private List<AuditEntry> buildTimeline(TradeStateSnapshot creation,
                                           List<StateTransition> transitions,
                                           List<EventRecord> events) {
        Map<String, EventRecord> eventsById = events.stream()
                .collect(Collectors.toMap(EventRecord::getEventId, Function.identity()));
        Map<String, List<StateTransition>> transitionsByEvent = transitions.stream()
                .filter(t -> eventsById.containsKey(t.getEventId()))
                .collect(Collectors.groupingBy(StateTransition::getEventId));

        List<AuditEntry> timeline = new ArrayList<>();
        timeline.add(AuditEntry.builder()
                .timestamp(creation.getTimestamp())
                .kind(AuditEntry.Kind.TRADE_CREATED)
                .toState(creation.getState())
                .description(String.format("Trade created as %s between %s",
                        creation.getProductType(), String.join(", ", creation.getParties())))
                .build());

        for (EventRecord event : events) {
            timeline.add(AuditEntry.builder()
                    .timestamp(event.getTimestamp())
                    .kind(AuditEntry.Kind.EVENT_RECORDED)
                    .eventId(event.getEventId())
                    .eventType(event.getEventType())
                    .actor(event.getInitiator())
                    .description(event.getStatus() + ": " + event.getMessage())
                    .build());
            for (StateTransition transition : transitionsByEvent.getOrDefault(event.getEventId(), List.of())) {
                timeline.add(stateChanged(transition, event));
            }
        }
        transitions.stream()
                .filter(t -> !eventsById.containsKey(t.getEventId()))
                .forEach(t -> timeline.add(stateChanged(t, null)));

        timeline.sort(Comparator.comparing(AuditEntry::getTimestamp));
        return timeline;
    }

    private static AuditEntry stateChanged(StateTransition transition, EventRecord cause) {
        String because = cause == null
                ? "requested directly (reference " + transition.getEventId() + ")"
                : cause.getEventType() + " event: " + cause.getMessage();
        return AuditEntry.builder()
                .timestamp(transition.getTimestamp())
                .kind(AuditEntry.Kind.STATE_CHANGED)
                .eventId(transition.getEventId())
                .eventType(cause == null ? null : cause.getEventType())
                .fromState(transition.getFromState())
                .toState(transition.getToState())
                .actor(transition.getInitiator())
                .description(transition.getFromState() + " -> " + transition.getToState() + ", " + because)
                .build();
    }
}
