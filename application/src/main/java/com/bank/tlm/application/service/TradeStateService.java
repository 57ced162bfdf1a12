package com.bank.tlm.application.service;

import com.bank.tlm.application.statemachine.TradeStateMachine;
import com.bank.tlm.domain.enums.ProductType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.StateTransition;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.store.TradeStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.bank.tlm.application.service.LedgerPreconditions.hasBlankEntry;
import static com.bank.tlm.application.service.LedgerPreconditions.requirePresent;
import static com.bank.tlm.application.service.LedgerPreconditions.requireText;

/**
 * Canonical current state and immutable snapshot history of every trade.
 *
 * Only this service writes snapshots and transitions. Recorders that move a trade call
 * {@link #advance} from inside their own write scope and {@link #afterTransition} once it has
 * committed.
 */
@Service
public class TradeStateService {

    private static final Logger log = LoggerFactory.getLogger(TradeStateService.class);

    private final TradeStateStore stateStore;
    private final TradeStateMachine stateMachine;
    private final TradeWriteScope writeScope;
    private final MetricsService metricsService;
    private final LifecycleNotificationService notificationService;
    private final Clock clock;

    public TradeStateService(TradeStateStore stateStore,
                             TradeStateMachine stateMachine,
                             TradeWriteScope writeScope,
                             MetricsService metricsService,
                             LifecycleNotificationService notificationService,
                             Clock clock) {
        this.stateStore = stateStore;
        this.stateMachine = stateMachine;
        this.writeScope = writeScope;
        this.metricsService = metricsService;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * Create a trade in the initial CREATED state
     *
     * @return the creation snapshot
     */
    public TradeStateSnapshot createTrade(String tradeId,
                                          ProductType productType,
                                          List<String> parties,
                                          LocalDate effectiveDate,
                                          LocalDate maturityDate) {
        requireText(tradeId, "tradeId");

        TradeStateSnapshot snapshot = writeScope.execute(tradeId, () -> {
            if (stateStore.existsTrade(tradeId)) {
                throw TradeLifecycleException.of(ErrorCode.TRADE_ALREADY_EXISTS, "Trade %s already exists", tradeId);
            }
            requirePresent(productType, ErrorCode.INVALID_PRODUCT_TYPE, "productType");
            if (parties == null || parties.isEmpty() || hasBlankEntry(parties)) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES,
                        "Trade %s needs at least one non-blank party", tradeId);
            }
            if (new HashSet<>(parties).size() != parties.size()) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_PARTIES,
                        "Trade %s lists the same party more than once", tradeId);
            }
            requirePresent(effectiveDate, ErrorCode.INVALID_DATES, "effectiveDate");
            requirePresent(maturityDate, ErrorCode.INVALID_DATES, "maturityDate");
            if (!maturityDate.isAfter(effectiveDate)) {
                throw TradeLifecycleException.of(ErrorCode.INVALID_DATES,
                        "Maturity date %s must be after effective date %s", maturityDate, effectiveDate);
            }

            TradeStateSnapshot initial = TradeStateSnapshot.builder()
                    .snapshotId(newId())
                    .tradeId(tradeId)
                    .sequence(1)
                    .state(stateMachine.initialState())
                    .productType(productType)
                    .timestamp(clock.instant())
                    .parties(List.copyOf(parties))
                    .effectiveDate(effectiveDate)
                    .maturityDate(maturityDate)
                    .build();
            stateStore.createTrade(initial);
            return initial;
        });

        metricsService.recordTradeCreated();
        log.info("Created trade {} ({}) with snapshot {}", tradeId, productType, snapshot.getSnapshotId());
        notificationService.tradeCreated(snapshot);
        return snapshot;
    }

    /**
     * Move a trade along one legal edge of the state machine
     *
     * @return the new current snapshot
     */
    public TradeStateSnapshot transitionState(String tradeId, TradeState target, String causingEventId, String initiator) {
        requireText(tradeId, "tradeId");
        requirePresent(target, "target state");
        requireText(causingEventId, "causingEventId");
        requireText(initiator, "initiator");

        TradeStateSnapshot[] previous = new TradeStateSnapshot[1];
        TradeStateSnapshot next = writeScope.execute(tradeId, () -> {
            previous[0] = lockCurrent(tradeId);
            return advance(previous[0], target, causingEventId, initiator);
        });
        afterTransition(previous[0].getState(), next, initiator);
        return next;
    }

    /**
     * Append the successor of {@code current} and its transition. Must run inside the trade's
     * write scope with {@code current} read through {@link #lockCurrent(String)}.
     */
    TradeStateSnapshot advance(TradeStateSnapshot current, TradeState target, String causingEventId, String initiator) {
        checkTransition(current, target);

        Instant now = clock.instant();
        TradeStateSnapshot snapshot = current.toBuilder()
                .snapshotId(newId())
                .sequence(current.getSequence() + 1)
                .state(target)
                .timestamp(now)
                .causingEventId(causingEventId)
                .previousSnapshotId(current.getSnapshotId())
                .build();
        StateTransition transition = StateTransition.builder()
                .transitionId(newId())
                .tradeId(current.getTradeId())
                .sequence(current.getSequence())
                .fromState(current.getState())
                .toState(target)
                .eventId(causingEventId)
                .timestamp(now)
                .initiator(initiator)
                .valid(true)
                .build();
        stateStore.advance(snapshot, transition);
        return snapshot;
    }

    /**
     * Metrics, log and notification for a committed transition
     */
    void afterTransition(TradeState fromState, TradeStateSnapshot snapshot, String initiator) {
        metricsService.recordTransition(fromState, snapshot.getState());
        log.info("Trade {} moved {} -> {} by event {} (initiator {})", snapshot.getTradeId(),
                fromState, snapshot.getState(), snapshot.getCausingEventId(), initiator);
        notificationService.stateChanged(fromState, snapshot);
    }

    /**
     * Reject the move from the given snapshot's state to the target if it is not a legal edge
     */
    void checkTransition(TradeStateSnapshot current, TradeState target) {
        TradeStateMachine.TransitionResult result = stateMachine.transition(current.getState(), target);
        if (!result.isValid()) {
            throw TradeLifecycleException.of(ErrorCode.INVALID_TRANSITION,
                    "Trade %s: %s", current.getTradeId(), result.getErrorMessage());
        }
    }

    public boolean isValidTransition(TradeState from, TradeState to) {
        return stateMachine.isValidTransition(from, to);
    }

    /**
     * Current snapshot, holding the trade's row for the enclosing write scope
     */
    TradeStateSnapshot lockCurrent(String tradeId) {
        return lockIfPresent(tradeId).orElseThrow(() -> tradeNotFound(tradeId));
    }

    Optional<TradeStateSnapshot> lockIfPresent(String tradeId) {
        return stateStore.findCurrentForUpdate(tradeId);
    }

    // ---- Queries ----

    public boolean tradeExists(String tradeId) {
        return tradeId != null && stateStore.existsTrade(tradeId);
    }

    public TradeStateSnapshot getCurrentState(String tradeId) {
        return stateStore.findCurrent(tradeId).orElseThrow(() -> tradeNotFound(tradeId));
    }

    public Optional<TradeStateSnapshot> findCurrentState(String tradeId) {
        return stateStore.findCurrent(tradeId);
    }

    public TradeStateSnapshot getSnapshot(String snapshotId) {
        return stateStore.findSnapshot(snapshotId)
                .orElseThrow(() -> TradeLifecycleException.of(ErrorCode.TRADE_NOT_FOUND,
                        "Snapshot %s not found", snapshotId));
    }

    /**
     * Snapshots reached by walking back links from the current snapshot, creation first
     */
    public List<TradeStateSnapshot> getSnapshotChain(String tradeId) {
        List<TradeStateSnapshot> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        TradeStateSnapshot cursor = getCurrentState(tradeId);
        while (cursor != null && visited.add(cursor.getSnapshotId())) {
            chain.add(cursor);
            String previousId = cursor.getPreviousSnapshotId();
            cursor = previousId == null ? null : stateStore.findSnapshot(previousId).orElse(null);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Check that the back-linked chain starts at a CREATED creation snapshot and that every
     * step is a single legal transition
     */
    public boolean verifySnapshotChain(String tradeId) {
        List<TradeStateSnapshot> chain = getSnapshotChain(tradeId);
        TradeStateSnapshot first = chain.get(0);
        if (!first.isCreationSnapshot() || first.getState() != stateMachine.initialState()) {
            log.warn("Trade {} snapshot chain does not start at a creation snapshot", tradeId);
            return false;
        }
        for (int i = 1; i < chain.size(); i++) {
            TradeState from = chain.get(i - 1).getState();
            TradeState to = chain.get(i).getState();
            if (!stateMachine.isValidTransition(from, to)) {
                log.warn("Trade {} snapshot chain holds illegal step {} -> {}", tradeId, from, to);
                return false;
            }
        }
        return chain.size() == stateStore.findSnapshots(tradeId).size();
    }

    public List<TradeStateSnapshot> getSnapshotHistory(String tradeId) {
        ensureExists(tradeId);
        return stateStore.findSnapshots(tradeId);
    }

    public List<StateTransition> getTransitionHistory(String tradeId) {
        ensureExists(tradeId);
        return stateStore.findTransitions(tradeId);
    }

    public boolean isInState(String tradeId, TradeState state) {
        return getCurrentState(tradeId).getState() == state;
    }

    public boolean isActive(String tradeId) {
        return isInState(tradeId, TradeState.ACTIVE);
    }

    public boolean isTerminated(String tradeId) {
        return isInState(tradeId, TradeState.TERMINATED);
    }

    public boolean isSettled(String tradeId) {
        return isInState(tradeId, TradeState.SETTLED);
    }

    /**
     * Time elapsed between trade creation and the supplied instant
     */
    public Duration getTradeAge(String tradeId, Instant now) {
        Instant createdAt = stateStore.findCreationTime(tradeId).orElseThrow(() -> tradeNotFound(tradeId));
        return Duration.between(createdAt, now);
    }

    public boolean isEffective(String tradeId, LocalDate today) {
        return !today.isBefore(getCurrentState(tradeId).getEffectiveDate());
    }

    public boolean hasReachedMaturity(String tradeId, LocalDate today) {
        return !today.isBefore(getCurrentState(tradeId).getMaturityDate());
    }

    /**
     * Days from the supplied date to maturity; negative once maturity has passed
     */
    public long getDaysToMaturity(String tradeId, LocalDate today) {
        return ChronoUnit.DAYS.between(today, getCurrentState(tradeId).getMaturityDate());
    }

    private void ensureExists(String tradeId) {
        if (!tradeExists(tradeId)) {
            throw tradeNotFound(tradeId);
        }
    }

    private static TradeLifecycleException tradeNotFound(String tradeId) {
        return TradeLifecycleException.of(ErrorCode.TRADE_NOT_FOUND, "Trade %s not found", tradeId);
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
