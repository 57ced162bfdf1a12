package com.bank.tlm.application.statemachine;

import com.bank.tlm.domain.enums.TradeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * State machine for trade lifecycle management
 *
 * Legal transitions:
 * - CREATED    -> PENDING, CONFIRMED
 * - PENDING    -> CONFIRMED, CREATED
 * - CONFIRMED  -> ACTIVE, TERMINATED
 * - ACTIVE     -> MATURED, TERMINATED
 * - MATURED    -> SETTLED
 * - TERMINATED -> SETTLED
 * - SETTLED    -> (none, terminal)
 *
 * Stateless; the current state of each trade lives in the state store.
 */
@Component
public class TradeStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TradeStateMachine.class);

    private static final Map<TradeState, Set<TradeState>> LEGAL_TRANSITIONS = new EnumMap<>(TradeState.class);

    static {
        LEGAL_TRANSITIONS.put(TradeState.CREATED, EnumSet.of(TradeState.PENDING, TradeState.CONFIRMED));
        LEGAL_TRANSITIONS.put(TradeState.PENDING, EnumSet.of(TradeState.CONFIRMED, TradeState.CREATED));
        LEGAL_TRANSITIONS.put(TradeState.CONFIRMED, EnumSet.of(TradeState.ACTIVE, TradeState.TERMINATED));
        LEGAL_TRANSITIONS.put(TradeState.ACTIVE, EnumSet.of(TradeState.MATURED, TradeState.TERMINATED));
        LEGAL_TRANSITIONS.put(TradeState.MATURED, EnumSet.of(TradeState.SETTLED));
        LEGAL_TRANSITIONS.put(TradeState.TERMINATED, EnumSet.of(TradeState.SETTLED));
        LEGAL_TRANSITIONS.put(TradeState.SETTLED, EnumSet.noneOf(TradeState.class));
    }

    /**
     * Result of a state transition attempt
     */
    public static class TransitionResult {
        private final TradeState newState;
        private final boolean valid;
        private final String errorMessage;

        private TransitionResult(TradeState newState, boolean valid, String errorMessage) {
            this.newState = newState;
            this.valid = valid;
            this.errorMessage = errorMessage;
        }

        public static TransitionResult success(TradeState newState) {
            return new TransitionResult(newState, true, null);
        }

        public static TransitionResult failure(String errorMessage) {
            return new TransitionResult(null, false, errorMessage);
        }

        public TradeState getNewState() {
            return newState;
        }

        public boolean isValid() {
            return valid;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }

    public TradeState initialState() {
        return TradeState.CREATED;
    }

    /**
     * Pure predicate over the legal-transition table
     */
    public boolean isValidTransition(TradeState from, TradeState to) {
        if (from == null || to == null) {
            return false;
        }
        return LEGAL_TRANSITIONS.get(from).contains(to);
    }

    public Set<TradeState> allowedTransitions(TradeState from) {
        if (from == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(LEGAL_TRANSITIONS.get(from));
    }

    public boolean isTerminal(TradeState state) {
        return state != null && LEGAL_TRANSITIONS.get(state).isEmpty();
    }

    /**
     * Attempt to move from the current state to the requested target
     *
     * @param currentState Current trade state (null if the trade doesn't exist)
     * @param target Requested state
     * @return Transition result indicating new state and validity
     */
    public TransitionResult transition(TradeState currentState, TradeState target) {
        log.debug("State transition: {} -> {}", currentState, target);

        if (currentState == null) {
            return TransitionResult.failure("Trade does not exist; only creation can establish a state");
        }
        if (target == null) {
            return TransitionResult.failure("Target state cannot be null");
        }
        if (isTerminal(currentState)) {
            return TransitionResult.failure(
                    String.format("%s is terminal. Received: %s", currentState, target));
        }
        if (!isValidTransition(currentState, target)) {
            return TransitionResult.failure(
                    String.format("Invalid state transition: %s -> %s. Allowed: %s",
                            currentState, target, LEGAL_TRANSITIONS.get(currentState)));
        }
        return TransitionResult.success(target);
    }
}
