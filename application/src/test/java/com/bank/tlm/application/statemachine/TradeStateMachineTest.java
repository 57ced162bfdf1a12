package com.bank.tlm.application.statemachine;

import com.bank.tlm.domain.enums.TradeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TradeStateMachineTest {
    
    private TradeStateMachine stateMachine;
    
    @BeforeEach
    void setUp() {
        stateMachine = new TradeStateMachine();
    }
    
    @Test
    void testInitialStateIsCreated() {
        assertEquals(TradeState.CREATED, stateMachine.initialState());
    }
    
    @Test
    void testCreatedToConfirmed() {
        TradeStateMachine.TransitionResult result = stateMachine.transition(TradeState.CREATED, TradeState.CONFIRMED);
        
        assertTrue(result.isValid());
        assertEquals(TradeState.CONFIRMED, result.getNewState());
        assertNull(result.getErrorMessage());
    }
    
    @Test
    void testPendingCanReturnToCreated() {
        assertTrue(stateMachine.isValidTransition(TradeState.PENDING, TradeState.CREATED));
    }
    
    @Test
    void testCreatedCannotJumpToActive() {
        TradeStateMachine.TransitionResult result = stateMachine.transition(TradeState.CREATED, TradeState.ACTIVE);
        
        assertFalse(result.isValid());
        assertNull(result.getNewState());
        assertTrue(result.getErrorMessage().contains("CREATED -> ACTIVE"));
    }
    
    @Test
    void testSettledIsTerminal() {
        assertTrue(stateMachine.isTerminal(TradeState.SETTLED));
        assertTrue(stateMachine.allowedTransitions(TradeState.SETTLED).isEmpty());
        
        TradeStateMachine.TransitionResult result = stateMachine.transition(TradeState.SETTLED, TradeState.ACTIVE);
        assertFalse(result.isValid());
        assertTrue(result.getErrorMessage().contains("terminal"));
    }
    
    @Test
    void testOnlySettledIsTerminal() {
        for (TradeState state : TradeState.values()) {
            assertEquals(state == TradeState.SETTLED, stateMachine.isTerminal(state), state.name());
        }
    }
    
    @Test
    void testLegalTransitionTable() {
        assertEquals(EnumSet.of(TradeState.PENDING, TradeState.CONFIRMED), stateMachine.allowedTransitions(TradeState.CREATED));
        assertEquals(EnumSet.of(TradeState.CONFIRMED, TradeState.CREATED), stateMachine.allowedTransitions(TradeState.PENDING));
        assertEquals(EnumSet.of(TradeState.ACTIVE, TradeState.TERMINATED), stateMachine.allowedTransitions(TradeState.CONFIRMED));
        assertEquals(EnumSet.of(TradeState.MATURED, TradeState.TERMINATED), stateMachine.allowedTransitions(TradeState.ACTIVE));
        assertEquals(EnumSet.of(TradeState.SETTLED), stateMachine.allowedTransitions(TradeState.MATURED));
        assertEquals(EnumSet.of(TradeState.SETTLED), stateMachine.allowedTransitions(TradeState.TERMINATED));
    }
    
    @Test
    void testIsValidTransitionAgreesWithAllowedTransitions() {
        for (TradeState from : TradeState.values()) {
            Set<TradeState> allowed = stateMachine.allowedTransitions(from);
            for (TradeState to : TradeState.values()) {
                assertEquals(allowed.contains(to), stateMachine.isValidTransition(from, to), from + " -> " + to);
            }
        }
    }
    
    @Test
    void testSelfTransitionsAreIllegal() {
        for (TradeState state : TradeState.values()) {
            assertFalse(stateMachine.isValidTransition(state, state), state.name());
        }
    }
    
    @Test
    void testNullStates() {
        assertFalse(stateMachine.isValidTransition(null, TradeState.CREATED));
        assertFalse(stateMachine.isValidTransition(TradeState.CREATED, null));
        assertFalse(stateMachine.transition(null, TradeState.CONFIRMED).isValid());
        assertFalse(stateMachine.transition(TradeState.CREATED, null).isValid());
    }
    
    @Test
    void testAllowedTransitionsIsUnmodifiable() {
        Set<TradeState> allowed = stateMachine.allowedTransitions(TradeState.CREATED);
        
        assertThrows(UnsupportedOperationException.class, () -> allowed.add(TradeState.SETTLED));
    }
}
