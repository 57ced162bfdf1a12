package com.bank.tlm.application.service;

import com.bank.tlm.application.support.LedgerFixture;
import com.bank.tlm.domain.enums.EventStatus;
import com.bank.tlm.domain.enums.EventType;
import com.bank.tlm.domain.enums.TradeState;
import com.bank.tlm.domain.event.TradeLifecycleNotification;
import com.bank.tlm.domain.exception.ErrorCategory;
import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;
import com.bank.tlm.domain.model.EconomicTerms;
import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.model.ExecutionDetails;
import com.bank.tlm.domain.model.ExecutionEventData;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.math.BigDecimal;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static com.bank.tlm.application.support.LedgerFixture.EFFECTIVE;
import static com.bank.tlm.application.support.LedgerFixture.PARTY_A;
import static com.bank.tlm.application.support.LedgerFixture.PARTY_B;
import static com.bank.tlm.application.support.LedgerFixture.TODAY;
import static com.bank.tlm.application.support.LedgerFixture.economicTerms;
import static com.bank.tlm.application.support.LedgerFixture.executionDetails;
import static org.junit.jupiter.api.Assertions.*;

class ExecutionServiceTest {
    
    private LedgerFixture ledger;
    private ExecutionService service;
    
    @BeforeEach
    void setUp() {
        ledger = new LedgerFixture();
        service = ledger.executionService;
        ledger.createTrade("T1");
    }
    
    private EventRecord execute(String eventId, ExecutionDetails details, EconomicTerms terms, String buyer, String seller) {
        return service.executeTrade(eventId, "T1", details, terms, buyer, seller, null, TODAY);
    }
    
    private void assertRejected(ErrorCode expected, Executable call) {
        TradeLifecycleException ex = assertThrows(TradeLifecycleException.class, call);
        assertEquals(expected, ex.getErrorCode());
        assertFalse(service.hasExecution("T1"));
        assertEquals(0, ledger.eventRecordStore.size());
        assertEquals(TradeState.CREATED, ledger.tradeStateService.getCurrentState("T1").getState());
    }
    
    @Test
    void testExecuteTradeConfirmsTrade() {
        TradeStateSnapshot created = ledger.tradeStateService.getCurrentState("T1");
        
        EventRecord record = service.executeTrade("EXE-1", "T1", executionDetails(), economicTerms(),
                PARTY_A, PARTY_B, "BROKER-X", TODAY);
        
        TradeStateSnapshot confirmed = ledger.tradeStateService.getCurrentState("T1");
        assertEquals(TradeState.CONFIRMED, confirmed.getState());
        assertEquals("EXE-1", confirmed.getCausingEventId());
        
        assertEquals(EventType.EXECUTION, record.getEventType());
        assertEquals(EventStatus.PROCESSED, record.getStatus());
        assertEquals(created.getSnapshotId(), record.getBeforeStateId());
        assertEquals(confirmed.getSnapshotId(), record.getAfterStateId());
        assertEquals(List.of(PARTY_A, PARTY_B, "BROKER-X"), record.getInvolvedParties());
        assertEquals(PARTY_A, record.getInitiator());
        assertEquals(EFFECTIVE, record.getEffectiveDate());
        
        assertEquals(PARTY_A, ledger.tradeStateService.getTransitionHistory("T1").get(0).getInitiator());
        
        ExecutionEventData data = service.getExecution("T1");
        assertEquals("EXE-1", data.getEventId());
        assertEquals("TRADEWEB", data.getExecutionDetails().getVenue());
        assertEquals(0, new BigDecimal("10000000").compareTo(data.getEconomicTerms().getNotional()));
        assertEquals(data, service.getExecutionByEvent("EXE-1"));
    }
    
    @Test
    void testSecondExecutionFailsWithAlreadyExecuted() {
        ledger.execute("T1");
        
        TradeLifecycleException ex = assertThrows(TradeLifecycleException.class,
                () -> execute("EXE-2", executionDetails(), economicTerms(), PARTY_A, PARTY_B));
        
        assertEquals(ErrorCode.ALREADY_EXECUTED, ex.getErrorCode());
        assertEquals(ErrorCategory.ALREADY_EXISTS, ex.getCategory());
        assertEquals(1, ledger.executionStore.size());
    }
    
    @Test
    void testBuyerAndSellerMustDiffer() {
        assertRejected(ErrorCode.INVALID_PARTIES,
                () -> execute("EXE-1", executionDetails(), economicTerms(), PARTY_A, PARTY_A));
        assertRejected(ErrorCode.INVALID_PARTIES,
                () -> execute("EXE-1", executionDetails(), economicTerms(), PARTY_A, ""));
    }
    
    @Test
    void testMaturityMustFollowEffectiveDate() {
        EconomicTerms terms = economicTerms().toBuilder().maturityDate(EFFECTIVE).build();
        
        assertRejected(ErrorCode.INVALID_DATES, () -> execute("EXE-1", executionDetails(), terms, PARTY_A, PARTY_B));
    }
    
    @Test
    void testExecutionCannotFollowEffectiveDate() {
        ExecutionDetails late = executionDetails().toBuilder()
                .executionTimestamp(LedgerFixture.NOW.plus(3, ChronoUnit.DAYS))
                .build();
        
        assertRejected(ErrorCode.INVALID_DATES, () -> execute("EXE-1", late, economicTerms(), PARTY_A, PARTY_B));
    }
    
    @Test
    void testEffectiveDateInThePast() {
        EconomicTerms terms = economicTerms().toBuilder().effectiveDate(TODAY.minusDays(1)).build();
        
        assertRejected(ErrorCode.INVALID_DATES, () -> execute("EXE-1", executionDetails(), terms, PARTY_A, PARTY_B));
    }
    
    @Test
    void testNotionalMustBePositive() {
        EconomicTerms terms = economicTerms().toBuilder().notional(BigDecimal.ZERO).build();
        
        assertRejected(ErrorCode.INVALID_NOTIONAL, () -> execute("EXE-1", executionDetails(), terms, PARTY_A, PARTY_B));
    }
    
    @Test
    void testTradeMustBeCreated() {
        ledger.tradeStateService.transitionState("T1", TradeState.PENDING, "CHK-1", "ops");
        
        TradeLifecycleException ex = assertThrows(TradeLifecycleException.class,
                () -> execute("EXE-1", executionDetails(), economicTerms(), PARTY_A, PARTY_B));
        
        assertEquals(ErrorCode.WRONG_TRADE_STATE, ex.getErrorCode());
        assertEquals(ErrorCategory.WRONG_LIFECYCLE_STAGE, ex.getCategory());
        assertFalse(service.hasExecution("T1"));
    }
    
    @Test
    void testUnknownTrade() {
        TradeLifecycleException ex = assertThrows(TradeLifecycleException.class,
                () -> service.executeTrade("EXE-1", "NOPE", executionDetails(), economicTerms(), PARTY_A, PARTY_B, null, TODAY));
        
        assertEquals(ErrorCode.TRADE_NOT_FOUND, ex.getErrorCode());
    }
    
    @Test
    void testRejectionIsCounted() {
        assertThrows(TradeLifecycleException.class,
                () -> execute("EXE-1", executionDetails(), economicTerms(), PARTY_A, PARTY_A));
        
        assertEquals(1.0, ledger.meterRegistry
                .counter("events.rejected", "operation", "executeTrade", "code", "INVALID_PARTIES").count());
        assertTrue(ledger.messageProducer.sent(TradeLifecycleNotification.Kind.EVENT_RECORDED).isEmpty());
    }
    
    @Test
    void testNotificationsFollowCommit() {
        ledger.messageProducer.clear();
        
        ledger.execute("T1");
        
        List<TradeLifecycleNotification> sent = ledger.messageProducer.sent();
        assertEquals(2, sent.size());
        assertEquals(TradeLifecycleNotification.Kind.EVENT_RECORDED, sent.get(0).getKind());
        assertEquals(TradeLifecycleNotification.Kind.STATE_CHANGED, sent.get(1).getKind());
        assertEquals(TradeState.CREATED, sent.get(1).getFromState());
        assertEquals(TradeState.CONFIRMED, sent.get(1).getToState());
    }
}
