package com.bank.tlm.domain.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCodeTest {
    
    @Test
    void testEveryCodeHasACategory() {
        for (ErrorCode code : ErrorCode.values()) {
            assertNotNull(code.category(), code.name());
        }
    }
    
    @Test
    void testCategoryMapping() {
        assertEquals(ErrorCategory.NOT_FOUND, ErrorCode.TRADE_NOT_FOUND.category());
        assertEquals(ErrorCategory.ALREADY_EXISTS, ErrorCode.RESET_ALREADY_EXISTS.category());
        assertEquals(ErrorCategory.ALREADY_EXISTS, ErrorCode.TRADE_ALREADY_TERMINATED.category());
        assertEquals(ErrorCategory.INVALID_INPUT, ErrorCode.INVALID_RESET_NUMBER.category());
        assertEquals(ErrorCategory.ILLEGAL_TRANSITION, ErrorCode.INVALID_TRANSITION.category());
        assertEquals(ErrorCategory.WRONG_LIFECYCLE_STAGE, ErrorCode.TRADE_NOT_ACTIVE.category());
        assertEquals(ErrorCategory.ALREADY_TERMINAL, ErrorCode.ALREADY_SETTLED.category());
        assertEquals(ErrorCategory.ALREADY_TERMINAL, ErrorCode.EVENT_ALREADY_FINALIZED.category());
    }
    
    @Test
    void testExceptionCarriesCodeAndFormattedMessage() {
        TradeLifecycleException ex = TradeLifecycleException.of(ErrorCode.RESET_ALREADY_EXISTS,
                "Reset %d already recorded for trade %s", 3, "T1");
        
        assertEquals(ErrorCode.RESET_ALREADY_EXISTS, ex.getErrorCode());
        assertEquals(ErrorCategory.ALREADY_EXISTS, ex.getCategory());
        assertEquals("Reset 3 already recorded for trade T1", ex.getMessage());
    }
}
