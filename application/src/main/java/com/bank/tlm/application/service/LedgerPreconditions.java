package com.bank.tlm.application.service;

import com.bank.tlm.domain.exception.ErrorCode;
import com.bank.tlm.domain.exception.TradeLifecycleException;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Shared precondition checks for ledger operations
 */
final class LedgerPreconditions {

    private LedgerPreconditions() {
        // utility class
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String requireText(String value, String field) {
        return requireText(value, ErrorCode.INVALID_INPUT, field);
    }

    static String requireText(String value, ErrorCode errorCode, String field) {
        if (isBlank(value)) {
            throw TradeLifecycleException.of(errorCode, "%s is required", field);
        }
        return value;
    }

    static <T> T requirePresent(T value, String field) {
        return requirePresent(value, ErrorCode.INVALID_INPUT, field);
    }

    static <T> T requirePresent(T value, ErrorCode errorCode, String field) {
        if (value == null) {
            throw TradeLifecycleException.of(errorCode, "%s is required", field);
        }
        return value;
    }

    static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    static boolean hasBlankEntry(Collection<String> values) {
        return values.stream().anyMatch(LedgerPreconditions::isBlank);
    }
}
