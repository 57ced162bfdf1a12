package com.bank.tlm.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Exclusive writer scope for one trade aggregate.
 *
 * Work runs under a striped reentrant lock keyed by trade id and inside a single transaction.
 * The lock is taken before the transaction starts and released after it commits or rolls back.
 * Nested calls for the same trade join the outer transaction.
 */
@Component
public class TradeWriteScope {

    private static final Logger log = LoggerFactory.getLogger(TradeWriteScope.class);

    private final ReentrantLock[] stripes;
    private final TransactionOperations transactionOperations;

    public TradeWriteScope(TransactionOperations transactionOperations,
                           @Value("${app.ledger.lock-stripes:256}") int lockStripes) {
        if (lockStripes < 1) {
            throw new IllegalArgumentException("app.ledger.lock-stripes must be at least 1");
        }
        this.transactionOperations = transactionOperations;
        this.stripes = new ReentrantLock[lockStripes];
        for (int i = 0; i < lockStripes; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public <T> T execute(String tradeId, Supplier<T> work) {
        ReentrantLock lock = stripeFor(tradeId);
        lock.lock();
        try {
            log.trace("Write scope entered for trade {} (depth {})", tradeId, lock.getHoldCount());
            return transactionOperations.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock stripeFor(String tradeId) {
        int hash = tradeId == null ? 0 : tradeId.hashCode();
        return stripes[Math.floorMod(hash, stripes.length)];
    }
}
