package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.ExecutionEventData;

import java.util.Optional;

public interface ExecutionEventStore {

    boolean existsByTradeId(String tradeId);

    Optional<ExecutionEventData> findByTradeId(String tradeId);

    Optional<ExecutionEventData> findByEventId(String eventId);

    ExecutionEventData save(ExecutionEventData data);
}
