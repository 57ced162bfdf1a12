package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.TerminationEventData;

import java.util.Optional;

public interface TerminationEventStore {

    boolean existsByTradeId(String tradeId);

    Optional<TerminationEventData> findByTradeId(String tradeId);

    Optional<TerminationEventData> findByEventId(String eventId);

    TerminationEventData save(TerminationEventData data);
}
