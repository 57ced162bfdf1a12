package com.bank.tlm.application.support;

import com.bank.tlm.domain.model.TerminationEventData;
import com.bank.tlm.domain.store.TerminationEventStore;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class InMemoryTerminationEventStore implements TerminationEventStore {

    private final Map<String, TerminationEventData> byTradeId = new LinkedHashMap<>();

    @Override
    public synchronized boolean existsByTradeId(String tradeId) {
        return byTradeId.containsKey(tradeId);
    }

    @Override
    public synchronized Optional<TerminationEventData> findByTradeId(String tradeId) {
        return Optional.ofNullable(PayloadCopier.copy(byTradeId.get(tradeId)));
    }

    @Override
    public synchronized Optional<TerminationEventData> findByEventId(String eventId) {
        return byTradeId.values().stream()
                .filter(t -> t.getEventId().equals(eventId))
                .findFirst()
                .map(PayloadCopier::copy);
    }

    @Override
    public synchronized TerminationEventData save(TerminationEventData data) {
        TerminationEventData existing = byTradeId.get(data.getTradeId());
        if (existing != null && !existing.getEventId().equals(data.getEventId())) {
            throw new IllegalStateException("Trade " + data.getTradeId() + " already has a termination");
        }
        byTradeId.put(data.getTradeId(), PayloadCopier.copy(data));
        return PayloadCopier.copy(data);
    }

    public synchronized int size() {
        return byTradeId.size();
    }
}
