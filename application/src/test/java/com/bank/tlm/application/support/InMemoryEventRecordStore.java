package com.bank.tlm.application.support;

import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.store.EventRecordStore;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InMemoryEventRecordStore implements EventRecordStore {

    private final Map<String, EventRecord> records = new LinkedHashMap<>();

    @Override
    public synchronized boolean exists(String eventId) {
        return records.containsKey(eventId);
    }

    @Override
    public synchronized Optional<EventRecord> findById(String eventId) {
        return Optional.ofNullable(PayloadCopier.copy(records.get(eventId)));
    }

    @Override
    public synchronized List<EventRecord> findByTradeId(String tradeId) {
        return records.values().stream()
                .filter(r -> r.getTradeId().equals(tradeId))
                .sorted(Comparator.comparingInt(EventRecord::getSequence))
                .map(PayloadCopier::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<EventRecord> findLastByTradeId(String tradeId) {
        return records.values().stream()
                .filter(r -> r.getTradeId().equals(tradeId))
                .max(Comparator.comparingInt(EventRecord::getSequence))
                .map(PayloadCopier::copy);
    }

    @Override
    public synchronized EventRecord save(EventRecord record) {
        records.put(record.getEventId(), PayloadCopier.copy(record));
        return PayloadCopier.copy(record);
    }

    public synchronized int size() {
        return records.size();
    }
}
