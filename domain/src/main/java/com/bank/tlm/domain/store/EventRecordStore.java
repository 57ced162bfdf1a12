package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.EventRecord;

import java.util.List;
import java.util.Optional;

/**
 * Global table of generic event records with a per-trade ordered view
 */
public interface EventRecordStore {

    boolean exists(String eventId);

    Optional<EventRecord> findById(String eventId);

    /**
     * Events of a trade ordered by their per-trade sequence
     */
    List<EventRecord> findByTradeId(String tradeId);

    Optional<EventRecord> findLastByTradeId(String tradeId);

    EventRecord save(EventRecord record);
}
