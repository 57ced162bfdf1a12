package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.ResetEventData;

import java.util.List;
import java.util.Optional;

public interface ResetEventStore {

    boolean existsByTradeIdAndResetNumber(String tradeId, int resetNumber);

    Optional<ResetEventData> findByTradeIdAndResetNumber(String tradeId, int resetNumber);

    Optional<ResetEventData> findByEventId(String eventId);

    /**
     * Resets of a trade ordered by reset number
     */
    List<ResetEventData> findByTradeId(String tradeId);

    ResetEventData save(ResetEventData data);
}
