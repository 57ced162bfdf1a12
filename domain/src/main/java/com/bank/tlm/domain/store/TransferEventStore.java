package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.TransferEventData;

import java.util.List;
import java.util.Optional;

public interface TransferEventStore {

    boolean existsByPaymentReference(String paymentReference);

    Optional<TransferEventData> findByEventId(String eventId);

    /**
     * Transfers of a trade in insertion order
     */
    List<TransferEventData> findByTradeId(String tradeId);

    Optional<TransferEventData> findLastByTradeId(String tradeId);

    int countByTradeId(String tradeId);

    TransferEventData save(TransferEventData data);
}
