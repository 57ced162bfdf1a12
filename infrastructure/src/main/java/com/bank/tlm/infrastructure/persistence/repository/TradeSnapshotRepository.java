package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.TradeSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for immutable trade snapshots
 */
@Repository
public interface TradeSnapshotRepository extends JpaRepository<TradeSnapshotEntity, String> {
    
    /**
     * Snapshot chain of a trade, oldest first
     */
    List<TradeSnapshotEntity> findByTradeIdOrderBySequenceAsc(String tradeId);
}
