package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.EventRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for generic event records
 */
@Repository
public interface EventRecordRepository extends JpaRepository<EventRecordEntity, String> {
    
    /**
     * Per-trade event view ordered by sequence
     */
    List<EventRecordEntity> findByTradeIdOrderBySequenceAsc(String tradeId);
    
    /**
     * Most recent event of a trade
     */
    Optional<EventRecordEntity> findFirstByTradeIdOrderBySequenceDesc(String tradeId);
}
