package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.ResetEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for reset payloads
 */
@Repository
public interface ResetEventRepository extends JpaRepository<ResetEventEntity, String> {
    
    boolean existsByTradeIdAndResetNumber(String tradeId, int resetNumber);
    
    Optional<ResetEventEntity> findByTradeIdAndResetNumber(String tradeId, int resetNumber);
    
    /**
     * Resets of a trade in reset number order
     */
    List<ResetEventEntity> findByTradeIdOrderByResetNumberAsc(String tradeId);
}
