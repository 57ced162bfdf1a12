package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.TradeCurrentStateEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for the per-trade current snapshot pointer
 */
@Repository
public interface TradeCurrentStateRepository extends JpaRepository<TradeCurrentStateEntity, String> {
    
    /**
     * Row lock held until the surrounding transaction ends
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM TradeCurrentStateEntity c WHERE c.tradeId = :tradeId")
    Optional<TradeCurrentStateEntity> findForUpdate(@Param("tradeId") String tradeId);
}
