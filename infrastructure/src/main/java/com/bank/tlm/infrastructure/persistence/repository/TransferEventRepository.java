package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.TransferEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for transfer payloads
 */
@Repository
public interface TransferEventRepository extends JpaRepository<TransferEventEntity, String> {
    
    boolean existsByPaymentReference(String paymentReference);
    
    /**
     * Transfers of a trade in insertion order
     */
    List<TransferEventEntity> findByTradeIdOrderBySequenceNumberAsc(String tradeId);
    
    Optional<TransferEventEntity> findFirstByTradeIdOrderBySequenceNumberDesc(String tradeId);
    
    long countByTradeId(String tradeId);
}
