package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.TerminationEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TerminationEventRepository extends JpaRepository<TerminationEventEntity, String> {
    
    boolean existsByTradeId(String tradeId);
    
    Optional<TerminationEventEntity> findByTradeId(String tradeId);
}
