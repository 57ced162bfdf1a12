package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.ExecutionEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ExecutionEventRepository extends JpaRepository<ExecutionEventEntity, String> {
    
    boolean existsByTradeId(String tradeId);
    
    Optional<ExecutionEventEntity> findByTradeId(String tradeId);
}
