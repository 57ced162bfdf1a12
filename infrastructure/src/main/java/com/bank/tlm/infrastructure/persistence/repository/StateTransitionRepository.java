package com.bank.tlm.infrastructure.persistence.repository;

import com.bank.tlm.infrastructure.persistence.entity.StateTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StateTransitionRepository extends JpaRepository<StateTransitionEntity, String> {
    
    List<StateTransitionEntity> findByTradeIdOrderBySequenceAsc(String tradeId);
}
