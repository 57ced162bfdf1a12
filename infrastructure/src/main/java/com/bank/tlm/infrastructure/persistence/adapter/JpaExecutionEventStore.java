package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.ExecutionEventData;
import com.bank.tlm.domain.store.ExecutionEventStore;
import com.bank.tlm.infrastructure.persistence.entity.ExecutionEventEntity;
import com.bank.tlm.infrastructure.persistence.repository.ExecutionEventRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JpaExecutionEventStore implements ExecutionEventStore {
    
    private final ExecutionEventRepository repository;
    private final PayloadMapper payloadMapper;
    
    public JpaExecutionEventStore(ExecutionEventRepository repository, PayloadMapper payloadMapper) {
        this.repository = repository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean existsByTradeId(String tradeId) {
        return repository.existsByTradeId(tradeId);
    }
    
    @Override
    public Optional<ExecutionEventData> findByTradeId(String tradeId) {
        return repository.findByTradeId(tradeId).map(this::toDomain);
    }
    
    @Override
    public Optional<ExecutionEventData> findByEventId(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }
    
    @Override
    public ExecutionEventData save(ExecutionEventData data) {
        repository.save(ExecutionEventEntity.builder()
                .eventId(data.getEventId())
                .tradeId(data.getTradeId())
                .payload(payloadMapper.write(data))
                .recordedAt(data.getRecordedAt())
                .build());
        return data;
    }
    
    private ExecutionEventData toDomain(ExecutionEventEntity entity) {
        return payloadMapper.read(entity.getPayload(), ExecutionEventData.class);
    }
}
