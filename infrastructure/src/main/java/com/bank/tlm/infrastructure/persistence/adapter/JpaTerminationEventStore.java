package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.TerminationEventData;
import com.bank.tlm.domain.store.TerminationEventStore;
import com.bank.tlm.infrastructure.persistence.entity.TerminationEventEntity;
import com.bank.tlm.infrastructure.persistence.repository.TerminationEventRepository;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class JpaTerminationEventStore implements TerminationEventStore {
    
    private final TerminationEventRepository repository;
    private final PayloadMapper payloadMapper;
    
    public JpaTerminationEventStore(TerminationEventRepository repository, PayloadMapper payloadMapper) {
        this.repository = repository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean existsByTradeId(String tradeId) {
        return repository.existsByTradeId(tradeId);
    }
    
    @Override
    public Optional<TerminationEventData> findByTradeId(String tradeId) {
        return repository.findByTradeId(tradeId).map(this::toDomain);
    }
    
    @Override
    public Optional<TerminationEventData> findByEventId(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }
    
    @Override
    public TerminationEventData save(TerminationEventData data) {
        repository.save(TerminationEventEntity.builder()
                .eventId(data.getEventId())
                .tradeId(data.getTradeId())
                .status(data.getStatus())
                .payload(payloadMapper.write(data))
                .recordedAt(data.getRecordedAt())
                .build());
        return data;
    }
    
    private TerminationEventData toDomain(TerminationEventEntity entity) {
        return payloadMapper.read(entity.getPayload(), TerminationEventData.class);
    }
}
