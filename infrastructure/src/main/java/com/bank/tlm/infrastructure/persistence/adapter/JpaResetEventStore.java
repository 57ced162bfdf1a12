package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.ResetEventData;
import com.bank.tlm.domain.store.ResetEventStore;
import com.bank.tlm.infrastructure.persistence.entity.ResetEventEntity;
import com.bank.tlm.infrastructure.persistence.repository.ResetEventRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Reset payloads as JSON with the lookup keys in their own columns.
 * Saving an existing event id replaces its payload (rate verification).
 */
@Component
public class JpaResetEventStore implements ResetEventStore {
    
    private final ResetEventRepository repository;
    private final PayloadMapper payloadMapper;
    
    public JpaResetEventStore(ResetEventRepository repository, PayloadMapper payloadMapper) {
        this.repository = repository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean existsByTradeIdAndResetNumber(String tradeId, int resetNumber) {
        return repository.existsByTradeIdAndResetNumber(tradeId, resetNumber);
    }
    
    @Override
    public Optional<ResetEventData> findByTradeIdAndResetNumber(String tradeId, int resetNumber) {
        return repository.findByTradeIdAndResetNumber(tradeId, resetNumber).map(this::toDomain);
    }
    
    @Override
    public Optional<ResetEventData> findByEventId(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }
    
    @Override
    public List<ResetEventData> findByTradeId(String tradeId) {
        return repository.findByTradeIdOrderByResetNumberAsc(tradeId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    public ResetEventData save(ResetEventData data) {
        repository.save(ResetEventEntity.builder()
                .eventId(data.getEventId())
                .tradeId(data.getTradeId())
                .resetNumber(data.getResetNumber())
                .rateVerified(data.isRateVerified())
                .payload(payloadMapper.write(data))
                .recordedAt(data.getRecordedAt())
                .build());
        return data;
    }
    
    private ResetEventData toDomain(ResetEventEntity entity) {
        return payloadMapper.read(entity.getPayload(), ResetEventData.class);
    }
}
