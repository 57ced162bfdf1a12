package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.EventRecord;
import com.bank.tlm.domain.store.EventRecordStore;
import com.bank.tlm.infrastructure.persistence.entity.EventRecordEntity;
import com.bank.tlm.infrastructure.persistence.repository.EventRecordRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class JpaEventRecordStore implements EventRecordStore {
    
    private final EventRecordRepository repository;
    private final PayloadMapper payloadMapper;
    
    public JpaEventRecordStore(EventRecordRepository repository, PayloadMapper payloadMapper) {
        this.repository = repository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean exists(String eventId) {
        return repository.existsById(eventId);
    }
    
    @Override
    public Optional<EventRecord> findById(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }
    
    @Override
    public List<EventRecord> findByTradeId(String tradeId) {
        return repository.findByTradeIdOrderBySequenceAsc(tradeId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    public Optional<EventRecord> findLastByTradeId(String tradeId) {
        return repository.findFirstByTradeIdOrderBySequenceDesc(tradeId).map(this::toDomain);
    }
    
    @Override
    public EventRecord save(EventRecord record) {
        return toDomain(repository.save(toEntity(record)));
    }
    
    private EventRecordEntity toEntity(EventRecord record) {
        return EventRecordEntity.builder()
                .eventId(record.getEventId())
                .eventType(record.getEventType())
                .status(record.getStatus())
                .timestamp(record.getTimestamp())
                .effectiveDate(record.getEffectiveDate())
                .tradeId(record.getTradeId())
                .sequence(record.getSequence())
                .involvedPartiesJson(payloadMapper.write(
                        record.getInvolvedParties() != null ? record.getInvolvedParties() : List.of()))
                .initiator(record.getInitiator())
                .beforeStateId(record.getBeforeStateId())
                .afterStateId(record.getAfterStateId())
                .previousEventId(record.getPreviousEventId())
                .valid(record.isValid())
                .message(record.getMessage())
                .failureReason(record.getFailureReason())
                .correlationId(record.getCorrelationId())
                .build();
    }
    
    private EventRecord toDomain(EventRecordEntity entity) {
        return EventRecord.builder()
                .eventId(entity.getEventId())
                .eventType(entity.getEventType())
                .status(entity.getStatus())
                .timestamp(entity.getTimestamp())
                .effectiveDate(entity.getEffectiveDate())
                .tradeId(entity.getTradeId())
                .sequence(entity.getSequence())
                .involvedParties(payloadMapper.readStrings(entity.getInvolvedPartiesJson()))
                .initiator(entity.getInitiator())
                .beforeStateId(entity.getBeforeStateId())
                .afterStateId(entity.getAfterStateId())
                .previousEventId(entity.getPreviousEventId())
                .valid(entity.isValid())
                .message(entity.getMessage())
                .failureReason(entity.getFailureReason())
                .correlationId(entity.getCorrelationId())
                .build();
    }
}
