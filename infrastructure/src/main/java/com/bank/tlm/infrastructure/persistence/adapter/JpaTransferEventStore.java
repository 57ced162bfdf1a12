package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.TransferEventData;
import com.bank.tlm.domain.store.TransferEventStore;
import com.bank.tlm.infrastructure.persistence.entity.TransferEventEntity;
import com.bank.tlm.infrastructure.persistence.repository.TransferEventRepository;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Component
public class JpaTransferEventStore implements TransferEventStore {
    
    private final TransferEventRepository repository;
    private final PayloadMapper payloadMapper;
    
    public JpaTransferEventStore(TransferEventRepository repository, PayloadMapper payloadMapper) {
        this.repository = repository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean existsByPaymentReference(String paymentReference) {
        return paymentReference != null && repository.existsByPaymentReference(paymentReference);
    }
    
    @Override
    public Optional<TransferEventData> findByEventId(String eventId) {
        return repository.findById(eventId).map(this::toDomain);
    }
    
    @Override
    public List<TransferEventData> findByTradeId(String tradeId) {
        return repository.findByTradeIdOrderBySequenceNumberAsc(tradeId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    public Optional<TransferEventData> findLastByTradeId(String tradeId) {
        return repository.findFirstByTradeIdOrderBySequenceNumberDesc(tradeId).map(this::toDomain);
    }
    
    @Override
    public int countByTradeId(String tradeId) {
        return Math.toIntExact(repository.countByTradeId(tradeId));
    }
    
    @Override
    public TransferEventData save(TransferEventData data) {
        String paymentReference = data.getPayment() != null ? data.getPayment().getPaymentReference() : null;
        repository.save(TransferEventEntity.builder()
                .eventId(data.getEventId())
                .tradeId(data.getTradeId())
                .sequenceNumber(data.getSequenceNumber())
                .paymentReference(paymentReference)
                .settlementStatus(data.getSettlementStatus())
                .payload(payloadMapper.write(data))
                .recordedAt(data.getRecordedAt())
                .build());
        return data;
    }
    
    private TransferEventData toDomain(TransferEventEntity entity) {
        return payloadMapper.read(entity.getPayload(), TransferEventData.class);
    }
}
