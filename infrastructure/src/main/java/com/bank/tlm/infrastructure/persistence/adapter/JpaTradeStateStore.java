package com.bank.tlm.infrastructure.persistence.adapter;

import com.bank.tlm.domain.model.StateTransition;
import com.bank.tlm.domain.model.TradeStateSnapshot;
import com.bank.tlm.domain.store.TradeStateStore;
import com.bank.tlm.infrastructure.persistence.entity.StateTransitionEntity;
import com.bank.tlm.infrastructure.persistence.entity.TradeCurrentStateEntity;
import com.bank.tlm.infrastructure.persistence.entity.TradeSnapshotEntity;
import com.bank.tlm.infrastructure.persistence.repository.StateTransitionRepository;
import com.bank.tlm.infrastructure.persistence.repository.TradeCurrentStateRepository;
import com.bank.tlm.infrastructure.persistence.repository.TradeSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * JPA backed snapshot chain and current-state pointer.
 * Callers run inside the trade write scope transaction.
 */
@Component
public class JpaTradeStateStore implements TradeStateStore {
    
    private static final Logger log = LoggerFactory.getLogger(JpaTradeStateStore.class);
    
    private final TradeSnapshotRepository snapshotRepository;
    private final TradeCurrentStateRepository currentStateRepository;
    private final StateTransitionRepository transitionRepository;
    private final PayloadMapper payloadMapper;
    
    public JpaTradeStateStore(TradeSnapshotRepository snapshotRepository,
                              TradeCurrentStateRepository currentStateRepository,
                              StateTransitionRepository transitionRepository,
                              PayloadMapper payloadMapper) {
        this.snapshotRepository = snapshotRepository;
        this.currentStateRepository = currentStateRepository;
        this.transitionRepository = transitionRepository;
        this.payloadMapper = payloadMapper;
    }
    
    @Override
    public boolean existsTrade(String tradeId) {
        return currentStateRepository.existsById(tradeId);
    }
    
    @Override
    public void createTrade(TradeStateSnapshot initialSnapshot) {
        snapshotRepository.save(toEntity(initialSnapshot));
        currentStateRepository.save(TradeCurrentStateEntity.builder()
                .tradeId(initialSnapshot.getTradeId())
                .currentSnapshotId(initialSnapshot.getSnapshotId())
                .createdAt(initialSnapshot.getTimestamp())
                .build());
        log.debug("Stored creation snapshot {} for trade {}", initialSnapshot.getSnapshotId(), initialSnapshot.getTradeId());
    }
    
    @Override
    public Optional<TradeStateSnapshot> findCurrent(String tradeId) {
        return currentStateRepository.findById(tradeId)
                .flatMap(current -> snapshotRepository.findById(current.getCurrentSnapshotId()))
                .map(this::toDomain);
    }
    
    @Override
    public Optional<TradeStateSnapshot> findCurrentForUpdate(String tradeId) {
        return currentStateRepository.findForUpdate(tradeId)
                .flatMap(current -> snapshotRepository.findById(current.getCurrentSnapshotId()))
                .map(this::toDomain);
    }
    
    @Override
    public Optional<TradeStateSnapshot> findSnapshot(String snapshotId) {
        return snapshotRepository.findById(snapshotId).map(this::toDomain);
    }
    
    @Override
    public List<TradeStateSnapshot> findSnapshots(String tradeId) {
        return snapshotRepository.findByTradeIdOrderBySequenceAsc(tradeId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    public void advance(TradeStateSnapshot snapshot, StateTransition transition) {
        TradeCurrentStateEntity current = currentStateRepository.findForUpdate(snapshot.getTradeId())
                .orElseThrow(() -> new IllegalStateException("No current state for trade " + snapshot.getTradeId()));
        if (!current.getCurrentSnapshotId().equals(snapshot.getPreviousSnapshotId())) {
            throw new IllegalStateException("Snapshot " + snapshot.getSnapshotId()
                    + " does not extend current snapshot " + current.getCurrentSnapshotId());
        }
        snapshotRepository.save(toEntity(snapshot));
        transitionRepository.save(toEntity(transition));
        current.setCurrentSnapshotId(snapshot.getSnapshotId());
        currentStateRepository.save(current);
    }
    
    @Override
    public List<StateTransition> findTransitions(String tradeId) {
        return transitionRepository.findByTradeIdOrderBySequenceAsc(tradeId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }
    
    @Override
    public Optional<Instant> findCreationTime(String tradeId) {
        return currentStateRepository.findById(tradeId).map(TradeCurrentStateEntity::getCreatedAt);
    }
    
    private TradeSnapshotEntity toEntity(TradeStateSnapshot snapshot) {
        return TradeSnapshotEntity.builder()
                .snapshotId(snapshot.getSnapshotId())
                .tradeId(snapshot.getTradeId())
                .sequence(snapshot.getSequence())
                .state(snapshot.getState())
                .productType(snapshot.getProductType())
                .timestamp(snapshot.getTimestamp())
                .causingEventId(snapshot.getCausingEventId())
                .previousSnapshotId(snapshot.getPreviousSnapshotId())
                .partiesJson(payloadMapper.write(snapshot.getParties()))
                .effectiveDate(snapshot.getEffectiveDate())
                .maturityDate(snapshot.getMaturityDate())
                .build();
    }
    
    private TradeStateSnapshot toDomain(TradeSnapshotEntity entity) {
        return TradeStateSnapshot.builder()
                .snapshotId(entity.getSnapshotId())
                .tradeId(entity.getTradeId())
                .sequence(entity.getSequence())
                .state(entity.getState())
                .productType(entity.getProductType())
                .timestamp(entity.getTimestamp())
                .causingEventId(entity.getCausingEventId())
                .previousSnapshotId(entity.getPreviousSnapshotId())
                .parties(payloadMapper.readStrings(entity.getPartiesJson()))
                .effectiveDate(entity.getEffectiveDate())
                .maturityDate(entity.getMaturityDate())
                .build();
    }
    
    private StateTransitionEntity toEntity(StateTransition transition) {
        return StateTransitionEntity.builder()
                .transitionId(transition.getTransitionId())
                .tradeId(transition.getTradeId())
                .sequence(transition.getSequence())
                .fromState(transition.getFromState())
                .toState(transition.getToState())
                .eventId(transition.getEventId())
                .timestamp(transition.getTimestamp())
                .initiator(transition.getInitiator())
                .valid(transition.isValid())
                .build();
    }
    
    private StateTransition toDomain(StateTransitionEntity entity) {
        return StateTransition.builder()
                .transitionId(entity.getTransitionId())
                .tradeId(entity.getTradeId())
                .sequence(entity.getSequence())
                .fromState(entity.getFromState())
                .toState(entity.getToState())
                .eventId(entity.getEventId())
                .timestamp(entity.getTimestamp())
                .initiator(entity.getInitiator())
                .valid(entity.isValid())
                .build();
    }
}
