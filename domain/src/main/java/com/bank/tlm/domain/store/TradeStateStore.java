package com.bank.tlm.domain.store;

import com.bank.tlm.domain.model.StateTransition;
import com.bank.tlm.domain.model.TradeStateSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for trade snapshots, the per-trade current-snapshot pointer and the transition log.
 * Snapshots and transitions are append-only.
 */
public interface TradeStateStore {

    boolean existsTrade(String tradeId);

    /**
     * Store the creation snapshot and point the trade's current state at it
     */
    void createTrade(TradeStateSnapshot initialSnapshot);

    Optional<TradeStateSnapshot> findCurrent(String tradeId);

    /**
     * Same as {@link #findCurrent(String)} but holds the trade's current-state row
     * for the remainder of the enclosing transaction
     */
    Optional<TradeStateSnapshot> findCurrentForUpdate(String tradeId);

    Optional<TradeStateSnapshot> findSnapshot(String snapshotId);

    /**
     * All snapshots of a trade ordered by sequence
     */
    List<TradeStateSnapshot> findSnapshots(String tradeId);

    /**
     * Append a snapshot and advance the current pointer to it
     */
    void advance(TradeStateSnapshot snapshot, StateTransition transition);

    List<StateTransition> findTransitions(String tradeId);

    Optional<Instant> findCreationTime(String tradeId);
}
