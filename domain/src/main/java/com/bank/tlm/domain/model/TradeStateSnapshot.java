package com.bank.tlm.domain.model;

import com.bank.tlm.domain.enums.ProductType;
import com.bank.tlm.domain.enums.TradeState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Immutable point-in-time capture of a trade's lifecycle state.
 *
 * Snapshots of one trade form a single backward chain through {@code previousSnapshotId},
 * ending at the creation snapshot (sequence 1, no predecessor).
 */
@Value
@Builder(toBuilder = true)
public class TradeStateSnapshot {
    String snapshotId;
    String tradeId;
    int sequence;
    TradeState state;
    ProductType productType;
    Instant timestamp;
    String causingEventId;
    String previousSnapshotId;
    List<String> parties;
    LocalDate effectiveDate;
    LocalDate maturityDate;

    public boolean isCreationSnapshot() {
        return previousSnapshotId == null;
    }
}
