package com.bank.tlm.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row per trade pointing at its current snapshot. Writers lock this row.
 */
@Entity
@Table(name = "trade_current_state")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeCurrentStateEntity {

    @Id
    @Column(name = "trade_id")
    private String tradeId;

    @Column(name = "current_snapshot_id", nullable = false, length = 36)
    private String currentSnapshotId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
