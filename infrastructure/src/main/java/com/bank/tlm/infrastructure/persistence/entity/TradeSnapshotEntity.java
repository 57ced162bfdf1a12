package com.bank.tlm.infrastructure.persistence.entity;

import com.bank.tlm.domain.enums.ProductType;
import com.bank.tlm.domain.enums.TradeState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Immutable snapshot row; inserted once, never updated
 */
@Entity
@Table(name = "trade_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSnapshotEntity {

    @Id
    @Column(name = "snapshot_id", length = 36)
    private String snapshotId;

    @Column(name = "trade_id", nullable = false, updatable = false)
    private String tradeId;

    @Column(name = "sequence", nullable = false, updatable = false)
    private int sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, updatable = false, length = 20)
    private TradeState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "product_type", nullable = false, updatable = false, length = 20)
    private ProductType productType;

    @Column(name = "snapshot_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "causing_event_id", updatable = false)
    private String causingEventId;

    @Column(name = "previous_snapshot_id", length = 36, updatable = false)
    private String previousSnapshotId;

    @Column(name = "parties_json", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String partiesJson;

    @Column(name = "effective_date", nullable = false, updatable = false)
    private LocalDate effectiveDate;

    @Column(name = "maturity_date", nullable = false, updatable = false)
    private LocalDate maturityDate;
}
