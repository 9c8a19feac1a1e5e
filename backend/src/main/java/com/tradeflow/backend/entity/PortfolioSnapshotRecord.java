package com.tradeflow.backend.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Single row, upserted on every portfolio change.
 */
@Entity
@Table(name = "portfolio_snapshots")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioSnapshotRecord {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "total_capital", precision = 20, scale = 8, nullable = false)
    private BigDecimal totalCapital;

    @Column(name = "available_capital", precision = 20, scale = 8, nullable = false)
    private BigDecimal availableCapital;

    @Column(name = "daily_realized_pnl", precision = 20, scale = 8, nullable = false)
    private BigDecimal dailyRealizedPnl;

    @Column(name = "trading_day")
    private LocalDate tradingDay;

    @Column(name = "snapshot_version", nullable = false)
    private Long snapshotVersion;

    @Column(name = "positions", columnDefinition = "TEXT")
    private String positions;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
