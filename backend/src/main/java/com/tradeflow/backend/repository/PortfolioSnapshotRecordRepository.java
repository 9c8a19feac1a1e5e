package com.tradeflow.backend.repository;

import com.tradeflow.backend.entity.PortfolioSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PortfolioSnapshotRecordRepository extends JpaRepository<PortfolioSnapshotRecord, Long> {
}
