package com.flagship.retail_ledger.adjustment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AdjustmentRecordRepository extends JpaRepository<AdjustmentRecordEntity, Long> {

    List<AdjustmentRecordEntity> findByExpenseIdOrderByIdAsc(UUID expenseId);

    List<AdjustmentRecordEntity> findByAdjustedAtGreaterThanEqualAndAdjustedAtLessThanOrderByIdAsc(
        Instant from, Instant to);

    List<AdjustmentRecordEntity> findByReasonAndAdjustedAtGreaterThanEqualAndAdjustedAtLessThanOrderByIdAsc(
        AdjustmentReason reason, Instant from, Instant to);
}
