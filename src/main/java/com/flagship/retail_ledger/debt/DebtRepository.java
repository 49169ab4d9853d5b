package com.flagship.retail_ledger.debt;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DebtRepository extends JpaRepository<DebtEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT d FROM DebtEntity d WHERE d.id = :id")
    Optional<DebtEntity> findByIdForUpdate(@Param("id") UUID id);

    List<DebtEntity> findByKindOrderByDueDateAscCreatedAtAsc(DebtKind kind);

    @Query("SELECT d FROM DebtEntity d WHERE d.kind = :kind AND d.amountPaid < d.amount "
        + "ORDER BY d.dueDate ASC, d.createdAt ASC")
    List<DebtEntity> findPending(@Param("kind") DebtKind kind);
}
