package com.flagship.retail_ledger.expense;

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
public interface ExpenseRepository extends JpaRepository<ExpenseEntity, UUID> {

    /**
     * Loads an expense with a row lock. Payments and adjustments of the same
     * expense serialize here, before any account is locked.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM ExpenseEntity e WHERE e.id = :id")
    Optional<ExpenseEntity> findByIdForUpdate(@Param("id") UUID id);

    List<ExpenseEntity> findAllByOrderByExpenseDateDescCreatedAtDesc();

    @Query("SELECT e FROM ExpenseEntity e WHERE e.amountPaid = 0 ORDER BY e.expenseDate DESC, e.createdAt DESC")
    List<ExpenseEntity> findPending();

    @Query("SELECT e FROM ExpenseEntity e WHERE e.amountPaid > 0 AND e.amountPaid < e.amount "
        + "ORDER BY e.expenseDate DESC, e.createdAt DESC")
    List<ExpenseEntity> findPartiallyPaid();

    @Query("SELECT e FROM ExpenseEntity e WHERE e.amountPaid >= e.amount ORDER BY e.expenseDate DESC, e.createdAt DESC")
    List<ExpenseEntity> findPaid();
}
