package com.flagship.retail_ledger.expense;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ExpensePaymentRepository extends JpaRepository<ExpensePaymentEntity, Long> {

    List<ExpensePaymentEntity> findByExpenseIdAndActiveTrueOrderByIdAsc(UUID expenseId);
}
