package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.error.ConcurrencyConflictException;
import com.flagship.retail_ledger.error.NotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for expense persistence operations.
 *
 * Bridges the domain layer (Expense, ExpensePayment) and the JPA entities.
 * Used by the expense ledger for payments and by the adjustment engine for
 * corrections, so both lock and update expenses the same way.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpensePersistenceService {

    private static final String RESOURCE = "Expense";

    private final ExpenseRepository expenseRepository;
    private final ExpensePaymentRepository paymentRepository;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public Expense save(Expense expense) {
        ExpenseEntity saved = expenseRepository.save(ExpenseEntity.fromDomain(expense));
        log.debug("Saved expense {}", saved.getId());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Expense> findById(UUID expenseId) {
        return expenseRepository.findById(expenseId).map(ExpenseEntity::toDomain);
    }

    /**
     * Finds expenses by status, most recent first. A null status returns all.
     */
    @Transactional(readOnly = true)
    public List<Expense> findByStatus(ExpenseStatus status) {
        List<ExpenseEntity> entities;
        if (status == null) {
            entities = expenseRepository.findAllByOrderByExpenseDateDescCreatedAtDesc();
        } else {
            switch (status) {
                case PENDING:
                    entities = expenseRepository.findPending();
                    break;
                case PARTIALLY_PAID:
                    entities = expenseRepository.findPartiallyPaid();
                    break;
                default:
                    entities = expenseRepository.findPaid();
                    break;
            }
        }
        return entities.stream().map(ExpenseEntity::toDomain).toList();
    }

    /**
     * Locks the expense row for the rest of the surrounding transaction and
     * returns its current state.
     *
     * @throws NotFoundException if the expense does not exist
     * @throws ConcurrencyConflictException if the lock cannot be acquired in time
     */
    @Transactional
    public Expense lock(UUID expenseId) {
        try {
            ExpenseEntity entity = expenseRepository.findByIdForUpdate(expenseId)
                .orElseThrow(() -> new NotFoundException(RESOURCE, expenseId));
            entityManager.refresh(entity);
            return entity.toDomain();
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("expense", expenseId, e);
        }
    }

    /**
     * Updates an expense through the controlled update method (no setters).
     * Timestamps are handled by the @PreUpdate lifecycle hook.
     */
    @Transactional
    public Expense update(Expense expense) {
        ExpenseEntity existing = expenseRepository.findById(expense.getId())
            .orElseThrow(() -> new NotFoundException(RESOURCE, expense.getId()));
        existing.updateFromDomain(expense);
        ExpenseEntity updated = expenseRepository.save(existing);
        log.debug("Updated expense {}: amount={}, amountPaid={}, status={}",
                updated.getId(), expense.getAmount(), expense.getAmountPaid(), expense.getStatus());
        return updated.toDomain();
    }

    @Transactional
    public ExpensePayment recordAllocation(UUID expenseId, UUID accountId, BigDecimal amount,
                                           PaymentMethod method, Instant paidAt) {
        ExpensePaymentEntity saved = paymentRepository.save(
            ExpensePaymentEntity.allocate(expenseId, accountId, amount, method, paidAt));
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<ExpensePayment> activeAllocations(UUID expenseId) {
        return paymentRepository.findByExpenseIdAndActiveTrueOrderByIdAsc(expenseId).stream()
            .map(ExpensePaymentEntity::toDomain)
            .toList();
    }

    @Transactional
    public void deactivateAllocations(Collection<ExpensePayment> allocations) {
        for (ExpensePayment allocation : allocations) {
            ExpensePaymentEntity entity = paymentRepository.findById(allocation.getId())
                .orElseThrow(() -> new IllegalStateException("Allocation not found: " + allocation.getId()));
            entity.deactivate();
            paymentRepository.save(entity);
        }
    }
}
