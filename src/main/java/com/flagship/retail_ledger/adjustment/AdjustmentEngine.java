package com.flagship.retail_ledger.adjustment;

import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.error.NoChangeRequestedException;
import com.flagship.retail_ledger.error.NotFoundException;
import com.flagship.retail_ledger.error.ValidationException;
import com.flagship.retail_ledger.expense.Expense;
import com.flagship.retail_ledger.expense.ExpensePayment;
import com.flagship.retail_ledger.expense.ExpensePersistenceService;
import com.flagship.retail_ledger.observability.CorrelationContext;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Corrects, reverts and partially refunds paid expenses.
 *
 * Every operation is one transaction that moves the money, updates the
 * expense and appends exactly one {@link AdjustmentRecord}. Money always
 * goes back to the account it came from, following the expense's active
 * payment allocations.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdjustmentEngine {

    // adjustment_records.description
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final ExpensePersistenceService expenses;
    private final BalanceAccountStore accountStore;
    private final AdjustmentRecordRepository recordRepository;
    private final LedgerProperties properties;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    /**
     * Corrects the amount and/or the paying account of an expense that has
     * payments. The reason is normalized from what actually changes.
     *
     * @param newAmount new expense amount, or null to keep it
     * @param newAccountId account that should have paid, or null to keep it
     * @throws NoChangeRequestedException if neither the amount nor the account changes
     */
    @Transactional
    public AdjustmentResult adjust(UUID expenseId, BigDecimal newAmount, UUID newAccountId,
                                   AdjustmentReason reason, String description, String adjustedBy) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, String.valueOf(expenseId));
        try {
            String text = requireDescription(description);
            if (reason == AdjustmentReason.ERROR_REVERSAL) {
                throw new ValidationException("reason", "Use a reversal to undo a payment");
            }
            if (reason == AdjustmentReason.PARTIAL_REFUND) {
                throw new ValidationException("reason", "Use a refund to return part of a payment");
            }
            BigDecimal amount = newAmount == null ? null : Amounts.requirePositive(newAmount, "new_amount");

            Expense expense = expenses.lock(expenseId);
            requirePayments(expense);
            List<ExpensePayment> allocations = expenses.activeAllocations(expenseId);
            UUID currentAccount = currentAccount(expense, allocations);

            boolean amountChanging = amount != null && amount.compareTo(expense.getAmount()) != 0;
            boolean accountChanging = newAccountId != null
                && allocations.stream().anyMatch(allocation -> !allocation.getAccountId().equals(newAccountId));
            if (!amountChanging && !accountChanging) {
                throw new NoChangeRequestedException(expenseId);
            }
            AdjustmentReason normalized = amountChanging && accountChanging
                ? AdjustmentReason.BOTH_CORRECTION
                : accountChanging ? AdjustmentReason.ACCOUNT_CORRECTION : AdjustmentReason.AMOUNT_CORRECTION;
            if (reason != null && reason != normalized) {
                log.debug("Adjustment reason {} normalized to {}", reason.getValue(), normalized.getValue());
            }

            BigDecimal finalAmount = amountChanging ? amount : expense.getAmount();
            BigDecimal newPaid;
            if (!amountChanging) {
                newPaid = expense.getAmountPaid();
            } else if (expense.isPaid()) {
                newPaid = finalAmount;
            } else {
                newPaid = expense.getAmountPaid().min(finalAmount);
            }

            List<UUID> touched = new ArrayList<>(allocations.stream().map(ExpensePayment::getAccountId).toList());
            touched.add(newAccountId);
            accountStore.lockAccounts(touched);

            String reference = "ADJ-" + expenseId;
            String entryText = "Expense adjustment: " + expense.getDescription();
            Instant now = Instant.now(clock);
            UUID settlingAccount;
            PaymentMethod settlingMethod;

            if (accountChanging) {
                creditBack(allocations, entryText, reference);
                expenses.deactivateAllocations(allocations);
                BalanceAccount target = accountStore.debit(newAccountId, newPaid, entryText, reference);
                settlingMethod = PaymentMethod.defaultFor(target.getKind());
                expenses.recordAllocation(expenseId, newAccountId, newPaid, settlingMethod, now);
                settlingAccount = newAccountId;
            } else {
                BigDecimal delta = newPaid.subtract(expense.getAmountPaid());
                if (delta.signum() > 0) {
                    accountStore.debit(currentAccount, delta, entryText, reference);
                    expenses.recordAllocation(expenseId, currentAccount, delta,
                        methodOf(expense, allocations), now);
                } else if (delta.signum() < 0) {
                    returnFunds(allocations, delta.negate(), entryText, reference);
                }
                settlingAccount = expense.getPaymentAccountId() != null
                    ? expense.getPaymentAccountId()
                    : lastAccount(allocations);
                settlingMethod = methodOf(expense, allocations);
            }

            Expense updated = expenses.update(
                expense.corrected(finalAmount, newPaid, settlingAccount, settlingMethod, now));

            AdjustmentRecord record = append(AdjustmentRecord.builder()
                .expenseId(expenseId)
                .reason(normalized)
                .previousAmount(expense.getAmount())
                .newAmount(finalAmount)
                .adjustmentDelta(finalAmount.subtract(expense.getAmount()))
                .previousAmountPaid(expense.getAmountPaid())
                .newAmountPaid(newPaid)
                .previousAccountId(currentAccount)
                .newAccountId(accountChanging ? newAccountId : currentAccount)
                .description(text)
                .adjustedBy(adjustedBy)
                .adjustedAt(now)
                .build());

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordLatency("adjust_expense", duration);
            log.info("Expense adjusted: reason={}, amount {} -> {}, paid {} -> {}, duration={}ms",
                    normalized.getValue(), expense.getAmount(), finalAmount, expense.getAmountPaid(), newPaid, duration);
            return new AdjustmentResult(updated, record);
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * Undoes every payment of an expense: each allocation is credited back to
     * its account and the expense returns to pending.
     */
    @Transactional
    public AdjustmentResult revert(UUID expenseId, String description, String adjustedBy) {
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, String.valueOf(expenseId));
        try {
            String text = requireDescription(description);
            Expense expense = expenses.lock(expenseId);
            requirePayments(expense);
            List<ExpensePayment> allocations = expenses.activeAllocations(expenseId);
            UUID currentAccount = currentAccount(expense, allocations);

            accountStore.lockAccounts(allocations.stream().map(ExpensePayment::getAccountId).toList());
            creditBack(allocations, "Expense reversal: " + expense.getDescription(), "REV-" + expenseId);
            expenses.deactivateAllocations(allocations);

            Expense reverted = expenses.update(expense.reverted());
            AdjustmentRecord record = append(AdjustmentRecord.builder()
                .expenseId(expenseId)
                .reason(AdjustmentReason.ERROR_REVERSAL)
                .previousAmount(expense.getAmount())
                .newAmount(Amounts.zero())
                .adjustmentDelta(expense.getAmountPaid().negate())
                .previousAmountPaid(expense.getAmountPaid())
                .newAmountPaid(Amounts.zero())
                .previousAccountId(currentAccount)
                .newAccountId(null)
                .description(text)
                .adjustedBy(adjustedBy)
                .adjustedAt(Instant.now(clock))
                .build());

            log.info("Expense reverted: returned={} to {} account(s)", expense.getAmountPaid(),
                    allocations.stream().map(ExpensePayment::getAccountId).distinct().count());
            return new AdjustmentResult(reverted, record);
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * Returns part of what was paid, most recent payment first. On a paid
     * expense the cost drops by the same amount so it stays paid; a refund of
     * everything paid is a reversal.
     */
    @Transactional
    public AdjustmentResult refund(UUID expenseId, BigDecimal amount, String description, String adjustedBy) {
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, String.valueOf(expenseId));
        try {
            String text = requireDescription(description);
            BigDecimal value = Amounts.requirePositive(amount, "amount");
            Expense expense = expenses.lock(expenseId);
            requirePayments(expense);
            if (value.compareTo(expense.getAmountPaid()) > 0) {
                throw new ValidationException("amount", String.format(
                    "Refund of %s exceeds the amount paid %s",
                    value.toPlainString(), expense.getAmountPaid().toPlainString()));
            }
            if (expense.isPaid() && value.compareTo(expense.getAmountPaid()) == 0) {
                throw new ValidationException("amount", "Refunding everything paid is a reversal; use revert");
            }

            List<ExpensePayment> allocations = expenses.activeAllocations(expenseId);
            UUID currentAccount = currentAccount(expense, allocations);
            accountStore.lockAccounts(allocations.stream().map(ExpensePayment::getAccountId).toList());
            returnFunds(allocations, value, "Expense refund: " + expense.getDescription(), "RFD-" + expenseId);

            BigDecimal newPaid = expense.getAmountPaid().subtract(value);
            BigDecimal newAmount = expense.isPaid() ? expense.getAmount().subtract(value) : expense.getAmount();
            Instant now = Instant.now(clock);
            Expense updated = expenses.update(expense.corrected(newAmount, newPaid,
                expense.getPaymentAccountId(), expense.getPaymentMethod(), now));

            AdjustmentRecord record = append(AdjustmentRecord.builder()
                .expenseId(expenseId)
                .reason(AdjustmentReason.PARTIAL_REFUND)
                .previousAmount(expense.getAmount())
                .newAmount(newAmount)
                .adjustmentDelta(newAmount.subtract(expense.getAmount()))
                .previousAmountPaid(expense.getAmountPaid())
                .newAmountPaid(newPaid)
                .previousAccountId(currentAccount)
                .newAccountId(currentAccount)
                .description(text)
                .adjustedBy(adjustedBy)
                .adjustedAt(now)
                .build());

            log.info("Expense refunded: amount={}, paid {} -> {}", value, expense.getAmountPaid(), newPaid);
            return new AdjustmentResult(updated, record);
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * @return the adjustment records of an expense, oldest first
     */
    @Transactional(readOnly = true)
    public List<AdjustmentRecord> getHistory(UUID expenseId) {
        if (expenses.findById(expenseId).isEmpty()) {
            throw new NotFoundException("Expense", expenseId);
        }
        return recordRepository.findByExpenseIdOrderByIdAsc(expenseId).stream()
            .map(AdjustmentRecordEntity::toDomain)
            .toList();
    }

    /**
     * Finds adjustments made between two dates, both inclusive, in the
     * ledger clock's time zone.
     */
    @Transactional(readOnly = true)
    public List<AdjustmentRecord> findAdjustments(LocalDate from, LocalDate to, AdjustmentReason reason) {
        if (from == null || to == null) {
            throw new ValidationException("from", "Both from and to dates are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("from", "from must not be after to");
        }
        Instant start = from.atStartOfDay(clock.getZone()).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(clock.getZone()).toInstant();
        List<AdjustmentRecordEntity> entities = reason == null
            ? recordRepository.findByAdjustedAtGreaterThanEqualAndAdjustedAtLessThanOrderByIdAsc(start, end)
            : recordRepository.findByReasonAndAdjustedAtGreaterThanEqualAndAdjustedAtLessThanOrderByIdAsc(
                reason, start, end);
        return entities.stream().map(AdjustmentRecordEntity::toDomain).toList();
    }

    private AdjustmentRecord append(AdjustmentRecord record) {
        AdjustmentRecord saved = recordRepository.save(AdjustmentRecordEntity.fromDomain(record)).toDomain();
        ledgerMetrics.recordAdjustment(saved.getReason().getValue());
        return saved;
    }

    /**
     * Credits every allocation back to its account, one journal entry per account.
     */
    private void creditBack(List<ExpensePayment> allocations, String description, String reference) {
        Map<UUID, BigDecimal> perAccount = new TreeMap<>();
        for (ExpensePayment allocation : allocations) {
            perAccount.merge(allocation.getAccountId(), allocation.getAmount(), BigDecimal::add);
        }
        perAccount.forEach((accountId, amount) -> accountStore.credit(accountId, amount, description, reference));
    }

    /**
     * Returns {@code amount} to the paying accounts, latest allocation first.
     * A partly consumed allocation is replaced by one for the remainder.
     */
    private void returnFunds(List<ExpensePayment> allocations, BigDecimal amount, String description,
                             String reference) {
        List<ExpensePayment> latestFirst = new ArrayList<>(allocations);
        Collections.reverse(latestFirst);
        BigDecimal remaining = amount;
        for (ExpensePayment allocation : latestFirst) {
            if (remaining.signum() == 0) {
                break;
            }
            BigDecimal take = remaining.min(allocation.getAmount());
            accountStore.credit(allocation.getAccountId(), take, description, reference);
            expenses.deactivateAllocations(List.of(allocation));
            BigDecimal rest = allocation.getAmount().subtract(take);
            if (rest.signum() > 0) {
                expenses.recordAllocation(allocation.getExpenseId(), allocation.getAccountId(), rest,
                    allocation.getMethod(), allocation.getPaidAt());
            }
            remaining = remaining.subtract(take);
        }
        if (remaining.signum() > 0) {
            throw new IllegalStateException("Payment allocations do not cover " + amount.toPlainString());
        }
    }

    private String requireDescription(String description) {
        int minimum = properties.getMinDescriptionLength();
        if (description == null || description.trim().length() < minimum) {
            throw new ValidationException("description",
                "A description of at least " + minimum + " characters is required");
        }
        if (description.trim().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description",
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description.trim();
    }

    private static void requirePayments(Expense expense) {
        if (expense.getAmountPaid().signum() == 0) {
            throw new ValidationException("expense_id",
                "Expense " + expense.getId() + " has no payments to adjust");
        }
    }

    /**
     * The account that currently holds the payment: the settling account of a
     * paid expense, or the single account behind all allocations.
     */
    private static UUID currentAccount(Expense expense, List<ExpensePayment> allocations) {
        if (expense.getPaymentAccountId() != null) {
            return expense.getPaymentAccountId();
        }
        List<UUID> accounts = allocations.stream().map(ExpensePayment::getAccountId).distinct().toList();
        return accounts.size() == 1 ? accounts.get(0) : null;
    }

    private static UUID lastAccount(List<ExpensePayment> allocations) {
        return allocations.isEmpty() ? null : allocations.get(allocations.size() - 1).getAccountId();
    }

    private static PaymentMethod methodOf(Expense expense, List<ExpensePayment> allocations) {
        if (expense.getPaymentMethod() != null) {
            return expense.getPaymentMethod();
        }
        return allocations.isEmpty() ? PaymentMethod.OTHER : allocations.get(allocations.size() - 1).getMethod();
    }
}
