package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.error.ConcurrencyConflictException;
import com.flagship.retail_ledger.error.InsufficientFundsException;
import com.flagship.retail_ledger.error.NeedsFallbackConfirmationException;
import com.flagship.retail_ledger.error.NotFoundException;
import com.flagship.retail_ledger.error.ValidationException;
import com.flagship.retail_ledger.fallback.CashFallbackResolver;
import com.flagship.retail_ledger.fallback.FallbackCheck;
import com.flagship.retail_ledger.observability.CorrelationContext;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the expense lifecycle and its payment state machine.
 *
 * Key principles:
 * - A payment is one transaction: expense update, account debit, allocation
 *   and journal entry commit together or not at all
 * - The expense row is locked before any account, accounts in id order
 * - A short cash account never silently switches to its fallback: the caller
 *   must resend the payment with {@code useFallback}
 * - Paid expenses are only changed through the adjustment engine
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExpenseLedger {

    private final ExpensePersistenceService persistenceService;
    private final BalanceAccountStore accountStore;
    private final CashFallbackResolver fallbackResolver;
    private final LedgerMetrics ledgerMetrics;

    @Transactional
    public Expense createExpense(ExpenseCategory category, String description, BigDecimal amount,
                                 LocalDate expenseDate, LocalDate dueDate, String vendor) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        requireText(description, "description");
        Expense expense = Expense.create(
            UUID.randomUUID(),
            category == null ? ExpenseCategory.OTHER : category,
            description.trim(),
            value,
            expenseDate == null ? LocalDate.now() : expenseDate,
            dueDate,
            vendor == null || vendor.isBlank() ? null : vendor.trim()
        );
        Expense saved = persistenceService.save(expense);
        log.info("Created expense: id={}, category={}, amount={}", saved.getId(), saved.getCategory().getValue(), value);
        return saved;
    }

    @Transactional(readOnly = true)
    public Expense getExpense(UUID expenseId) {
        return persistenceService.findById(expenseId)
            .orElseThrow(() -> new NotFoundException("Expense", expenseId));
    }

    /**
     * @param status filter, or null for every expense
     */
    @Transactional(readOnly = true)
    public List<Expense> listExpenses(ExpenseStatus status) {
        return persistenceService.findByStatus(status);
    }

    /**
     * Edits the details of an expense. Null arguments keep the current value.
     * The amount can only change while nothing has been paid; afterwards it is
     * corrected through an audited adjustment.
     */
    @Transactional
    public Expense updateExpense(UUID expenseId, ExpenseCategory category, String description, BigDecimal amount,
                                 LocalDate expenseDate, LocalDate dueDate, String vendor) {
        Expense expense = persistenceService.lock(expenseId);
        BigDecimal newAmount = amount == null ? expense.getAmount() : Amounts.requirePositive(amount, "amount");
        if (newAmount.compareTo(expense.getAmount()) != 0 && expense.getAmountPaid().signum() > 0) {
            throw new ValidationException("amount", String.format(
                "Expense is %s; use an adjustment to change its amount", expense.getStatus().getValue()));
        }
        if (description != null) {
            requireText(description, "description");
        }

        Expense updated = expense.withDetails(
            category == null ? expense.getCategory() : category,
            description == null ? expense.getDescription() : description.trim(),
            newAmount,
            expenseDate == null ? expense.getExpenseDate() : expenseDate,
            dueDate == null ? expense.getDueDate() : dueDate,
            vendor == null ? expense.getVendor() : vendor.trim()
        );
        log.info("Updated expense {}", expenseId);
        return persistenceService.update(updated);
    }

    /**
     * Pays (part of) an expense from an account.
     *
     * @param useFallback the caller confirmed paying from the configured fallback of {@code accountId}
     * @param fallbackAccountId optional; when given it must be the configured fallback
     * @throws ValidationException for a non-positive amount, more than two decimals or more than the balance
     * @throws NeedsFallbackConfirmationException if the cash account is short but its fallback is not
     * @throws InsufficientFundsException if no candidate account can cover the amount
     */
    @Transactional
    public ExpensePaymentResult payExpense(UUID expenseId, BigDecimal amount, UUID accountId, PaymentMethod method,
                                           boolean useFallback, UUID fallbackAccountId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.EXPENSE_ID_MDC_KEY, String.valueOf(expenseId));
        try {
            BigDecimal value = Amounts.requirePositive(amount, "amount");
            if (accountId == null) {
                throw new ValidationException("account_id", "Account id is required");
            }

            Expense expense = persistenceService.lock(expenseId);
            if (value.compareTo(expense.getBalance()) > 0) {
                throw new ValidationException("amount", String.format(
                    "Payment of %s exceeds the outstanding balance %s",
                    value.toPlainString(), expense.getBalance().toPlainString()));
            }

            BalanceAccount requested = accountStore.getAccount(accountId);
            Optional<BalanceAccount> fallback = fallbackResolver.fallbackFor(accountId);
            List<UUID> candidates = new ArrayList<>();
            candidates.add(accountId);
            fallback.ifPresent(account -> candidates.add(account.getId()));
            accountStore.lockAccounts(candidates);

            UUID target = useFallback
                ? resolveFallbackTarget(requested, fallback, fallbackAccountId)
                : checkSource(requested, value);

            BalanceAccount debited = accountStore.debit(target, value,
                "Expense payment: " + expense.getDescription(), reference(expenseId));
            PaymentMethod paymentMethod = method == null ? PaymentMethod.defaultFor(debited.getKind()) : method;
            Instant now = Instant.now();

            Expense paid = persistenceService.update(expense.applyPayment(value, target, paymentMethod, now));
            ExpensePayment allocation = persistenceService.recordAllocation(expenseId, target, value, paymentMethod, now);

            boolean fallbackUsed = !target.equals(accountId);
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordExpensePayment("success", fallbackUsed);
            ledgerMetrics.recordLatency("pay_expense", duration);
            log.info("Expense payment recorded: amount={}, account={}, status={}, balance={}, fallbackUsed={}, duration={}ms",
                    value, debited.getCode(), paid.getStatus().getValue(), paid.getBalance(), fallbackUsed, duration);

            return new ExpensePaymentResult(paid, allocation, debited, fallbackUsed);

        } catch (NeedsFallbackConfirmationException e) {
            ledgerMetrics.recordExpensePayment("needs_fallback", false);
            log.info("Expense payment needs fallback confirmation: {}", e.getMessage());
            throw e;
        } catch (InsufficientFundsException e) {
            ledgerMetrics.recordExpensePayment("insufficient_funds", useFallback);
            log.warn("Expense payment rejected: {}", e.getMessage());
            throw e;
        } catch (ValidationException | NotFoundException e) {
            ledgerMetrics.recordExpensePayment("invalid", useFallback);
            log.warn("Expense payment rejected: {}", e.getMessage());
            throw e;
        } catch (ConcurrencyConflictException e) {
            ledgerMetrics.recordExpensePayment("conflict", useFallback);
            log.warn("Expense payment conflict: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerMetrics.recordExpensePayment("error", useFallback);
            log.error("Expense payment failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.EXPENSE_ID_MDC_KEY);
        }
    }

    /**
     * Pays from {@code accountId} with the method its kind implies.
     */
    @Transactional
    public ExpensePaymentResult payExpense(UUID expenseId, BigDecimal amount, UUID accountId, boolean useFallback) {
        return payExpense(expenseId, amount, accountId, null, useFallback, null);
    }

    @Transactional(readOnly = true)
    public List<ExpensePayment> getPayments(UUID expenseId) {
        getExpense(expenseId);
        return persistenceService.activeAllocations(expenseId);
    }

    private UUID checkSource(BalanceAccount source, BigDecimal amount) {
        if (!source.getKind().isCash()) {
            return source.getId();
        }
        FallbackCheck check = fallbackResolver.check(amount, source.getId());
        if (check.isCanPay()) {
            return source.getId();
        }
        if (check.requiresConfirmation()) {
            throw new NeedsFallbackConfirmationException(source.getId(), check.getSourceBalance(),
                check.getFallbackAccountId(), check.getFallbackBalance(), amount);
        }
        throw new InsufficientFundsException(source.getId(), source.getName(), check.getSourceBalance(), amount,
            check.getFallbackAccountId(), check.getFallbackBalance());
    }

    private UUID resolveFallbackTarget(BalanceAccount requested, Optional<BalanceAccount> fallback,
                                       UUID fallbackAccountId) {
        UUID target;
        if (fallback.isPresent()) {
            target = fallback.get().getId();
        } else if (fallbackResolver.isFallbackTarget(requested)) {
            target = requested.getId();
        } else {
            throw new ValidationException("use_fallback",
                "Account " + requested.getCode() + " has no configured fallback account");
        }
        if (fallbackAccountId != null && !fallbackAccountId.equals(target)) {
            throw new ValidationException("fallback_account_id",
                "Account " + fallbackAccountId + " is not the configured fallback of " + requested.getCode());
        }
        return target;
    }

    private static String reference(UUID expenseId) {
        return "EXP-" + expenseId;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, field + " is required");
        }
    }
}
