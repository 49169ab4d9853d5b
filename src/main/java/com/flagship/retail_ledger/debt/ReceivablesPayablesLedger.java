package com.flagship.retail_ledger.debt;

import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.error.ConcurrencyConflictException;
import com.flagship.retail_ledger.error.NotFoundException;
import com.flagship.retail_ledger.error.ValidationException;
import com.flagship.retail_ledger.observability.CorrelationContext;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Receivables (owed to the business) and payables (owed by it), paid
 * incrementally.
 *
 * A payment may name a balance account: collecting a receivable credits it,
 * paying a payable debits it under the usual funds rule. The debt row is
 * locked before the account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceivablesPayablesLedger {

    private final DebtRepository debtRepository;
    private final BalanceAccountStore accountStore;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public Debt create(DebtKind kind, String description, String counterparty, BigDecimal amount,
                       LocalDate invoiceDate, LocalDate dueDate) {
        if (kind == null) {
            throw new ValidationException("kind", "Debt kind is required");
        }
        if (description == null || description.isBlank()) {
            throw new ValidationException("description", "Description is required");
        }
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        LocalDate invoiced = invoiceDate == null ? today() : invoiceDate;
        if (dueDate != null && dueDate.isBefore(invoiced)) {
            throw new ValidationException("due_date", "Due date cannot be before the invoice date");
        }

        Debt debt = Debt.create(UUID.randomUUID(), kind, description.trim(),
            counterparty == null || counterparty.isBlank() ? null : counterparty.trim(),
            value, invoiced, dueDate);
        Debt saved = debtRepository.save(DebtEntity.fromDomain(debt)).toDomain();
        log.info("Created {}: id={}, amount={}, dueDate={}", kind.getValue(), saved.getId(), value, dueDate);
        return saved;
    }

    /**
     * @throws NotFoundException if no debt of that kind has the id
     */
    @Transactional(readOnly = true)
    public Debt get(DebtKind kind, UUID id) {
        return debtRepository.findById(id)
            .filter(entity -> entity.getKind() == kind)
            .map(DebtEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(resource(kind), id));
    }

    @Transactional(readOnly = true)
    public List<Debt> list(DebtKind kind, boolean pendingOnly, boolean overdueOnly) {
        List<DebtEntity> entities = pendingOnly || overdueOnly
            ? debtRepository.findPending(kind)
            : debtRepository.findByKindOrderByDueDateAscCreatedAtAsc(kind);
        LocalDate today = today();
        return entities.stream()
            .map(DebtEntity::toDomain)
            .filter(debt -> !overdueOnly || debt.isOverdue(today))
            .toList();
    }

    /**
     * Records a (partial) payment of a debt.
     *
     * @param accountId optional account the money moved through
     * @throws ValidationException if the amount is not positive or exceeds the balance
     */
    @Transactional
    public DebtPaymentResult recordPayment(DebtKind kind, UUID id, BigDecimal amount, PaymentMethod method,
                                           UUID accountId) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.DEBT_ID_MDC_KEY, String.valueOf(id));
        try {
            BigDecimal value = Amounts.requirePositive(amount, "amount");
            DebtEntity entity = lock(kind, id);
            Debt debt = entity.toDomain();
            if (value.compareTo(debt.getBalance()) > 0) {
                throw new ValidationException("amount", String.format(
                    "Payment of %s exceeds the outstanding balance %s",
                    value.toPlainString(), debt.getBalance().toPlainString()));
            }

            BalanceAccount account = null;
            if (accountId != null) {
                String reference = (kind == DebtKind.RECEIVABLE ? "RCV-" : "PAY-") + id;
                String text = (kind == DebtKind.RECEIVABLE ? "Collected receivable: " : "Paid payable: ")
                    + debt.getDescription();
                account = kind == DebtKind.RECEIVABLE
                    ? accountStore.credit(accountId, value, text, reference)
                    : accountStore.debit(accountId, value, text, reference);
            }

            Debt paid = debt.applyPayment(value, Instant.now(clock));
            entity.updateFromDomain(paid);
            Debt saved = debtRepository.save(entity).toDomain();

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordDebtPayment(kind.getValue());
            ledgerMetrics.recordLatency("debt_payment", duration);
            log.info("{} payment recorded: amount={}, method={}, account={}, balance={}, duration={}ms",
                    kind.getValue(), value, method == null ? null : method.getValue(), accountId,
                    saved.getBalance(), duration);
            return new DebtPaymentResult(saved, account);
        } finally {
            MDC.remove(CorrelationContext.DEBT_ID_MDC_KEY);
        }
    }

    public boolean isOverdue(Debt debt) {
        return debt.isOverdue(today());
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    private DebtEntity lock(DebtKind kind, UUID id) {
        try {
            DebtEntity entity = debtRepository.findByIdForUpdate(id)
                .filter(found -> found.getKind() == kind)
                .orElseThrow(() -> new NotFoundException(resource(kind), id));
            entityManager.refresh(entity);
            return entity;
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(kind.getValue(), id, e);
        }
    }

    private static String resource(DebtKind kind) {
        return kind == DebtKind.RECEIVABLE ? "Receivable" : "Payable";
    }
}
