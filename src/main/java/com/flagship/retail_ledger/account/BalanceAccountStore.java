package com.flagship.retail_ledger.account;

import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.common.PaymentMethod;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.error.ConcurrencyConflictException;
import com.flagship.retail_ledger.error.InsufficientFundsException;
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
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Holds the balance accounts and is the only component that changes a
 * balance.
 *
 * Invariants enforced here:
 * 1. A ledger debit never drives a funds account (cash, wallet, bank) negative
 * 2. Every mutation runs under the account's row lock
 * 3. Multi-account operations lock in ascending id order (no deadlocks)
 * 4. Every mutation writes exactly one journal entry in the same transaction
 *
 * Administrative {@link #setBalance} is the only path that may leave an
 * account negative; it is journaled as BALANCE_SET with its reason.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BalanceAccountStore {

    private static final String RESOURCE = "Balance account";
    // balance_entries.description
    private static final int MAX_DESCRIPTION_LENGTH = 500;

    private final BalanceAccountRepository accountRepository;
    private final BalanceEntryRepository entryRepository;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerProperties properties;
    private final LedgerMetrics ledgerMetrics;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional
    public BalanceAccount createAccount(String code, String name, AccountKind kind, BigDecimal openingBalance) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("code", "Account code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "Account name is required");
        }
        if (kind == null) {
            throw new ValidationException("kind", "Account kind is required");
        }
        BigDecimal opening = openingBalance == null
            ? Amounts.zero()
            : Amounts.requireExact(openingBalance, "opening_balance");
        if (kind.isFunds() && opening.signum() < 0) {
            throw new ValidationException("opening_balance",
                "Opening balance of a " + kind.getValue() + " account cannot be negative");
        }
        if (accountRepository.existsByCode(code)) {
            throw new ValidationException("code", "Account code already in use: " + code);
        }

        BalanceAccount account = BalanceAccount.open(UUID.randomUUID(), code.trim(), name.trim(), kind, opening);
        BalanceAccountEntity saved = accountRepository.save(BalanceAccountEntity.fromDomain(account));
        entryRepository.save(BalanceEntryEntity.record(saved.getId(), EntryType.BALANCE_SET, opening, opening,
            "Opening balance", "OPEN-" + saved.getCode()));

        log.info("Created balance account: code={}, kind={}, openingBalance={}", code, kind, opening);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<BalanceAccount> listAccounts() {
        return accountRepository.findByActiveTrueOrderByCodeAsc().stream()
            .map(BalanceAccountEntity::toDomain)
            .toList();
    }

    /**
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public BalanceAccount getAccount(UUID accountId) {
        return accountRepository.findById(accountId)
            .map(BalanceAccountEntity::toDomain)
            .orElseThrow(() -> new NotFoundException(RESOURCE, accountId));
    }

    @Transactional(readOnly = true)
    public BalanceAccount getAccountByCode(String code) {
        return accountRepository.findByCode(code)
            .map(BalanceAccountEntity::toDomain)
            .orElseThrow(() -> new ValidationException("code", "No balance account with code " + code));
    }

    @Transactional(readOnly = true)
    public BigDecimal getBalance(UUID accountId) {
        return getAccount(accountId).getBalance();
    }

    /**
     * Acquires the row locks of several accounts in ascending id order.
     * Must run inside the caller's transaction; the locks are held until it
     * commits or rolls back.
     *
     * @return the locked accounts keyed by id, in lock order
     */
    @Transactional
    public Map<UUID, BalanceAccount> lockAccounts(Collection<UUID> accountIds) {
        Map<UUID, BalanceAccount> locked = new LinkedHashMap<>();
        accountIds.stream()
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .forEach(id -> locked.put(id, lockEntity(id).toDomain()));
        return locked;
    }

    /**
     * Subtracts an amount from an account.
     *
     * @throws InsufficientFundsException if a funds account would go negative; the balance is left unchanged
     */
    @Transactional
    public BalanceAccount debit(UUID accountId, BigDecimal amount, String description, String reference) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        BalanceAccountEntity entity = lockEntity(accountId);
        requireActive(entity);

        BalanceAccount updated;
        try {
            updated = entity.toDomain().debit(value);
        } catch (InsufficientFundsException e) {
            ledgerMetrics.recordInsufficientFunds(entity.getKind().getValue());
            log.warn("Debit rejected: account={}, balance={}, requested={}",
                    entity.getCode(), entity.getBalance(), value);
            throw e;
        }
        return apply(entity, updated, EntryType.DEBIT, value.negate(), description, reference);
    }

    @Transactional
    public BalanceAccount debit(UUID accountId, BigDecimal amount) {
        return debit(accountId, amount, "Ledger debit", null);
    }

    @Transactional
    public BalanceAccount credit(UUID accountId, BigDecimal amount, String description, String reference) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        BalanceAccountEntity entity = lockEntity(accountId);
        requireActive(entity);
        return apply(entity, entity.toDomain().credit(value), EntryType.CREDIT, value, description, reference);
    }

    @Transactional
    public BalanceAccount credit(UUID accountId, BigDecimal amount) {
        return credit(accountId, amount, "Ledger credit", null);
    }

    /**
     * Records money entering a funds account from a sale or other income.
     * Journaled as a credit with an {@code INC-} reference.
     */
    @Transactional
    public BalanceAccount recordIncome(UUID accountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        String text = requireDescription(description);
        BalanceAccountEntity entity = lockEntity(accountId);
        requireActive(entity);
        if (!entity.getKind().isFunds()) {
            throw new ValidationException("account_id",
                "Income can only be recorded on a cash, wallet or bank account, not " + entity.getKind().getValue());
        }
        String reference = "INC-" + UUID.randomUUID().toString().substring(0, 8);
        log.info("Recording income: account={}, amount={}, reference={}", entity.getCode(), value, reference);
        return apply(entity, entity.toDomain().credit(value), EntryType.CREDIT, value, text, reference);
    }

    /**
     * Records income into the account configured for its payment method.
     *
     * @throws ValidationException if the method has no income account (credit sales become receivables)
     */
    @Transactional
    public BalanceAccount recordIncome(PaymentMethod method, BigDecimal amount, String description) {
        if (method == null) {
            throw new ValidationException("payment_method", "Payment method is required");
        }
        BalanceAccount account = accountForPaymentMethod(method)
            .orElseThrow(() -> new ValidationException("payment_method",
                "Payment method " + method.getValue() + " does not move money into an account"));
        return recordIncome(account.getId(), amount, description);
    }

    @Transactional(readOnly = true)
    public Optional<BalanceAccount> accountForPaymentMethod(PaymentMethod method) {
        String code = properties.getIncome().getMethodAccounts().get(method);
        if (code == null) {
            return Optional.empty();
        }
        return accountRepository.findByCode(code)
            .filter(BalanceAccountEntity::isActive)
            .map(BalanceAccountEntity::toDomain);
    }

    /**
     * Administrative balance override. Always succeeds for valid input, even
     * when the new balance is negative, and is journaled with its reason.
     */
    @Transactional
    public BalanceAccount setBalance(UUID accountId, BigDecimal newBalance, String reason) {
        BigDecimal value = Amounts.requireExact(newBalance, "balance");
        requireReason(reason);
        BalanceAccountEntity entity = lockEntity(accountId);
        requireActive(entity);

        BigDecimal difference = value.subtract(entity.getBalance());
        log.warn("Administrative balance override: account={}, previous={}, new={}, reason={}",
                entity.getCode(), entity.getBalance(), value, reason);
        return apply(entity, entity.toDomain().withBalance(value), EntryType.BALANCE_SET, difference,
                reason.trim(), "SET-" + entity.getCode());
    }

    /**
     * Moves money between two accounts (e.g. end-of-day liquidation of petty
     * cash into vault cash). Both accounts are locked in id order; if the
     * debit fails nothing is changed.
     */
    @Transactional
    public TransferResult transfer(UUID fromAccountId, UUID toAccountId, BigDecimal amount, String description) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        if (fromAccountId == null || toAccountId == null) {
            throw new ValidationException("account_id", "Source and destination accounts are required");
        }
        if (fromAccountId.equals(toAccountId)) {
            throw new ValidationException("to_account_id", "Source and destination accounts must be different");
        }
        lockAccounts(List.of(fromAccountId, toAccountId));

        String reference = "TRF-" + UUID.randomUUID().toString().substring(0, 8);
        String text = description == null || description.isBlank() ? "Transfer between accounts" : description.trim();
        BalanceAccount from = debit(fromAccountId, value, text, reference);
        BalanceAccount to = credit(toAccountId, value, text, reference);

        log.info("Transferred {} from {} to {}: reference={}", value, from.getCode(), to.getCode(), reference);
        return new TransferResult(reference, value, from, to);
    }

    /**
     * Deactivates an account. Accounts that funded an expense stay active so
     * that reversals always have somewhere to return the money, and only an
     * empty account can be deactivated.
     */
    @Transactional
    public BalanceAccount deactivateAccount(UUID accountId) {
        BalanceAccountEntity entity = lockEntity(accountId);
        requireActive(entity);
        if (entity.getBalance().signum() != 0) {
            throw new ValidationException("account_id",
                "Account " + entity.getCode() + " still holds " + entity.getBalance().toPlainString()
                    + "; transfer or set the balance to zero before deactivating it");
        }
        Integer references = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expense_payments WHERE account_id = ? AND active = TRUE",
            Integer.class,
            accountId
        );
        Integer paidExpenses = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM expenses WHERE payment_account_id = ?",
            Integer.class,
            accountId
        );
        if ((references != null && references > 0) || (paidExpenses != null && paidExpenses > 0)) {
            throw new ValidationException("account_id",
                "Account " + entity.getCode() + " funds recorded expense payments and cannot be deactivated");
        }
        entity.updateFromDomain(entity.toDomain().deactivate());
        accountRepository.save(entity);
        log.info("Deactivated balance account {}", entity.getCode());
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public List<BalanceEntry> getEntries(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new NotFoundException(RESOURCE, accountId);
        }
        return entryRepository.findByAccountIdOrderByIdAsc(accountId).stream()
            .map(BalanceEntryEntity::toDomain)
            .toList();
    }

    private BalanceAccount apply(BalanceAccountEntity entity, BalanceAccount updated, EntryType entryType,
                                 BigDecimal signedAmount, String description, String reference) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, entity.getId().toString());
        try {
            entity.updateFromDomain(updated);
            accountRepository.save(entity);
            entryRepository.save(BalanceEntryEntity.record(entity.getId(), entryType, signedAmount,
                    updated.getBalance(), description, reference));
            ledgerMetrics.recordAccountMovement(entryType.name());
            log.debug("Account {} {}: amount={}, balanceAfter={}, reference={}",
                    entity.getCode(), entryType, signedAmount, updated.getBalance(), reference);
            return entity.toDomain();
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private BalanceAccountEntity lockEntity(UUID accountId) {
        if (accountId == null) {
            throw new ValidationException("account_id", "Account id is required");
        }
        try {
            BalanceAccountEntity entity = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new NotFoundException(RESOURCE, accountId));
            // a row read earlier in this transaction keeps its old state until refreshed
            entityManager.refresh(entity);
            return entity;
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("account", accountId, e);
        }
    }

    private void requireActive(BalanceAccountEntity entity) {
        if (!entity.isActive()) {
            throw new ValidationException("account_id", "Account " + entity.getCode() + " is inactive");
        }
    }

    private static String requireDescription(String description) {
        if (description == null || description.isBlank()) {
            throw new ValidationException("description", "Description is required");
        }
        if (description.trim().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description",
                "Description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        return description.trim();
    }

    private void requireReason(String reason) {
        int minimum = properties.getMinDescriptionLength();
        if (reason == null || reason.trim().length() < minimum) {
            throw new ValidationException("reason",
                "A reason of at least " + minimum + " characters is required for a balance override");
        }
        if (reason.trim().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("reason",
                "Reason must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}
