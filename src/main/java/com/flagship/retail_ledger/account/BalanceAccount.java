package com.flagship.retail_ledger.account;

import com.flagship.retail_ledger.error.InsufficientFundsException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for a balance account: a named pool of money with a running
 * balance.
 *
 * Balance changes return a new instance, the same way payment state
 * transitions do. Amounts are expected to be validated and normalized by
 * the caller.
 */
@Value
public class BalanceAccount {
    UUID id;
    String code;
    String name;
    AccountKind kind;
    BigDecimal balance;
    boolean active;
    Instant createdAt;
    Instant updatedAt;

    public static BalanceAccount open(UUID id, String code, String name, AccountKind kind, BigDecimal openingBalance) {
        Instant now = Instant.now();
        return new BalanceAccount(id, code, name, kind, openingBalance, true, now, now);
    }

    /**
     * Subtracts an amount as a ledger debit.
     *
     * @throws InsufficientFundsException if this is a funds account and the balance would go negative
     */
    public BalanceAccount debit(BigDecimal amount) {
        BigDecimal newBalance = balance.subtract(amount);
        if (kind.isFunds() && newBalance.signum() < 0) {
            throw new InsufficientFundsException(id, name, balance, amount);
        }
        return withBalance(newBalance);
    }

    public BalanceAccount credit(BigDecimal amount) {
        return withBalance(balance.add(amount));
    }

    /**
     * Administrative override. No funds check: an audited manual correction
     * may leave any account negative.
     */
    public BalanceAccount withBalance(BigDecimal newBalance) {
        return new BalanceAccount(id, code, name, kind, newBalance, active, createdAt, Instant.now());
    }

    public BalanceAccount deactivate() {
        if (!active) {
            throw new IllegalStateException("Account " + code + " is already inactive");
        }
        return new BalanceAccount(id, code, name, kind, balance, false, createdAt, Instant.now());
    }

    public boolean canCover(BigDecimal amount) {
        return balance.compareTo(amount) >= 0;
    }
}
