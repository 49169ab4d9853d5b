package com.flagship.retail_ledger.fallback;

import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the cash fallback check. The account store is mocked.
 */
class CashFallbackResolverTest {

    private BalanceAccountStore accountStore;
    private LedgerProperties properties;
    private CashFallbackResolver resolver;

    @BeforeEach
    void setUp() {
        accountStore = mock(BalanceAccountStore.class);
        properties = new LedgerProperties();
        properties.getFallback().getPairs().put("1101", "1102");
        resolver = new CashFallbackResolver(accountStore, properties);
    }

    private BalanceAccount account(String code, AccountKind kind, String balance) {
        BalanceAccount account = BalanceAccount.open(UUID.randomUUID(), code, "Account " + code, kind,
            new BigDecimal(balance));
        when(accountStore.getAccount(account.getId())).thenReturn(account);
        when(accountStore.getAccountByCode(code)).thenReturn(account);
        return account;
    }

    @Test
    @DisplayName("Primary covers the amount: can pay, fallback still reported")
    void testCheck_PrimaryCovers() {
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "100000.00");
        BalanceAccount vault = account("1102", AccountKind.CASH_SECONDARY, "200000.00");

        FallbackCheck check = resolver.check(new BigDecimal("80000"), petty.getId());

        assertTrue(check.isCanPay());
        assertFalse(check.requiresConfirmation());
        assertEquals(vault.getId(), check.getFallbackAccountId());
        assertEquals(0, check.getShortfall().signum());
    }

    @Test
    @DisplayName("Primary short, fallback covers: confirmation required")
    void testCheck_NeedsConfirmation() {
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "50000.00");
        BalanceAccount vault = account("1102", AccountKind.CASH_SECONDARY, "200000.00");

        FallbackCheck check = resolver.check(new BigDecimal("80000.00"), petty.getId());

        assertFalse(check.isCanPay());
        assertTrue(check.isFallbackAvailable());
        assertTrue(check.requiresConfirmation());
        assertEquals(vault.getId(), check.getFallbackAccountId());
        assertEquals(new BigDecimal("200000.00"), check.getFallbackBalance());
        assertEquals(new BigDecimal("30000.00"), check.getShortfall());
    }

    @Test
    @DisplayName("Both accounts short: no confirmation, both balances reported")
    void testCheck_BothShort() {
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "50000.00");
        account("1102", AccountKind.CASH_SECONDARY, "60000.00");

        FallbackCheck check = resolver.check(new BigDecimal("80000.00"), petty.getId());

        assertFalse(check.isCanPay());
        assertFalse(check.requiresConfirmation());
        assertTrue(check.hasFallback());
        assertEquals(new BigDecimal("60000.00"), check.getFallbackBalance());
    }

    @Test
    @DisplayName("Account without a configured pair has no fallback")
    void testCheck_NoPair() {
        BalanceAccount bank = account("1104", AccountKind.BANK, "10.00");

        FallbackCheck check = resolver.check(new BigDecimal("80.00"), bank.getId());

        assertFalse(check.hasFallback());
        assertNull(check.getFallbackBalance());
        assertFalse(check.requiresConfirmation());
    }

    @Test
    @DisplayName("Inactive fallback is ignored")
    void testFallbackFor_InactiveIgnored() {
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "0.00");
        BalanceAccount vault = BalanceAccount.open(UUID.randomUUID(), "1102", "Vault", AccountKind.CASH_SECONDARY,
            new BigDecimal("500.00")).deactivate();
        when(accountStore.getAccountByCode("1102")).thenReturn(vault);

        assertTrue(resolver.fallbackFor(petty.getId()).isEmpty());
    }

    @Test
    @DisplayName("A pair joining a non-cash account is a configuration error")
    void testFallbackFor_RejectsNonCashPair() {
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "0.00");
        account("1102", AccountKind.BANK, "500.00");

        assertThrows(IllegalStateException.class, () -> resolver.fallbackFor(petty.getId()));
    }

    @Test
    @DisplayName("Configured fallback accounts are recognized as targets")
    void testIsFallbackTarget() {
        BalanceAccount vault = account("1102", AccountKind.CASH_SECONDARY, "0.00");
        BalanceAccount petty = account("1101", AccountKind.CASH_PRIMARY, "0.00");

        assertTrue(resolver.isFallbackTarget(vault));
        assertFalse(resolver.isFallbackTarget(petty));
    }
}
