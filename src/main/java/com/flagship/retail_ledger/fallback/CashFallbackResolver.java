package com.flagship.retail_ledger.fallback;

import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether a cash payment can be covered by its primary cash account
 * and, if not, whether the configured fallback account could cover it.
 *
 * The resolver only reports. It never moves money and never picks the
 * account to debit: the caller does that explicitly with its
 * {@code useFallback} flag. Pairs come from {@code ledger.fallback.pairs}
 * and must join two cash accounts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CashFallbackResolver {

    private final BalanceAccountStore accountStore;
    private final LedgerProperties properties;

    /**
     * Checks whether {@code amount} can be paid from the primary account.
     *
     * @param amount amount to pay
     * @param primaryAccountId account the caller wants to pay from
     * @return balances of the source and, if configured, of its fallback
     */
    @Transactional(readOnly = true)
    public FallbackCheck check(BigDecimal amount, UUID primaryAccountId) {
        BigDecimal value = Amounts.requirePositive(amount, "amount");
        BalanceAccount source = accountStore.getAccount(primaryAccountId);
        boolean canPay = source.canCover(value);

        Optional<BalanceAccount> fallback = fallbackFor(source);
        FallbackCheck check = new FallbackCheck(
            value,
            source.getId(),
            source.getBalance(),
            canPay,
            fallback.map(BalanceAccount::getId).orElse(null),
            fallback.map(BalanceAccount::getBalance).orElse(null),
            !canPay && fallback.map(account -> account.canCover(value)).orElse(false)
        );

        log.debug("Fallback check: source={}, sourceBalance={}, amount={}, canPay={}, fallback={}, fallbackBalance={}",
                source.getCode(), source.getBalance(), value, canPay,
                check.getFallbackAccountId(), check.getFallbackBalance());
        return check;
    }

    /**
     * Returns the configured fallback of an account, if any.
     */
    @Transactional(readOnly = true)
    public Optional<BalanceAccount> fallbackFor(UUID accountId) {
        return fallbackFor(accountStore.getAccount(accountId));
    }

    /**
     * Whether the account is configured as the fallback of some primary account.
     */
    public boolean isFallbackTarget(BalanceAccount account) {
        return properties.getFallback().getPairs().containsValue(account.getCode());
    }

    private Optional<BalanceAccount> fallbackFor(BalanceAccount source) {
        String fallbackCode = properties.getFallback().getPairs().get(source.getCode());
        if (fallbackCode == null) {
            return Optional.empty();
        }

        BalanceAccount fallback = accountStore.getAccountByCode(fallbackCode);
        if (!source.getKind().isCash() || !fallback.getKind().isCash()) {
            throw new IllegalStateException(String.format(
                "Fallback pair %s -> %s must join two cash accounts (found %s and %s)",
                source.getCode(), fallbackCode, source.getKind().getValue(), fallback.getKind().getValue()));
        }
        if (!fallback.isActive()) {
            log.warn("Fallback account {} of {} is inactive, ignoring it", fallbackCode, source.getCode());
            return Optional.empty();
        }
        return Optional.of(fallback);
    }
}
