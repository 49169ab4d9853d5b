package com.flagship.retail_ledger.observability;

import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.account.BalanceAccountEntity;
import com.flagship.retail_ledger.account.BalanceAccountRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Health indicator for funds accounts.
 *
 * Ledger debits can never drive a funds account negative, so a negative one
 * was set by an administrative override and needs attention. The service
 * keeps working: the status is WARNING, not DOWN.
 */
@Component("fundsAccountsHealth")
public class FundsAccountsHealthIndicator implements HealthIndicator {

    private static final List<AccountKind> FUNDS_KINDS = Arrays.stream(AccountKind.values())
            .filter(AccountKind::isFunds)
            .toList();

    private final BalanceAccountRepository accountRepository;

    public FundsAccountsHealthIndicator(BalanceAccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    public Health health() {
        try {
            List<String> negative = accountRepository.findNegative(FUNDS_KINDS).stream()
                    .map(BalanceAccountEntity::getCode)
                    .toList();

            Health.Builder builder = negative.isEmpty() ? Health.up() : Health.status("WARNING");
            return builder
                    .withDetail("negativeAccounts", negative)
                    .build();

        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
