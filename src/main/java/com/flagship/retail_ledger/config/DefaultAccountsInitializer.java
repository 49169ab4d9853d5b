package com.flagship.retail_ledger.config;

import com.flagship.retail_ledger.account.BalanceAccountRepository;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the configured default accounts (petty cash, vault cash, wallet,
 * bank) on startup. Accounts that already exist are left untouched, so the
 * runner is safe on every boot.
 */
@Component
@ConditionalOnProperty(name = "ledger.accounts.seed-defaults", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class DefaultAccountsInitializer implements ApplicationRunner {

    private final LedgerProperties properties;
    private final BalanceAccountRepository accountRepository;
    private final BalanceAccountStore accountStore;

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        for (LedgerProperties.DefaultAccount account : properties.getAccounts().getDefaults()) {
            if (accountRepository.existsByCode(account.getCode())) {
                continue;
            }
            accountStore.createAccount(account.getCode(), account.getName(), account.getKind(),
                    account.getOpeningBalance());
            created++;
        }
        log.info("Default accounts checked: configured={}, created={}",
                properties.getAccounts().getDefaults().size(), created);
    }
}
