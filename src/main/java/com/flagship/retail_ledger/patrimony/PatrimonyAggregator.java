package com.flagship.retail_ledger.patrimony;

import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.inventory.InventoryValuation;
import com.flagship.retail_ledger.inventory.InventoryValuationService;
import com.flagship.retail_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Computes the patrimony snapshot from scratch on every call.
 *
 * Assets: liquid funds + inventory + pending receivables + fixed + other.
 * Liabilities: current liability accounts + pending payables + pending
 * expenses + long-term liability accounts.
 *
 * All reads run in one repeatable-read transaction so the equation is
 * computed over a single consistent state. Nothing is cached or written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatrimonyAggregator {

    private static final String ACCOUNTS_SQL =
        "SELECT id, code, name, kind, balance FROM balance_accounts WHERE active = TRUE ORDER BY code";

    private static final String DEBT_BALANCE_SQL =
        "SELECT COALESCE(SUM(amount - amount_paid), 0) FROM debts WHERE kind = ?";

    private static final String PENDING_EXPENSES_SQL =
        "SELECT COALESCE(SUM(amount - amount_paid), 0) FROM expenses";

    private final JdbcTemplate jdbcTemplate;
    private final InventoryValuationService inventoryValuation;
    private final LedgerMetrics ledgerMetrics;
    private final Clock clock;

    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public PatrimonySnapshot snapshot() {
        return ledgerMetrics.timePatrimony(this::compute);
    }

    private PatrimonySnapshot compute() {
        List<PatrimonySnapshot.AccountLine> accounts = jdbcTemplate.query(ACCOUNTS_SQL, (rs, rowNum) ->
            new PatrimonySnapshot.AccountLine(
                rs.getObject("id", UUID.class),
                rs.getString("code"),
                rs.getString("name"),
                AccountKind.valueOf(rs.getString("kind")),
                rs.getBigDecimal("balance")
            ));

        List<PatrimonySnapshot.AccountLine> liquidAccounts = filter(accounts, kind -> kind.isFunds());
        BigDecimal liquid = sum(liquidAccounts);
        InventoryValuation inventory = inventoryValuation.value();
        BigDecimal receivables = scalar(DEBT_BALANCE_SQL, "RECEIVABLE");
        BigDecimal fixed = sum(filter(accounts, kind -> kind == AccountKind.ASSET_FIXED));
        BigDecimal other = sum(filter(accounts, kind -> kind == AccountKind.ASSET_OTHER));
        BigDecimal currentAssets = liquid.add(inventory.getTotal()).add(receivables);
        BigDecimal totalAssets = currentAssets.add(fixed).add(other);

        BigDecimal payables = scalar(DEBT_BALANCE_SQL, "PAYABLE");
        BigDecimal pendingExpenses = scalar(PENDING_EXPENSES_SQL);
        BigDecimal currentAccounts = sum(filter(accounts, kind -> kind == AccountKind.LIABILITY_CURRENT));
        BigDecimal longTerm = sum(filter(accounts, kind -> kind == AccountKind.LIABILITY_LONG));
        BigDecimal currentLiabilities = currentAccounts.add(payables).add(pendingExpenses);
        BigDecimal totalLiabilities = currentLiabilities.add(longTerm);

        List<PatrimonySnapshot.AccountLine> equityAccounts = filter(accounts, kind -> kind == AccountKind.EQUITY);

        PatrimonySnapshot snapshot = PatrimonySnapshot.builder()
            .assets(PatrimonySnapshot.Assets.builder()
                .liquid(liquid)
                .liquidAccounts(liquidAccounts)
                .inventory(inventory.getTotal())
                .inventoryEstimated(inventory.isEstimated())
                .receivables(receivables)
                .currentTotal(currentAssets)
                .fixed(fixed)
                .other(other)
                .total(totalAssets)
                .build())
            .liabilities(PatrimonySnapshot.Liabilities.builder()
                .payables(payables)
                .pendingExpenses(pendingExpenses)
                .currentAccounts(currentAccounts)
                .currentTotal(currentLiabilities)
                .longTerm(longTerm)
                .total(totalLiabilities)
                .build())
            .equity(PatrimonySnapshot.Equity.builder()
                .accounts(equityAccounts)
                .total(sum(equityAccounts))
                .build())
            .netPatrimony(totalAssets.subtract(totalLiabilities))
            .computedAt(Instant.now(clock))
            .build();

        log.debug("Patrimony computed: assets={}, liabilities={}, net={}",
                totalAssets, totalLiabilities, snapshot.getNetPatrimony());
        return snapshot;
    }

    private BigDecimal scalar(String sql, Object... args) {
        BigDecimal value = jdbcTemplate.queryForObject(sql, BigDecimal.class, args);
        return value == null ? Amounts.zero() : value.setScale(Amounts.SCALE);
    }

    private static List<PatrimonySnapshot.AccountLine> filter(List<PatrimonySnapshot.AccountLine> accounts,
                                                              Predicate<AccountKind> kind) {
        return accounts.stream().filter(line -> kind.test(line.getKind())).toList();
    }

    private static BigDecimal sum(List<PatrimonySnapshot.AccountLine> lines) {
        return lines.stream()
            .map(PatrimonySnapshot.AccountLine::getBalance)
            .reduce(Amounts.zero(), BigDecimal::add);
    }
}
