package com.flagship.retail_ledger.patrimony;

import com.flagship.retail_ledger.LedgerFixtures;
import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.debt.DebtKind;
import com.flagship.retail_ledger.debt.ReceivablesPayablesLedger;
import com.flagship.retail_ledger.expense.Expense;
import com.flagship.retail_ledger.expense.ExpenseLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

import static com.flagship.retail_ledger.LedgerFixtures.money;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the patrimony snapshot. The database is shared with other
 * tests, so totals are checked as differences between two snapshots.
 */
@SpringBootTest
@ActiveProfiles("test")
class PatrimonyAggregatorTest {

    @Autowired
    private PatrimonyAggregator aggregator;

    @Autowired
    private BalanceAccountStore accountStore;

    @Autowired
    private ExpenseLedger expenseLedger;

    @Autowired
    private ReceivablesPayablesLedger debtLedger;

    @Autowired
    private LedgerProperties properties;

    private LedgerFixtures fixtures;

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountStore, expenseLedger, properties);
    }

    private static void assertBalanced(PatrimonySnapshot snapshot) {
        PatrimonySnapshot.Assets assets = snapshot.getAssets();
        PatrimonySnapshot.Liabilities liabilities = snapshot.getLiabilities();
        assertEquals(0, assets.getCurrentTotal()
            .compareTo(assets.getLiquid().add(assets.getInventory()).add(assets.getReceivables())));
        assertEquals(0, assets.getTotal()
            .compareTo(assets.getCurrentTotal().add(assets.getFixed()).add(assets.getOther())));
        assertEquals(0, liabilities.getTotal().compareTo(liabilities.getCurrentTotal().add(liabilities.getLongTerm())));
        assertEquals(0, snapshot.getNetPatrimony().compareTo(assets.getTotal().subtract(liabilities.getTotal())));
    }

    @Test
    @DisplayName("Every category moves the snapshot by exactly its amount")
    void testSnapshot_Categories() {
        PatrimonySnapshot before = aggregator.snapshot();
        assertBalanced(before);

        fixtures.account(AccountKind.BANK, "1000.00");
        fixtures.account(AccountKind.ASSET_FIXED, "5000.00");
        fixtures.account(AccountKind.LIABILITY_LONG, "2000.00");
        fixtures.account(AccountKind.EQUITY, "700.00");
        debtLedger.create(DebtKind.RECEIVABLE, "Client order", null, new BigDecimal("300"), null, null);
        debtLedger.create(DebtKind.PAYABLE, "Supplier order", null, new BigDecimal("200"), null, null);
        fixtures.expense("100.00");

        PatrimonySnapshot after = aggregator.snapshot();
        assertBalanced(after);

        assertEquals(money("1000.00"), after.getAssets().getLiquid().subtract(before.getAssets().getLiquid()));
        assertEquals(money("5000.00"), after.getAssets().getFixed().subtract(before.getAssets().getFixed()));
        assertEquals(money("300.00"),
            after.getAssets().getReceivables().subtract(before.getAssets().getReceivables()));
        assertEquals(money("200.00"),
            after.getLiabilities().getPayables().subtract(before.getLiabilities().getPayables()));
        assertEquals(money("100.00"),
            after.getLiabilities().getPendingExpenses().subtract(before.getLiabilities().getPendingExpenses()));
        assertEquals(money("2000.00"),
            after.getLiabilities().getLongTerm().subtract(before.getLiabilities().getLongTerm()));
        assertEquals(money("700.00"), after.getEquity().getTotal().subtract(before.getEquity().getTotal()));
        // 1000 + 5000 + 300 - 200 - 100 - 2000; equity is reported, not subtracted
        assertEquals(money("4000.00"), after.getNetPatrimony().subtract(before.getNetPatrimony()));
        assertNotNull(after.getComputedAt());
    }

    @Test
    @DisplayName("Paying an expense leaves net patrimony unchanged")
    void testSnapshot_PaymentIsNeutral() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = fixtures.expense("400.00");
        PatrimonySnapshot before = aggregator.snapshot();

        expenseLedger.payExpense(expense.getId(), new BigDecimal("150"), bank.getId(), false);
        PatrimonySnapshot after = aggregator.snapshot();

        assertEquals(0, after.getNetPatrimony().compareTo(before.getNetPatrimony()));
        assertEquals(money("-150.00"), after.getAssets().getLiquid().subtract(before.getAssets().getLiquid()));
        assertTrue(after.getAssets().getLiquidAccounts().stream()
            .anyMatch(line -> line.getId().equals(bank.getId())
                && line.getBalance().compareTo(new BigDecimal("850")) == 0));
    }
}
