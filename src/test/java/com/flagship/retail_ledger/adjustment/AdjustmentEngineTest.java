package com.flagship.retail_ledger.adjustment;

import com.flagship.retail_ledger.LedgerFixtures;
import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.account.BalanceAccount;
import com.flagship.retail_ledger.account.BalanceAccountStore;
import com.flagship.retail_ledger.config.LedgerProperties;
import com.flagship.retail_ledger.error.InsufficientFundsException;
import com.flagship.retail_ledger.error.NoChangeRequestedException;
import com.flagship.retail_ledger.error.ValidationException;
import com.flagship.retail_ledger.expense.Expense;
import com.flagship.retail_ledger.expense.ExpenseLedger;
import com.flagship.retail_ledger.expense.ExpensePayment;
import com.flagship.retail_ledger.expense.ExpenseStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static com.flagship.retail_ledger.LedgerFixtures.money;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for corrections, reversals and refunds of paid expenses.
 */
@SpringBootTest
@ActiveProfiles("test")
class AdjustmentEngineTest {

    private static final String REASON = "Supplier invoice corrected";

    @Autowired
    private AdjustmentEngine adjustmentEngine;

    @Autowired
    private ExpenseLedger expenseLedger;

    @Autowired
    private BalanceAccountStore accountStore;

    @Autowired
    private LedgerProperties properties;

    private LedgerFixtures fixtures;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        fixtures = new LedgerFixtures(accountStore, expenseLedger, properties);
    }

    private Expense paidExpense(BalanceAccount account, String amount) {
        Expense expense = fixtures.expense(amount);
        return expenseLedger.payExpense(expense.getId(), new BigDecimal(amount), account.getId(), false)
            .getExpense();
    }

    @Test
    @DisplayName("Lowering a paid amount credits the difference back and records a negative delta")
    void testAdjust_DecreaseAmount() {
        printTestHeader("Amount correction 100,000 -> 90,000");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "500000.00");
        Expense expense = paidExpense(bank, "100000.00");

        AdjustmentResult result = adjustmentEngine.adjust(expense.getId(), new BigDecimal("90000"), null,
            AdjustmentReason.AMOUNT_CORRECTION, REASON, "maria");

        AdjustmentRecord record = result.getRecord();
        printOutput("Delta", record.getAdjustmentDelta());
        assertEquals(AdjustmentReason.AMOUNT_CORRECTION, record.getReason());
        assertEquals(money("100000.00"), record.getPreviousAmount());
        assertEquals(money("90000.00"), record.getNewAmount());
        assertEquals(money("-10000.00"), record.getAdjustmentDelta());
        assertEquals(bank.getId(), record.getPreviousAccountId());
        assertEquals(bank.getId(), record.getNewAccountId());
        assertEquals("maria", record.getAdjustedBy());

        assertEquals(ExpenseStatus.PAID, result.getExpense().getStatus());
        assertEquals(money("90000.00"), result.getExpense().getAmountPaid());
        assertEquals(money("410000.00"), accountStore.getBalance(bank.getId()));
        printSuccess("10,000 returned to the bank");
    }

    @Test
    @DisplayName("Raising a paid amount debits the difference")
    void testAdjust_IncreaseAmount() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(bank, "100.00");

        AdjustmentResult result = adjustmentEngine.adjust(expense.getId(), new BigDecimal("130"), null,
            null, REASON, null);

        assertEquals(money("30.00"), result.getRecord().getAdjustmentDelta());
        assertEquals(ExpenseStatus.PAID, result.getExpense().getStatus());
        assertEquals(money("870.00"), accountStore.getBalance(bank.getId()));
    }

    @Test
    @DisplayName("Raising the amount beyond the account's funds rolls everything back")
    void testAdjust_IncreaseInsufficientFunds() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "110.00");
        Expense expense = paidExpense(bank, "100.00");

        assertThrows(InsufficientFundsException.class, () -> adjustmentEngine.adjust(expense.getId(),
            new BigDecimal("150"), null, null, REASON, null));

        assertEquals(money("10.00"), accountStore.getBalance(bank.getId()));
        assertEquals(money("100.00"), expenseLedger.getExpense(expense.getId()).getAmount());
        assertTrue(adjustmentEngine.getHistory(expense.getId()).isEmpty());
    }

    @Test
    @DisplayName("Moving a payment to another account credits the old one and debits the new one")
    void testAdjust_AccountCorrection() {
        BalanceAccount cash = fixtures.account(AccountKind.CASH_SECONDARY, "1000.00");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(cash, "250.00");

        AdjustmentResult result = adjustmentEngine.adjust(expense.getId(), null, bank.getId(),
            AdjustmentReason.ACCOUNT_CORRECTION, "Was paid by bank transfer", null);

        assertEquals(AdjustmentReason.ACCOUNT_CORRECTION, result.getRecord().getReason());
        assertEquals(cash.getId(), result.getRecord().getPreviousAccountId());
        assertEquals(bank.getId(), result.getRecord().getNewAccountId());
        assertEquals(0, result.getRecord().getAdjustmentDelta().signum());
        assertEquals(bank.getId(), result.getExpense().getPaymentAccountId());
        assertEquals(money("1000.00"), accountStore.getBalance(cash.getId()));
        assertEquals(money("750.00"), accountStore.getBalance(bank.getId()));

        List<ExpensePayment> payments = expenseLedger.getPayments(expense.getId());
        assertEquals(1, payments.size());
        assertEquals(bank.getId(), payments.get(0).getAccountId());
    }

    @Test
    @DisplayName("Changing amount and account together is a both correction")
    void testAdjust_BothCorrection() {
        BalanceAccount cash = fixtures.account(AccountKind.CASH_SECONDARY, "1000.00");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(cash, "250.00");

        AdjustmentResult result = adjustmentEngine.adjust(expense.getId(), new BigDecimal("200"), bank.getId(),
            AdjustmentReason.AMOUNT_CORRECTION, REASON, null);

        assertEquals(AdjustmentReason.BOTH_CORRECTION, result.getRecord().getReason());
        assertEquals(money("1000.00"), accountStore.getBalance(cash.getId()));
        assertEquals(money("800.00"), accountStore.getBalance(bank.getId()));
    }

    @Test
    @DisplayName("Adjustment without any change is rejected")
    void testAdjust_NoChange() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(bank, "100.00");

        assertThrows(NoChangeRequestedException.class, () -> adjustmentEngine.adjust(expense.getId(),
            new BigDecimal("100.00"), bank.getId(), null, REASON, null));
    }

    @Test
    @DisplayName("Short descriptions, unpaid expenses and reserved reasons are rejected")
    void testAdjust_Validation() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense paid = paidExpense(bank, "100.00");
        Expense pending = fixtures.expense("100.00");

        assertThrows(ValidationException.class, () -> adjustmentEngine.adjust(paid.getId(),
            new BigDecimal("90"), null, null, "typo", null));
        assertThrows(ValidationException.class, () -> adjustmentEngine.adjust(pending.getId(),
            new BigDecimal("90"), null, null, REASON, null));
        assertThrows(ValidationException.class, () -> adjustmentEngine.adjust(paid.getId(),
            new BigDecimal("90"), null, AdjustmentReason.ERROR_REVERSAL, REASON, null));
        assertThrows(ValidationException.class, () -> adjustmentEngine.adjust(paid.getId(),
            new BigDecimal("90"), null, AdjustmentReason.PARTIAL_REFUND, REASON, null));
        assertEquals(money("900.00"), accountStore.getBalance(bank.getId()));
    }

    @Test
    @DisplayName("Reverting a paid expense restores the account and the pending state")
    void testRevert_RoundTrip() {
        printTestHeader("Revert paid expense");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(bank, "400.00");

        AdjustmentResult result = adjustmentEngine.revert(expense.getId(), "Paid the wrong invoice", "jose");

        assertEquals(ExpenseStatus.PENDING, result.getExpense().getStatus());
        assertNull(result.getExpense().getPaymentAccountId());
        assertEquals(money("1000.00"), accountStore.getBalance(bank.getId()));
        assertEquals(AdjustmentReason.ERROR_REVERSAL, result.getRecord().getReason());
        assertEquals(money("-400.00"), result.getRecord().getAdjustmentDelta());
        assertNull(result.getRecord().getNewAccountId());
        assertTrue(expenseLedger.getPayments(expense.getId()).isEmpty());

        // the expense can be paid again
        expenseLedger.payExpense(expense.getId(), new BigDecimal("400"), bank.getId(), false);
        assertEquals(money("600.00"), accountStore.getBalance(bank.getId()));
        printSuccess("Expense reverted and paid again");
    }

    @Test
    @DisplayName("Reverting a partially paid expense returns each payment to its account")
    void testRevert_PartialPaymentsFromTwoAccounts() {
        BalanceAccount wallet = fixtures.account(AccountKind.DIGITAL_WALLET, "100.00");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "100.00");
        Expense expense = fixtures.expense("300.00");
        expenseLedger.payExpense(expense.getId(), new BigDecimal("60"), wallet.getId(), false);
        expenseLedger.payExpense(expense.getId(), new BigDecimal("70"), bank.getId(), false);

        adjustmentEngine.revert(expense.getId(), "Payments registered twice", null);

        assertEquals(money("100.00"), accountStore.getBalance(wallet.getId()));
        assertEquals(money("100.00"), accountStore.getBalance(bank.getId()));
        assertEquals(ExpenseStatus.PENDING, expenseLedger.getExpense(expense.getId()).getStatus());
        assertThrows(ValidationException.class,
            () -> adjustmentEngine.revert(expense.getId(), "Payments registered twice", null));
    }

    @Test
    @DisplayName("Refund of a paid expense lowers amount and amount paid together")
    void testRefund_PaidExpense() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(bank, "300.00");

        AdjustmentResult result = adjustmentEngine.refund(expense.getId(), new BigDecimal("50"),
            "Two shirts returned", null);

        assertEquals(AdjustmentReason.PARTIAL_REFUND, result.getRecord().getReason());
        assertEquals(money("-50.00"), result.getRecord().getAdjustmentDelta());
        assertEquals(ExpenseStatus.PAID, result.getExpense().getStatus());
        assertEquals(money("250.00"), result.getExpense().getAmount());
        assertEquals(money("750.00"), accountStore.getBalance(bank.getId()));

        assertThrows(ValidationException.class, () -> adjustmentEngine.refund(expense.getId(),
            new BigDecimal("250"), "Everything returned", null));
        assertThrows(ValidationException.class, () -> adjustmentEngine.refund(expense.getId(),
            new BigDecimal("300"), "More than was paid", null));
    }

    @Test
    @DisplayName("Refund of a partially paid expense returns the latest payment first")
    void testRefund_LatestPaymentFirst() {
        BalanceAccount wallet = fixtures.account(AccountKind.DIGITAL_WALLET, "100.00");
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "100.00");
        Expense expense = fixtures.expense("300.00");
        expenseLedger.payExpense(expense.getId(), new BigDecimal("60"), wallet.getId(), false);
        expenseLedger.payExpense(expense.getId(), new BigDecimal("70"), bank.getId(), false);

        AdjustmentResult result = adjustmentEngine.refund(expense.getId(), new BigDecimal("80"),
            "Partial return of goods", null);

        assertEquals(money("300.00"), result.getExpense().getAmount());
        assertEquals(money("50.00"), result.getExpense().getAmountPaid());
        assertEquals(ExpenseStatus.PARTIALLY_PAID, result.getExpense().getStatus());
        assertEquals(money("100.00"), accountStore.getBalance(bank.getId()));
        assertEquals(money("50.00"), accountStore.getBalance(wallet.getId()));

        List<ExpensePayment> payments = expenseLedger.getPayments(expense.getId());
        assertEquals(1, payments.size());
        assertEquals(wallet.getId(), payments.get(0).getAccountId());
        assertEquals(money("50.00"), payments.get(0).getAmount());
    }

    @Test
    @DisplayName("History lists adjustments oldest first and the range query finds them")
    void testHistoryAndRange() {
        BalanceAccount bank = fixtures.account(AccountKind.BANK, "1000.00");
        Expense expense = paidExpense(bank, "300.00");
        adjustmentEngine.adjust(expense.getId(), new BigDecimal("280"), null, null, REASON, null);
        adjustmentEngine.refund(expense.getId(), new BigDecimal("30"), "One item returned", null);
        adjustmentEngine.revert(expense.getId(), "Invoice was cancelled", null);

        List<AdjustmentRecord> history = adjustmentEngine.getHistory(expense.getId());
        assertEquals(List.of(AdjustmentReason.AMOUNT_CORRECTION, AdjustmentReason.PARTIAL_REFUND,
                AdjustmentReason.ERROR_REVERSAL),
            history.stream().map(AdjustmentRecord::getReason).toList());
        assertEquals(money("1000.00"), accountStore.getBalance(bank.getId()));

        LocalDate today = LocalDate.now(ZoneId.systemDefault());
        List<AdjustmentRecord> refunds = adjustmentEngine.findAdjustments(today.minusDays(1), today.plusDays(1),
            AdjustmentReason.PARTIAL_REFUND);
        assertTrue(refunds.stream().anyMatch(r -> r.getExpenseId().equals(expense.getId())));
        assertTrue(refunds.stream().allMatch(r -> r.getReason() == AdjustmentReason.PARTIAL_REFUND));

        assertThrows(ValidationException.class,
            () -> adjustmentEngine.findAdjustments(today, today.minusDays(1), null));
    }
}
