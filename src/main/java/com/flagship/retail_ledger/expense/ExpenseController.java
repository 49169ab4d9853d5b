package com.flagship.retail_ledger.expense;

import com.flagship.retail_ledger.expense.dto.CreateExpenseRequest;
import com.flagship.retail_ledger.expense.dto.ExpensePaymentResponse;
import com.flagship.retail_ledger.expense.dto.ExpenseResponse;
import com.flagship.retail_ledger.expense.dto.PayExpenseRequest;
import com.flagship.retail_ledger.expense.dto.PayExpenseResponse;
import com.flagship.retail_ledger.expense.dto.UpdateExpenseRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for expenses and their payments.
 *
 * Errors are rendered by the global exception handler: a short cash account
 * answers 409 NEEDS_FALLBACK_CONFIRMATION, an account that cannot cover the
 * payment 422 INSUFFICIENT_FUNDS.
 */
@RestController
@RequestMapping("/api/expenses")
@RequiredArgsConstructor
@Slf4j
public class ExpenseController {

    private final ExpenseLedger expenseLedger;

    @PostMapping
    public ResponseEntity<ExpenseResponse> createExpense(@Valid @RequestBody CreateExpenseRequest request) {
        log.info("Received expense creation request: category={}, amount={}",
                request.getCategory(), request.getAmount());
        Expense expense = expenseLedger.createExpense(
            request.getCategory(),
            request.getDescription(),
            request.getAmount(),
            request.getExpenseDate(),
            request.getDueDate(),
            request.getVendor()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ExpenseResponse.from(expense));
    }

    @GetMapping
    public ResponseEntity<List<ExpenseResponse>> listExpenses(
            @RequestParam(value = "status", required = false) String status) {
        ExpenseStatus filter = status == null || status.isBlank() ? null : ExpenseStatus.fromValue(status);
        return ResponseEntity.ok(expenseLedger.listExpenses(filter).stream()
            .map(ExpenseResponse::from)
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ExpenseResponse> getExpense(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(ExpenseResponse.from(expenseLedger.getExpense(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ExpenseResponse> updateExpense(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody UpdateExpenseRequest request) {
        Expense expense = expenseLedger.updateExpense(
            id,
            request.getCategory(),
            request.getDescription(),
            request.getAmount(),
            request.getExpenseDate(),
            request.getDueDate(),
            request.getVendor()
        );
        return ResponseEntity.ok(ExpenseResponse.from(expense));
    }

    @PostMapping("/{id}/pay")
    public ResponseEntity<PayExpenseResponse> payExpense(@PathVariable("id") UUID id,
                                                         @Valid @RequestBody PayExpenseRequest request) {
        log.info("Received expense payment request: expenseId={}, amount={}, accountId={}, useFallback={}",
                id, request.getAmount(), request.getAccountId(), request.isUseFallback());
        ExpensePaymentResult result = expenseLedger.payExpense(
            id,
            request.getAmount(),
            request.getAccountId(),
            request.getMethod(),
            request.isUseFallback(),
            request.getFallbackAccountId()
        );
        return ResponseEntity.ok(PayExpenseResponse.from(result));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<ExpensePaymentResponse>> getPayments(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(expenseLedger.getPayments(id).stream()
            .map(ExpensePaymentResponse::from)
            .toList());
    }
}
