package com.flagship.retail_ledger.debt;

import com.flagship.retail_ledger.debt.dto.CreateDebtRequest;
import com.flagship.retail_ledger.debt.dto.DebtPaymentRequest;
import com.flagship.retail_ledger.debt.dto.DebtResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.UUID;

/**
 * Endpoints shared by receivables and payables. Each concrete controller
 * binds them to its own path and kind.
 */
@Slf4j
public abstract class DebtController {

    private final ReceivablesPayablesLedger ledger;
    private final DebtKind kind;

    protected DebtController(ReceivablesPayablesLedger ledger, DebtKind kind) {
        this.ledger = ledger;
        this.kind = kind;
    }

    @PostMapping
    public ResponseEntity<DebtResponse> create(@Valid @RequestBody CreateDebtRequest request) {
        log.info("Received {} creation request: amount={}, dueDate={}",
                kind.getValue(), request.getAmount(), request.getDueDate());
        Debt debt = ledger.create(kind, request.getDescription(), request.getCounterparty(), request.getAmount(),
            request.getInvoiceDate(), request.getDueDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(DebtResponse.from(debt, ledger.today()));
    }

    @GetMapping
    public ResponseEntity<List<DebtResponse>> list(
            @RequestParam(value = "pending", defaultValue = "false") boolean pendingOnly,
            @RequestParam(value = "overdue", defaultValue = "false") boolean overdueOnly) {
        return ResponseEntity.ok(ledger.list(kind, pendingOnly, overdueOnly).stream()
            .map(debt -> DebtResponse.from(debt, ledger.today()))
            .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<DebtResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(DebtResponse.from(ledger.get(kind, id), ledger.today()));
    }

    @PostMapping("/{id}/pay")
    public ResponseEntity<DebtResponse> pay(@PathVariable("id") UUID id,
                                            @Valid @RequestBody DebtPaymentRequest request) {
        log.info("Received {} payment request: id={}, amount={}, accountId={}",
                kind.getValue(), id, request.getAmount(), request.getAccountId());
        DebtPaymentResult result = ledger.recordPayment(kind, id, request.getAmount(), request.getMethod(),
            request.getAccountId());
        return ResponseEntity.ok(DebtResponse.from(result.getDebt(), ledger.today()));
    }
}
