package com.flagship.retail_ledger.account;

import com.flagship.retail_ledger.account.dto.AccountResponse;
import com.flagship.retail_ledger.account.dto.BalanceEntryResponse;
import com.flagship.retail_ledger.account.dto.CreateAccountRequest;
import com.flagship.retail_ledger.account.dto.RecordIncomeRequest;
import com.flagship.retail_ledger.account.dto.SetBalanceRequest;
import com.flagship.retail_ledger.account.dto.TransferRequest;
import com.flagship.retail_ledger.account.dto.TransferResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST Controller for balance accounts and their journal.
 */
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private final BalanceAccountStore accountStore;

    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts() {
        return ResponseEntity.ok(accountStore.listAccounts().stream()
            .map(AccountResponse::from)
            .toList());
    }

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        BalanceAccount account = accountStore.createAccount(request.getCode(), request.getName(), request.getKind(),
            request.getOpeningBalance());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    @GetMapping("/{id}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountStore.getAccount(id)));
    }

    @PutMapping("/{id}/balance")
    public ResponseEntity<AccountResponse> setBalance(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody SetBalanceRequest request) {
        BalanceAccount account = accountStore.setBalance(id, request.getBalance(), request.getReason());
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @PostMapping("/{id}/income")
    public ResponseEntity<AccountResponse> recordIncome(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody RecordIncomeRequest request) {
        BalanceAccount account = accountStore.recordIncome(id, request.getAmount(), request.getDescription());
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    /**
     * Income routed by payment method: cash to the cash drawer, transfers and cards to the bank.
     */
    @PostMapping("/income")
    public ResponseEntity<AccountResponse> recordIncomeByMethod(@Valid @RequestBody RecordIncomeRequest request) {
        log.info("Received income: method={}, amount={}", request.getPaymentMethod(), request.getAmount());
        BalanceAccount account = accountStore.recordIncome(request.getPaymentMethod(), request.getAmount(),
            request.getDescription());
        return ResponseEntity.ok(AccountResponse.from(account));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<AccountResponse> deactivateAccount(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(AccountResponse.from(accountStore.deactivateAccount(id)));
    }

    @GetMapping("/{id}/entries")
    public ResponseEntity<List<BalanceEntryResponse>> getEntries(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(accountStore.getEntries(id).stream()
            .map(BalanceEntryResponse::from)
            .toList());
    }

    @PostMapping("/transfers")
    public ResponseEntity<TransferResponse> transfer(@Valid @RequestBody TransferRequest request) {
        log.info("Received transfer request: from={}, to={}, amount={}",
                request.getFromAccountId(), request.getToAccountId(), request.getAmount());
        TransferResult result = accountStore.transfer(request.getFromAccountId(), request.getToAccountId(),
            request.getAmount(), request.getDescription());
        return ResponseEntity.ok(TransferResponse.from(result));
    }
}
