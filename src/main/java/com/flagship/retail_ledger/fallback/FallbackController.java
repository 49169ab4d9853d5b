package com.flagship.retail_ledger.fallback;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Read-only preview of the cash fallback check, so a caller can warn before
 * submitting a payment.
 */
@RestController
@RequiredArgsConstructor
public class FallbackController {

    private final CashFallbackResolver fallbackResolver;

    @GetMapping("/api/accounts/{id}/fallback-check")
    public ResponseEntity<FallbackCheckResponse> check(@PathVariable("id") UUID id,
                                                       @RequestParam("amount") BigDecimal amount) {
        return ResponseEntity.ok(FallbackCheckResponse.from(fallbackResolver.check(amount, id)));
    }
}
