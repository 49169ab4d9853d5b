package com.flagship.retail_ledger.health;

import com.flagship.retail_ledger.account.BalanceAccountRepository;
import com.flagship.retail_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated health check for load balancers.
 * The ledger counts as UP once its account table answers a query.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final BalanceAccountRepository accountRepository;
    private final LedgerProperties properties;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "retail-ledger");
        body.put("timestamp", Instant.now().toString());
        body.put("fallbackPairs", properties.getFallback().getPairs().size());

        try {
            long accounts = accountRepository.count();
            body.put("status", "UP");
            body.put("database", "UP");
            body.put("accounts", accounts);
            return ResponseEntity.ok(body);
        } catch (DataAccessException e) {
            log.warn("Ledger store unreachable: {}", e.getMessage());
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
