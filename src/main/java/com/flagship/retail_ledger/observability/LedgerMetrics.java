package com.flagship.retail_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.account.movements: balance mutations by entry type
 * - ledger.account.insufficient_funds: rejected debits by account kind
 * - ledger.expense.payments: payment attempts by outcome
 * - ledger.expense.adjustments: adjustment records by reason
 * - ledger.debt.payments: receivable/payable payments by kind
 * - ledger.operation.latency: latency of mutating operations
 * - ledger.patrimony.duration: time taken to compute a snapshot
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer patrimonyTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.patrimonyTimer = Timer.builder("ledger.patrimony.duration")
                .description("Time taken to compute a patrimony snapshot")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordAccountMovement(String entryType) {
        registry.counter("ledger.account.movements",
                "type", sanitizeTag(entryType)
        ).increment();
    }

    public void recordInsufficientFunds(String accountKind) {
        registry.counter("ledger.account.insufficient_funds",
                "kind", sanitizeTag(accountKind)
        ).increment();
    }

    /**
     * Records a payment attempt. Outcome is one of success, needs_fallback,
     * insufficient_funds, invalid, conflict or error.
     */
    public void recordExpensePayment(String outcome, boolean fallbackUsed) {
        registry.counter("ledger.expense.payments",
                "outcome", sanitizeTag(outcome),
                "fallback_used", String.valueOf(fallbackUsed)
        ).increment();
    }

    public void recordAdjustment(String reason) {
        registry.counter("ledger.expense.adjustments",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordDebtPayment(String kind) {
        registry.counter("ledger.debt.payments",
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public <T> T timePatrimony(Supplier<T> operation) {
        return patrimonyTimer.record(operation);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
