package com.flagship.retail_ledger.adjustment;

import com.flagship.retail_ledger.adjustment.dto.AdjustExpenseRequest;
import com.flagship.retail_ledger.adjustment.dto.AdjustmentResponse;
import com.flagship.retail_ledger.adjustment.dto.AdjustmentResultResponse;
import com.flagship.retail_ledger.adjustment.dto.RefundExpenseRequest;
import com.flagship.retail_ledger.adjustment.dto.RevertExpenseRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * REST Controller for audited corrections of paid expenses.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AdjustmentController {

    private final AdjustmentEngine adjustmentEngine;

    @PostMapping("/expenses/{id}/adjust")
    public ResponseEntity<AdjustmentResultResponse> adjust(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody AdjustExpenseRequest request) {
        log.info("Received adjustment request: expenseId={}, newAmount={}, newAccountId={}, reason={}",
                id, request.getNewAmount(), request.getNewAccountId(), request.getReason());
        AdjustmentResult result = adjustmentEngine.adjust(
            id,
            request.getNewAmount(),
            request.getNewAccountId(),
            request.getReason(),
            request.getDescription(),
            request.getAdjustedBy()
        );
        return ResponseEntity.ok(AdjustmentResultResponse.from(result));
    }

    @PostMapping("/expenses/{id}/revert")
    public ResponseEntity<AdjustmentResultResponse> revert(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody RevertExpenseRequest request) {
        log.info("Received reversal request: expenseId={}", id);
        AdjustmentResult result = adjustmentEngine.revert(id, request.getDescription(), request.getAdjustedBy());
        return ResponseEntity.ok(AdjustmentResultResponse.from(result));
    }

    @PostMapping("/expenses/{id}/refund")
    public ResponseEntity<AdjustmentResultResponse> refund(@PathVariable("id") UUID id,
                                                           @Valid @RequestBody RefundExpenseRequest request) {
        log.info("Received refund request: expenseId={}, amount={}", id, request.getAmount());
        AdjustmentResult result = adjustmentEngine.refund(
            id, request.getAmount(), request.getDescription(), request.getAdjustedBy());
        return ResponseEntity.ok(AdjustmentResultResponse.from(result));
    }

    @GetMapping("/expenses/{id}/adjustments")
    public ResponseEntity<List<AdjustmentResponse>> history(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(adjustmentEngine.getHistory(id).stream()
            .map(AdjustmentResponse::from)
            .toList());
    }

    @GetMapping("/adjustments")
    public ResponseEntity<List<AdjustmentResponse>> findAdjustments(
            @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "reason", required = false) String reason) {
        AdjustmentReason filter = reason == null || reason.isBlank() ? null : AdjustmentReason.fromValue(reason);
        return ResponseEntity.ok(adjustmentEngine.findAdjustments(from, to, filter).stream()
            .map(AdjustmentResponse::from)
            .toList());
    }
}
