package com.flagship.retail_ledger.patrimony;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/patrimony")
@RequiredArgsConstructor
public class PatrimonyController {

    private final PatrimonyAggregator patrimonyAggregator;

    @GetMapping
    public ResponseEntity<PatrimonySnapshot> snapshot() {
        return ResponseEntity.ok(patrimonyAggregator.snapshot());
    }
}
