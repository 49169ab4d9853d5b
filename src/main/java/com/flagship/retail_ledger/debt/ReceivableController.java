package com.flagship.retail_ledger.debt;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/receivables")
public class ReceivableController extends DebtController {

    public ReceivableController(ReceivablesPayablesLedger ledger) {
        super(ledger, DebtKind.RECEIVABLE);
    }
}
