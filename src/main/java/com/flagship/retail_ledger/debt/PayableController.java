package com.flagship.retail_ledger.debt;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/payables")
public class PayableController extends DebtController {

    public PayableController(ReceivablesPayablesLedger ledger) {
        super(ledger, DebtKind.PAYABLE);
    }
}
