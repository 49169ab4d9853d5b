package com.flagship.retail_ledger.error;

import java.util.UUID;

public class NoChangeRequestedException extends LedgerException {

    public NoChangeRequestedException(UUID expenseId) {
        super("Adjustment of expense " + expenseId + " does not change its amount or payment account");
        addDetail("expense_id", expenseId);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.NO_CHANGE_REQUESTED;
    }
}
