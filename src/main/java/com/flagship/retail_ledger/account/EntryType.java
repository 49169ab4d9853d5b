package com.flagship.retail_ledger.account;

/**
 * Type of a balance journal entry.
 */
public enum EntryType {
    DEBIT,
    CREDIT,

    /**
     * Administrative balance override. Recorded with the difference it
     * introduced and the mandatory reason.
     */
    BALANCE_SET
}
