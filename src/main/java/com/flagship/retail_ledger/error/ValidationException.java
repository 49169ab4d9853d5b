package com.flagship.retail_ledger.error;

/**
 * Malformed or inconsistent input: non-positive amounts, amounts above the
 * outstanding balance, too-short descriptions, invalid state for the request.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String field, String message) {
        super(message);
        addDetail("field", field);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.VALIDATION_ERROR;
    }
}
