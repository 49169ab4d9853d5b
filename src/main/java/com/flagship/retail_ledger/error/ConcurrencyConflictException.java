package com.flagship.retail_ledger.error;

/**
 * A row lock could not be acquired in time, or the row changed underneath
 * the operation. The operation was rolled back and can be retried as is.
 */
public class ConcurrencyConflictException extends LedgerException {

    public ConcurrencyConflictException(String resource, Object id, Throwable cause) {
        super(String.format("Concurrent modification of %s %s, retry the request", resource, id), cause);
        addDetail("resource", resource);
        addDetail("id", id);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.CONCURRENCY_CONFLICT;
    }
}
