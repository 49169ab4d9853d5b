package com.flagship.retail_ledger.error;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy of the ledger core.
 *
 * Each code carries the HTTP status it is rendered with and how a caller
 * can recover from it.
 */
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, Recovery.TERMINAL),
    NOT_FOUND(HttpStatus.NOT_FOUND, Recovery.TERMINAL),
    NO_CHANGE_REQUESTED(HttpStatus.BAD_REQUEST, Recovery.TERMINAL),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY, Recovery.CALLER_ACTION),
    NEEDS_FALLBACK_CONFIRMATION(HttpStatus.CONFLICT, Recovery.CALLER_ACTION),
    CONCURRENCY_CONFLICT(HttpStatus.CONFLICT, Recovery.RETRY);

    private final HttpStatus httpStatus;
    private final Recovery recovery;

    ErrorCode(HttpStatus httpStatus, Recovery recovery) {
        this.httpStatus = httpStatus;
        this.recovery = recovery;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public enum Recovery {
        /**
         * The request must be corrected before it is sent again.
         */
        TERMINAL,

        /**
         * The caller can succeed by acting on the details (confirm the
         * fallback account, reduce the amount).
         */
        CALLER_ACTION,

        /**
         * Safe to resend unchanged: a failed operation leaves no partial state.
         */
        RETRY
    }
}
