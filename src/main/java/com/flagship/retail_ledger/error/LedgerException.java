package com.flagship.retail_ledger.error;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class of every business failure raised by the ledger core.
 *
 * Details are exposed as strings so that monetary values travel in their
 * exact decimal form.
 */
public abstract class LedgerException extends RuntimeException {

    private final Map<String, String> details = new LinkedHashMap<>();

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getErrorCode();

    public Map<String, String> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    protected void addDetail(String key, Object value) {
        if (value != null) {
            details.put(key, value instanceof BigDecimal
                    ? ((BigDecimal) value).toPlainString()
                    : value.toString());
        }
    }
}
