package com.flagship.retail_ledger.error;

import java.util.UUID;

public class NotFoundException extends LedgerException {

    public NotFoundException(String resource, UUID id) {
        super(resource + " not found: " + id);
        addDetail("resource", resource);
        addDetail("id", id);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.NOT_FOUND;
    }
}
