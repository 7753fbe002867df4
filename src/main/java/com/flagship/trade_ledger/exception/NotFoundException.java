package com.flagship.trade_ledger.exception;

/**
 * The key is absent, or the stored record does not have the shape of the
 * requested entity.
 */
public class NotFoundException extends LedgerException {

    private final String key;

    public NotFoundException(String key, String message) {
        super(ErrorCode.NOT_FOUND, message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
