package com.flagship.trade_ledger.exception;

/**
 * The underlying key/value store rejected a get, put or delete.
 */
public class StoreAccessException extends LedgerException {

    public StoreAccessException(String message, Throwable cause) {
        super(ErrorCode.STORE_FAILURE, message, cause);
    }

    public StoreAccessException(String message) {
        super(ErrorCode.STORE_FAILURE, message);
    }
}
