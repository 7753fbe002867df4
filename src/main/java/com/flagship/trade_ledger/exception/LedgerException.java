package com.flagship.trade_ledger.exception;

/**
 * Base type for every failure a ledger operation reports to its caller.
 *
 * Failures are never retried internally: the first one raised becomes the
 * result of the operation.
 */
public abstract class LedgerException extends RuntimeException {

    private final ErrorCode errorCode;

    protected LedgerException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected LedgerException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
