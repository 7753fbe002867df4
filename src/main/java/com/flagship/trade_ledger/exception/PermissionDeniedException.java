package com.flagship.trade_ledger.exception;

/**
 * A role or ownership check rejected the caller.
 */
public class PermissionDeniedException extends LedgerException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
