package com.flagship.trade_ledger.exception;

/**
 * Malformed or missing arguments, including non-numeric amounts and arity mismatches.
 */
public class ValidationException extends LedgerException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
