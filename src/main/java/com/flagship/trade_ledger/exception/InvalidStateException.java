package com.flagship.trade_ledger.exception;

/**
 * An operation was attempted in a state that does not allow it: an invoice
 * transition from the wrong status, or {@code init} on a ledger already set up.
 */
public class InvalidStateException extends LedgerException {

    public InvalidStateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
