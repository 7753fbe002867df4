package com.flagship.trade_ledger.exception;

/**
 * A create operation found an existing record under the requested primary key.
 */
public class AlreadyExistsException extends LedgerException {

    public AlreadyExistsException(String message) {
        super(ErrorCode.ALREADY_EXISTS, message);
    }
}
