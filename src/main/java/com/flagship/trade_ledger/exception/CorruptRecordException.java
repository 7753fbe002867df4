package com.flagship.trade_ledger.exception;

/**
 * Stored bytes under a key could not be parsed at all.
 * Distinct from {@link NotFoundException}, which covers well-formed records of the wrong shape.
 */
public class CorruptRecordException extends LedgerException {

    private final String key;

    public CorruptRecordException(String key, Throwable cause) {
        super(ErrorCode.CORRUPT_RECORD, "Corrupt record at key '" + key + "': " + cause.getMessage(), cause);
        this.key = key;
    }

    public CorruptRecordException(String key, String message) {
        super(ErrorCode.CORRUPT_RECORD, "Corrupt record at key '" + key + "': " + message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
