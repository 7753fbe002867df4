package com.flagship.trade_ledger.account;

/**
 * How account creation decides that an account number is already taken.
 */
public enum AccountExistenceCheck {
    /**
     * Taken only when the record under the key decodes to an account carrying
     * the same account number. Foreign or unreadable records are overwritten
     * (with a warning).
     */
    FIELD_MATCH,

    /**
     * Taken whenever any record exists under the key.
     */
    KEY_PRESENCE
}
