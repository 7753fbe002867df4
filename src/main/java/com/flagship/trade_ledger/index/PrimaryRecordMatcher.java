package com.flagship.trade_ledger.index;

/**
 * Tells whether the bytes stored under a key are a live primary record of one category.
 */
@FunctionalInterface
public interface PrimaryRecordMatcher {

    boolean matches(String key, byte[] value);
}
