package com.flagship.trade_ledger.store;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single-key view of the world state the ledger logic runs against.
 *
 * No multi-key transaction is assumed. Implementations raise
 * {@link com.flagship.trade_ledger.exception.StoreAccessException} when the
 * underlying engine rejects an operation.
 */
public interface LedgerStore {

    /**
     * @return the stored bytes, or empty when the key is absent
     */
    Optional<byte[]> get(String key);

    void put(String key, byte[] value);

    /**
     * Removes the key. Deleting an absent key is not an error.
     */
    void delete(String key);

    /**
     * Runs one ledger operation so that no other operation's reads or writes
     * interleave with it. Every read-validate-write span goes through here.
     *
     * @return whatever {@code work} returns
     */
    <T> T exclusively(Supplier<T> work);
}
