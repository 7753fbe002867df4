package com.flagship.trade_ledger.store;

import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * One buffered change to the world state: a put, or a delete when {@code value} is null.
 */
@Value
public class StateWrite {
    String key;
    byte[] value;

    public static StateWrite put(String key, byte[] value) {
        return new StateWrite(key, value.clone());
    }

    public static StateWrite delete(String key) {
        return new StateWrite(key, null);
    }

    public boolean isDelete() {
        return value == null;
    }

    void applyTo(LedgerStore store) {
        if (isDelete()) {
            store.delete(key);
        } else {
            store.put(key, value);
        }
    }

    @Override
    public String toString() {
        return isDelete()
            ? "DELETE " + key
            : "PUT " + key + "=" + new String(value, StandardCharsets.UTF_8);
    }
}
