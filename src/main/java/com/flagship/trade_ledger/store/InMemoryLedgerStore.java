package com.flagship.trade_ledger.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * World state held in process memory.
 *
 * Used for the {@code memory} store type and in tests. Writes are single-key
 * only, so multi-write operations rely on {@link LedgerTransaction} compensation.
 */
public class InMemoryLedgerStore implements ScannableLedgerStore {

    private final ConcurrentNavigableMap<String, byte[]> state = new ConcurrentSkipListMap<>();
    private final ReentrantLock operationLock = new ReentrantLock(true);

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = state.get(key);
        return value == null ? Optional.empty() : Optional.of(value.clone());
    }

    @Override
    public void put(String key, byte[] value) {
        state.put(key, value.clone());
    }

    @Override
    public void delete(String key) {
        state.remove(key);
    }

    @Override
    public <T> T exclusively(Supplier<T> work) {
        operationLock.lock();
        try {
            return work.get();
        } finally {
            operationLock.unlock();
        }
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(state.keySet());
    }

    public int size() {
        return state.size();
    }
}
