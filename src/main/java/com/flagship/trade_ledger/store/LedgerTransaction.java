package com.flagship.trade_ledger.store;

import com.flagship.trade_ledger.exception.StoreAccessException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unit of work for one ledger operation.
 *
 * Reads go straight to the store. Writes are buffered in order and applied by
 * {@link #commit()}:
 * <ul>
 *   <li>an {@link AtomicBatchStore} receives the whole write set at once and
 *       commits it all-or-nothing;</li>
 *   <li>any other store gets the writes one by one. Before-images of every
 *       written key are read first; if a write fails, the writes already
 *       applied are restored from those images in reverse order and the
 *       original failure is rethrown.</li>
 * </ul>
 * A transaction commits at most once. Dropping it without committing leaves
 * the store untouched.
 */
@Slf4j
public class LedgerTransaction {

    private final LedgerStore store;
    private final Map<String, StateWrite> pending = new LinkedHashMap<>();
    private boolean committed;

    public LedgerTransaction(LedgerStore store) {
        this.store = store;
    }

    public Optional<byte[]> get(String key) {
        StateWrite buffered = pending.get(key);
        if (buffered != null) {
            return buffered.isDelete() ? Optional.empty() : Optional.of(buffered.getValue().clone());
        }
        return store.get(key);
    }

    public void put(String key, byte[] value) {
        ensureOpen();
        pending.remove(key);
        pending.put(key, StateWrite.put(key, value));
    }

    public void delete(String key) {
        ensureOpen();
        pending.remove(key);
        pending.put(key, StateWrite.delete(key));
    }

    public List<StateWrite> pendingWrites() {
        return Collections.unmodifiableList(new ArrayList<>(pending.values()));
    }

    public boolean isCommitted() {
        return committed;
    }

    public void commit() {
        ensureOpen();
        committed = true;
        if (pending.isEmpty()) {
            return;
        }

        List<StateWrite> writes = pendingWrites();
        if (store instanceof AtomicBatchStore batchStore) {
            batchStore.applyAtomically(writes);
        } else {
            applyWithCompensation(writes);
        }
        log.debug("Committed write set: keys={}", pending.keySet());
    }

    private void applyWithCompensation(List<StateWrite> writes) {
        List<StateWrite> beforeImages = new ArrayList<>(writes.size());
        for (StateWrite write : writes) {
            beforeImages.add(store.get(write.getKey())
                .map(previous -> StateWrite.put(write.getKey(), previous))
                .orElseGet(() -> StateWrite.delete(write.getKey())));
        }

        for (int i = 0; i < writes.size(); i++) {
            try {
                writes.get(i).applyTo(store);
            } catch (RuntimeException e) {
                log.warn("Write {} of {} failed for key {}, compensating {} applied writes",
                    i + 1, writes.size(), writes.get(i).getKey(), i);
                compensate(beforeImages.subList(0, i), e);
                throw e;
            }
        }
    }

    private void compensate(List<StateWrite> beforeImages, RuntimeException cause) {
        List<String> unrestored = new ArrayList<>();
        for (int i = beforeImages.size() - 1; i >= 0; i--) {
            StateWrite image = beforeImages.get(i);
            try {
                image.applyTo(store);
            } catch (RuntimeException e) {
                log.error("Failed to restore key {} after partial write", image.getKey(), e);
                unrestored.add(image.getKey());
            }
        }
        if (!unrestored.isEmpty()) {
            throw new StoreAccessException(
                "Partial write could not be compensated for keys " + unrestored
                    + "; run index reconciliation", cause);
        }
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("Ledger transaction already committed");
        }
    }
}
