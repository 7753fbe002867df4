package com.flagship.trade_ledger.index;

import com.flagship.trade_ledger.codec.RecordCodec;
import com.flagship.trade_ledger.exception.CorruptRecordException;
import com.flagship.trade_ledger.store.LedgerStore;
import com.flagship.trade_ledger.store.LedgerTransaction;
import com.flagship.trade_ledger.store.ScannableLedgerStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps one singleton index record in step with the primary records of its category.
 *
 * The index is stored under a reserved key as {@code {"<field>": [ids...]}} and
 * preserves creation order. An index that was never initialised reads as empty.
 *
 * Invariants:
 * 1. Entries equal the set of live primary keys of the category
 * 2. No entry appears twice
 *
 * Append and remove run inside the caller's {@link LedgerTransaction}, so the
 * index change commits together with the primary record change.
 * {@link #reconcile} repairs an index that drifted anyway (raw writes, a
 * compensation that could not complete).
 */
@Slf4j
public class IndexMaintainer {

    private final String indexKey;
    private final String field;
    private final String reservedPrefix;
    private final RecordCodec codec;

    public IndexMaintainer(String indexKey, String field, String reservedPrefix, RecordCodec codec) {
        this.indexKey = indexKey;
        this.field = field;
        this.reservedPrefix = reservedPrefix;
        this.codec = codec;
    }

    public void initialize(LedgerTransaction tx) {
        tx.put(indexKey, codec.encodeIndex(field, List.of()));
    }

    public List<String> entries(LedgerTransaction tx) {
        return tx.get(indexKey)
            .map(bytes -> codec.decodeIndex(indexKey, field, bytes))
            .orElseGet(ArrayList::new);
    }

    public void append(LedgerTransaction tx, String id) {
        List<String> ids = entries(tx);
        if (ids.contains(id)) {
            log.warn("Index {} already contains {}, not appending a duplicate", indexKey, id);
            return;
        }
        ids.add(id);
        tx.put(indexKey, codec.encodeIndex(field, ids));
        log.debug("Index {} appended {}: size={}", indexKey, id, ids.size());
    }

    /**
     * Removes the first entry equal to {@code id}.
     *
     * @return false when the id was not indexed; the index is then left untouched
     */
    public boolean remove(LedgerTransaction tx, String id) {
        List<String> ids = entries(tx);
        if (!ids.remove(id)) {
            log.debug("Index {} has no entry {}, nothing to remove", indexKey, id);
            return false;
        }
        tx.put(indexKey, codec.encodeIndex(field, ids));
        log.debug("Index {} removed {}: size={}", indexKey, id, ids.size());
        return true;
    }

    /**
     * Verifies every entry against its primary record and rewrites the index if anything is off.
     *
     * Entries whose record is missing or fails {@code matcher} are dropped,
     * together with repeated entries. If the store can enumerate keys, matching
     * primary records absent from the index are appended in key order. An
     * unreadable index record is rebuilt from the scan alone.
     */
    public IndexRepairReport reconcile(LedgerStore store, PrimaryRecordMatcher matcher) {
        LedgerTransaction tx = new LedgerTransaction(store);
        List<String> before;
        boolean unreadable = false;
        try {
            before = entries(tx);
        } catch (CorruptRecordException e) {
            log.warn("Index {} is unreadable, rebuilding it: {}", indexKey, e.getMessage());
            before = List.of();
            unreadable = true;
        }

        Set<String> kept = new LinkedHashSet<>();
        List<String> removed = new ArrayList<>();
        for (String id : before) {
            boolean live = !kept.contains(id)
                && tx.get(id).map(bytes -> matcher.matches(id, bytes)).orElse(false);
            if (live) {
                kept.add(id);
            } else {
                removed.add(id);
            }
        }

        List<String> added = new ArrayList<>();
        boolean scanned = store instanceof ScannableLedgerStore;
        if (store instanceof ScannableLedgerStore scannable) {
            for (String key : scannable.keys()) {
                if (key.startsWith(reservedPrefix) || kept.contains(key)) {
                    continue;
                }
                boolean live = tx.get(key).map(bytes -> matcher.matches(key, bytes)).orElse(false);
                if (live) {
                    kept.add(key);
                    added.add(key);
                }
            }
        }

        IndexRepairReport report = IndexRepairReport.builder()
            .indexKey(indexKey)
            .entriesBefore(before.size())
            .entriesAfter(kept.size())
            .removed(removed)
            .added(added)
            .scanned(scanned)
            .rebuilt(unreadable)
            .build();

        if (report.isRepaired()) {
            tx.put(indexKey, codec.encodeIndex(field, new ArrayList<>(kept)));
            tx.commit();
            log.warn("Index {} repaired: removed={}, added={}", indexKey, removed, added);
        } else {
            log.info("Index {} verified: {} entries, scanned={}", indexKey, kept.size(), scanned);
        }
        return report;
    }
}
