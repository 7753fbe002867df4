package com.flagship.trade_ledger.index;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of reconciling one index against its primary records.
 */
@Value
@Builder
public class IndexRepairReport {
    String indexKey;
    int entriesBefore;
    int entriesAfter;
    /** Entries dropped because their primary record is gone, foreign, or duplicated. */
    List<String> removed;
    /** Primary records found by a key scan that the index was missing. */
    List<String> added;
    /** False when the store cannot enumerate keys, so missing entries could not be searched for. */
    boolean scanned;
    /** The stored index could not be decoded and was replaced. */
    boolean rebuilt;

    public boolean isRepaired() {
        return rebuilt || !removed.isEmpty() || !added.isEmpty();
    }
}
