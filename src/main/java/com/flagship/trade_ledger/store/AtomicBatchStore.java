package com.flagship.trade_ledger.store;

import java.util.List;

/**
 * A store that can apply a whole write set all-or-nothing.
 */
public interface AtomicBatchStore extends LedgerStore {

    void applyAtomically(List<StateWrite> writes);
}
