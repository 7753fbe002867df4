package com.flagship.trade_ledger.store;

import java.util.List;

/**
 * A store that can enumerate its keys.
 * Index reconciliation uses this to find primary records missing from an index.
 */
public interface ScannableLedgerStore extends LedgerStore {

    List<String> keys();
}
