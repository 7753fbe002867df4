package com.flagship.trade_ledger.observability;

import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.store.LedgerStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health of the world state store, probed by reading the account index key.
 * A missing index is reported but does not make the store unhealthy.
 */
@Component("ledgerStoreHealth")
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private final LedgerStore store;
    private final LedgerProperties properties;

    public LedgerStoreHealthIndicator(LedgerStore store, LedgerProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    public Health health() {
        try {
            boolean indexPresent = store.get(properties.getKeys().getAccountIndex()).isPresent();
            return Health.up()
                    .withDetail("storeType", properties.getStore().getType().name().toLowerCase())
                    .withDetail("accountIndexPresent", indexPresent)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
