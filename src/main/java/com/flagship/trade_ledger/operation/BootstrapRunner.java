package com.flagship.trade_ledger.operation;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs {@link LedgerBootstrap#bootstrap()} once the application has started.
 * Disable with {@code ledger.bootstrap.enabled=false}.
 */
@Component
@ConditionalOnProperty(prefix = "ledger.bootstrap", name = "enabled", havingValue = "true", matchIfMissing = true)
public class BootstrapRunner implements ApplicationRunner {

    private final LedgerBootstrap bootstrap;

    public BootstrapRunner(LedgerBootstrap bootstrap) {
        this.bootstrap = bootstrap;
    }

    @Override
    public void run(ApplicationArguments args) {
        bootstrap.bootstrap();
    }
}
