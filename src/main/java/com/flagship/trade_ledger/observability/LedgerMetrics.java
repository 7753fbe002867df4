package com.flagship.trade_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: Counter per operation, verb and outcome
 * - ledger.operation.duration: Timer per operation
 * - ledger.transfer.amount: Distribution of transferred amounts per currency
 * - ledger.index.repairs: Counter of index records rewritten by reconciliation
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter indexRepairs;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.indexRepairs = Counter.builder("ledger.index.repairs")
                .description("Number of index records rewritten by reconciliation")
                .register(registry);
    }

    /**
     * @param outcome "success" or the error code of the failure
     */
    public void recordOperation(String operation, String verb, String outcome, long durationMs) {
        registry.counter("ledger.operations",
                "operation", operation,
                "verb", verb,
                "outcome", outcome)
            .increment();

        Timer.builder("ledger.operation.duration")
                .description("Ledger operation latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordTransfer(String currency, BigDecimal amount) {
        DistributionSummary.builder("ledger.transfer.amount")
                .description("Amounts moved between accounts")
                .tag("currency", currency)
                .register(registry)
                .record(amount.doubleValue());
    }

    public void incrementIndexRepairs() {
        indexRepairs.increment();
    }
}
