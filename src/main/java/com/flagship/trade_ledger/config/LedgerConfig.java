package com.flagship.trade_ledger.config;

import com.flagship.trade_ledger.store.InMemoryLedgerStore;
import com.flagship.trade_ledger.store.JdbcLedgerStore;
import com.flagship.trade_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Selects the world state store from {@code ledger.store.type}.
 *
 * {@code jdbc} (default) keeps state in PostgreSQL and commits each write set
 * in one database transaction. {@code memory} keeps state in the JVM and needs
 * no datasource; see the {@code memory} profile.
 */
@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
@Slf4j
public class LedgerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "ledger.store", name = "type", havingValue = "jdbc", matchIfMissing = true)
    public LedgerStore jdbcLedgerStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        log.info("Using JDBC world state store");
        return new JdbcLedgerStore(jdbcTemplate, new TransactionTemplate(transactionManager));
    }

    @Bean
    @ConditionalOnProperty(prefix = "ledger.store", name = "type", havingValue = "memory")
    public LedgerStore inMemoryLedgerStore() {
        log.warn("Using in-memory world state store; state is lost on restart");
        return new InMemoryLedgerStore();
    }
}
