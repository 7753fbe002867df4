package com.flagship.trade_ledger.store;

import com.flagship.trade_ledger.TestLedger;
import com.flagship.trade_ledger.exception.InsufficientFundsException;
import com.flagship.trade_ledger.exception.StoreAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PostgreSQL world state store. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcLedgerStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("trade_ledger_test")
            .withUsername("test")
            .withPassword("test");

    private JdbcTemplate jdbcTemplate;
    private JdbcLedgerStore store;

    @BeforeEach
    void setUp() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);

        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM world_state");
        store = new JdbcLedgerStore(jdbcTemplate, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Put overwrites, get reads back, delete of an absent key is fine")
    void basicOperations() {
        assertTrue(store.get("k").isEmpty());

        store.put("k", bytes("one"));
        store.put("k", bytes("two"));
        assertEquals("two", new String(store.get("k").orElseThrow(), StandardCharsets.UTF_8));

        store.delete("k");
        store.delete("k");
        assertTrue(store.get("k").isEmpty());
    }

    @Test
    @DisplayName("Keys are listed in order")
    void listsKeys() {
        store.put("b", bytes("2"));
        store.put("a", bytes("1"));

        assertEquals(List.of("a", "b"), store.keys());
    }

    @Test
    @DisplayName("A failing write set rolls back completely")
    void writeSetRollsBack() {
        store.put("a", bytes("before"));

        // the second key is longer than the key column allows
        List<StateWrite> writes = List.of(
            StateWrite.put("a", bytes("after")),
            StateWrite.put("b".repeat(600), bytes("x")));

        assertThrows(StoreAccessException.class, () -> store.applyAtomically(writes));

        assertEquals("before", new String(store.get("a").orElseThrow(), StandardCharsets.UTF_8));
        assertEquals(List.of("a"), store.keys());
    }

    @Test
    @DisplayName("Ledger scenarios run unchanged on PostgreSQL")
    void ledgerOnPostgres() {
        TestLedger ledger = new TestLedger(store).withParticipants();

        ledger.accounts.createAccount("A001", "alice", "USD", "500.00");
        ledger.accounts.createAccount("B001", "bob", "USD", "0.00");
        ledger.accounts.transferBalance("A001", "B001", "200.00");

        assertEquals("300.00", ledger.accounts.getAccount("A001").getBalance().toPlainString());
        assertEquals("200.00", ledger.accounts.getAccount("B001").getBalance().toPlainString());
        assertEquals(List.of("A001", "B001"), ledger.accounts.accountNumbers());
    }

    @Test
    @DisplayName("Concurrent transfers are serialised by the operation lock")
    void concurrentTransfersOnPostgres() throws Exception {
        TestLedger ledger = new TestLedger(store).withParticipants();
        ledger.accounts.createAccount("A001", "alice", "USD", "500");
        ledger.accounts.createAccount("B001", "bob", "USD", "0");
        ledger.accounts.createAccount("C001", "carol", "USD", "0");

        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger rejectedCount = new AtomicInteger(0);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        for (String target : List.of("B001", "C001")) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ledger.accounts.transferBalance("A001", target, "400");
                    successCount.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejectedCount.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, successCount.get());
        assertEquals(1, rejectedCount.get());
        assertEquals("100", ledger.accounts.getAccount("A001").getBalance().toPlainString());
        int credited = ledger.accounts.getAccount("B001").getBalance().intValue()
            + ledger.accounts.getAccount("C001").getBalance().intValue();
        assertEquals(400, credited);
    }
}
