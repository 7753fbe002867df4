package com.flagship.trade_ledger.store;

import com.flagship.trade_ledger.exception.StoreAccessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * World state kept in a single {@code world_state} table.
 *
 * Plain JDBC, no JPA: every key is one row and the value column holds the raw
 * record bytes. A write set is applied inside one database transaction, so the
 * writes of a ledger operation commit or roll back together. Operations are
 * serialised with a transaction-scoped advisory lock, so concurrent callers,
 * including other application instances, never interleave a read-validate-write span.
 */
@Slf4j
public class JdbcLedgerStore implements ScannableLedgerStore, AtomicBatchStore {

    private static final String SELECT_VALUE =
        "SELECT state_value FROM world_state WHERE state_key = ?";
    private static final String UPSERT_VALUE =
        "INSERT INTO world_state (state_key, state_value, updated_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
        "ON CONFLICT (state_key) DO UPDATE SET state_value = EXCLUDED.state_value, updated_at = CURRENT_TIMESTAMP";
    private static final String DELETE_VALUE =
        "DELETE FROM world_state WHERE state_key = ?";
    private static final String SELECT_KEYS =
        "SELECT state_key FROM world_state ORDER BY state_key";
    private static final String ACQUIRE_OPERATION_LOCK =
        "SELECT pg_advisory_xact_lock(?)";
    // Arbitrary, shared by every instance pointing at the same database
    private static final long OPERATION_LOCK_ID = 7_301_245_001L;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public JdbcLedgerStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public Optional<byte[]> get(String key) {
        try {
            List<byte[]> rows = jdbcTemplate.query(SELECT_VALUE, (rs, rowNum) -> rs.getBytes("state_value"), key);
            return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
        } catch (DataAccessException e) {
            throw new StoreAccessException("Failed to get state for " + key, e);
        }
    }

    @Override
    public void put(String key, byte[] value) {
        try {
            jdbcTemplate.update(UPSERT_VALUE, key, value);
        } catch (DataAccessException e) {
            throw new StoreAccessException("Failed to put state for " + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            jdbcTemplate.update(DELETE_VALUE, key);
        } catch (DataAccessException e) {
            throw new StoreAccessException("Failed to delete state for " + key, e);
        }
    }

    @Override
    public List<String> keys() {
        try {
            return jdbcTemplate.queryForList(SELECT_KEYS, String.class);
        } catch (DataAccessException e) {
            throw new StoreAccessException("Failed to enumerate world state keys", e);
        }
    }

    @Override
    public <T> T exclusively(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> {
                jdbcTemplate.queryForList(ACQUIRE_OPERATION_LOCK, OPERATION_LOCK_ID);
                return work.get();
            });
        } catch (DataAccessException | TransactionException e) {
            throw new StoreAccessException("Failed to run ledger operation under the operation lock", e);
        }
    }

    @Override
    public void applyAtomically(List<StateWrite> writes) {
        try {
            transactionTemplate.executeWithoutResult(status -> writes.forEach(write -> write.applyTo(this)));
            log.debug("Applied {} writes in one database transaction", writes.size());
        } catch (TransactionException e) {
            throw new StoreAccessException("Failed to commit write set of " + writes.size() + " writes", e);
        }
    }
}
