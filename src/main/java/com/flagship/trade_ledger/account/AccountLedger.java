package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.codec.DecimalCodec;
import com.flagship.trade_ledger.codec.FieldValidator;
import com.flagship.trade_ledger.codec.RecordCodec;
import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.AlreadyExistsException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.index.IndexMaintainer;
import com.flagship.trade_ledger.index.IndexRepairReport;
import com.flagship.trade_ledger.observability.CorrelationContext;
import com.flagship.trade_ledger.store.LedgerStore;
import com.flagship.trade_ledger.store.LedgerTransaction;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Account records and the account index.
 *
 * This service enforces the core invariants:
 * 1. A balance is never negative
 * 2. A transfer conserves the combined balance of the two accounts exactly
 * 3. The account index lists exactly the accounts created and not deleted
 *
 * Every operation runs in its own {@link LedgerTransaction}: all records are
 * read first, then the new records are written together at commit.
 */
@Service
@Slf4j
public class AccountLedger {

    static final String INDEX_FIELD = "accountnumbers";

    private final LedgerStore store;
    private final RecordCodec codec;
    private final LedgerProperties.Keys keys;
    private final AccountExistenceCheck existenceCheck;
    private final IndexMaintainer accountIndex;

    public AccountLedger(LedgerStore store, RecordCodec codec, LedgerProperties properties) {
        this.store = store;
        this.codec = codec;
        this.keys = properties.getKeys();
        this.existenceCheck = properties.getAccounts().getExistenceCheck();
        this.accountIndex = new IndexMaintainer(
            keys.getAccountIndex(), INDEX_FIELD, keys.getReservedPrefix(), codec);
    }

    /**
     * Creates an account and appends it to the account index.
     *
     * @param initialBalance non-negative decimal string
     * @return the stored account
     * @throws ValidationException if an argument is empty, malformed or negative
     * @throws AlreadyExistsException if the account number is taken
     */
    public Account createAccount(String accountNumber, String ownerName, String currency, String initialBalance) {
        FieldValidator.requireNonEmpty(accountNumber, "accountNumber");
        FieldValidator.requireNonEmpty(ownerName, "ownerName");
        String currencyCode = FieldValidator.requireCurrency(currency);
        BigDecimal balance = DecimalCodec.parseNonNegative(initialBalance, "initialBalance");
        requireUnreserved(accountNumber);

        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountNumber);
        try {
            Account account = store.exclusively(() -> {
                LedgerTransaction tx = new LedgerTransaction(store);
                ensureAvailable(tx, accountNumber);

                Account created = Account.builder()
                    .accountNumber(accountNumber)
                    .ownerName(ownerName.toLowerCase(Locale.ROOT))
                    .currency(currencyCode)
                    .balance(balance)
                    .build();

                tx.put(accountNumber, codec.encodeAccount(created));
                accountIndex.append(tx, accountNumber);
                tx.commit();
                return created;
            });

            log.info("Account created: owner={}, currency={}, balance={}",
                account.getOwnerName(), currencyCode, DecimalCodec.format(balance));
            return account;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Moves {@code amount} from one account to another.
     *
     * Both records are rewritten in one transaction; on any failure neither changes.
     *
     * @throws ValidationException if the amount is not a positive decimal, the
     *         accounts are the same, or their currencies differ
     * @throws NotFoundException if either account does not exist
     * @throws com.flagship.trade_ledger.exception.InsufficientFundsException
     *         if the source balance is lower than the amount
     */
    public Transfer transferBalance(String fromAccount, String toAccount, String amount) {
        FieldValidator.requireNonEmpty(fromAccount, "fromAccount");
        FieldValidator.requireNonEmpty(toAccount, "toAccount");
        BigDecimal value = DecimalCodec.parsePositive(amount, "amount");
        if (fromAccount.equals(toAccount)) {
            throw new ValidationException("From and to accounts must be different");
        }

        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, fromAccount);
        try {
            log.info("Starting transfer: from={}, to={}, amount={}", fromAccount, toAccount, amount);

            return store.exclusively(() -> {
                LedgerTransaction tx = new LedgerTransaction(store);
                Account source = loadAccount(tx, fromAccount);
                Account target = loadAccount(tx, toAccount);

                if (!source.getCurrency().equals(target.getCurrency())) {
                    throw new ValidationException(String.format(
                        "Currency mismatch: %s holds %s, %s holds %s",
                        fromAccount, source.getCurrency(), toAccount, target.getCurrency()));
                }

                Account debited = source.debit(value);
                Account credited = target.credit(value);

                tx.put(fromAccount, codec.encodeAccount(debited));
                tx.put(toAccount, codec.encodeAccount(credited));
                tx.commit();

                log.info("Transfer completed: from={} ({} -> {}), to={} ({} -> {})",
                    fromAccount, DecimalCodec.format(source.getBalance()), DecimalCodec.format(debited.getBalance()),
                    toAccount, DecimalCodec.format(target.getBalance()), DecimalCodec.format(credited.getBalance()));
                return new Transfer(debited, credited, value);
            });
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    /**
     * Raw delete: removes whatever is stored under the key and drops the key from
     * the account index if present. Not type-aware.
     *
     * @return true if an index entry was removed
     */
    public boolean deleteAccount(String key) {
        FieldValidator.requireNonEmpty(key, "key");
        requireUnreserved(key);

        boolean indexed = store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            boolean removed = accountIndex.remove(tx, key);
            tx.delete(key);
            tx.commit();
            return removed;
        });

        log.info("Deleted state: key={}, indexEntryRemoved={}", key, indexed);
        return indexed;
    }

    public Account getAccount(String accountNumber) {
        FieldValidator.requireNonEmpty(accountNumber, "accountNumber");
        return store.exclusively(() -> loadAccount(new LedgerTransaction(store), accountNumber));
    }

    /**
     * All indexed accounts, in creation order.
     */
    public List<Account> listAccounts() {
        return store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            return accountIndex.entries(tx).stream()
                .map(accountNumber -> loadAccount(tx, accountNumber))
                .toList();
        });
    }

    public List<String> accountNumbers() {
        return store.exclusively(() -> accountIndex.entries(new LedgerTransaction(store)));
    }

    public void initializeIndex(LedgerTransaction tx) {
        accountIndex.initialize(tx);
    }

    public IndexRepairReport reconcileIndex() {
        return store.exclusively(() -> accountIndex.reconcile(store, (key, bytes) -> codec.peekAccount(key, bytes)
            .filter(account -> key.equals(account.getAccountNumber()))
            .isPresent()));
    }

    private Account loadAccount(LedgerTransaction tx, String accountNumber) {
        byte[] bytes = tx.get(accountNumber)
            .orElseThrow(() -> new NotFoundException(accountNumber, "Account not found: " + accountNumber));
        Account account = codec.decodeAccount(accountNumber, bytes);
        if (!accountNumber.equals(account.getAccountNumber())) {
            throw new NotFoundException(accountNumber, String.format(
                "Record at key '%s' belongs to account %s", accountNumber, account.getAccountNumber()));
        }
        return account;
    }

    private void ensureAvailable(LedgerTransaction tx, String accountNumber) {
        Optional<byte[]> existing = tx.get(accountNumber);
        if (existing.isEmpty()) {
            return;
        }
        if (existenceCheck == AccountExistenceCheck.KEY_PRESENCE) {
            throw new AlreadyExistsException("A record already exists at key " + accountNumber);
        }
        Optional<Account> stored = codec.peekAccount(accountNumber, existing.get());
        if (stored.isPresent() && accountNumber.equals(stored.get().getAccountNumber())) {
            throw new AlreadyExistsException("This account already exists: " + accountNumber);
        }
        log.warn("Key {} holds a record that is not account {}; it will be overwritten", accountNumber, accountNumber);
    }

    private void requireUnreserved(String key) {
        if (keys.isReserved(key)) {
            throw new ValidationException(
                "Key '" + key + "' uses the reserved prefix '" + keys.getReservedPrefix() + "'");
        }
    }

    /**
     * Result of a completed transfer: both accounts after the move.
     */
    @Value
    public static class Transfer {
        Account from;
        Account to;
        BigDecimal amount;
    }
}
