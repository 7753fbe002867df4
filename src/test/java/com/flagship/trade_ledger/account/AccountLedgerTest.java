package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.TestLedger;
import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.AlreadyExistsException;
import com.flagship.trade_ledger.exception.InsufficientFundsException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.store.InMemoryLedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for account creation, transfers, deletion and the account index.
 *
 * Invariants verified:
 * - balances never go negative
 * - a transfer conserves the combined balance
 * - the index lists exactly the live accounts, in creation order
 */
class AccountLedgerTest {

    private TestLedger ledger;
    private AccountLedger accounts;

    @BeforeEach
    void setUp() {
        ledger = new TestLedger(new InMemoryLedgerStore()).withParticipants();
        accounts = ledger.accounts;
    }

    @Nested
    @DisplayName("Create account")
    class CreateAccount {

        @Test
        @DisplayName("Stores the record and appends it to the index")
        void createsAndIndexes() {
            Account account = accounts.createAccount("A001", "Alice", "usd", "500.00");

            assertEquals("A001", account.getAccountNumber());
            assertEquals("alice", account.getOwnerName());
            assertEquals("USD", account.getCurrency());
            assertEquals(new BigDecimal("500.00"), account.getBalance());
            assertEquals(account, accounts.getAccount("A001"));
            assertEquals(List.of("A001"), accounts.accountNumbers());
        }

        @Test
        @DisplayName("Second create with the same number fails and keeps the original record")
        void createIsNotIdempotent() {
            accounts.createAccount("A001", "alice", "USD", "500.00");

            assertThrows(AlreadyExistsException.class,
                () -> accounts.createAccount("A001", "mallory", "USD", "1.00"));

            Account stored = accounts.getAccount("A001");
            assertEquals("alice", stored.getOwnerName());
            assertEquals("500.00", stored.getBalance().toPlainString());
            assertEquals(List.of("A001"), accounts.accountNumbers());
        }

        @Test
        @DisplayName("Rejects empty fields, bad currency, negative or non-numeric balance")
        void rejectsInvalidArguments() {
            assertThrows(ValidationException.class, () -> accounts.createAccount("", "alice", "USD", "1"));
            assertThrows(ValidationException.class, () -> accounts.createAccount("A1", "", "USD", "1"));
            assertThrows(ValidationException.class, () -> accounts.createAccount("A1", "alice", "US", "1"));
            assertThrows(ValidationException.class, () -> accounts.createAccount("A1", "alice", "USD", "-1"));
            assertThrows(ValidationException.class, () -> accounts.createAccount("A1", "alice", "USD", "abc"));
            assertTrue(accounts.accountNumbers().isEmpty());
        }

        @Test
        @DisplayName("Rejects opening balances with extreme exponents")
        void rejectsOutOfRangeBalance() {
            assertThrows(ValidationException.class,
                () -> accounts.createAccount("A1", "alice", "USD", "1E-999999999"));
            assertThrows(ValidationException.class,
                () -> accounts.createAccount("A1", "alice", "USD", "1E+999999999"));
            assertThrows(ValidationException.class,
                () -> accounts.createAccount("A1", "alice", "USD", "0.0000000000000000001"));
            assertTrue(accounts.accountNumbers().isEmpty());

            Account account = accounts.createAccount("A1", "alice", "USD", "1E+29");
            assertEquals(0, new BigDecimal("100000000000000000000000000000").compareTo(account.getBalance()));
        }

        @Test
        @DisplayName("Account numbers may not use the reserved key prefix")
        void rejectsReservedKey() {
            assertThrows(ValidationException.class,
                () -> accounts.createAccount("_accountindex", "alice", "USD", "1"));
        }

        @Test
        @DisplayName("Zero opening balance is allowed")
        void zeroBalanceAllowed() {
            Account account = accounts.createAccount("B001", "bob", "USD", "0.00");
            assertEquals(0, account.getBalance().signum());
        }

        @Test
        @DisplayName("Foreign record at the key is overwritten under field matching")
        void foreignRecordOverwrittenWithFieldMatch() {
            ledger.store.put("A001", "not json".getBytes(StandardCharsets.UTF_8));

            Account account = accounts.createAccount("A001", "alice", "USD", "10");

            assertEquals(account, accounts.getAccount("A001"));
        }

        @Test
        @DisplayName("Any record at the key blocks creation under key presence")
        void foreignRecordBlocksWithKeyPresence() {
            LedgerProperties properties = new LedgerProperties();
            properties.getAccounts().setExistenceCheck(AccountExistenceCheck.KEY_PRESENCE);
            TestLedger strict = new TestLedger(new InMemoryLedgerStore(), properties).withParticipants();
            strict.store.put("A001", "not json".getBytes(StandardCharsets.UTF_8));

            assertThrows(AlreadyExistsException.class,
                () -> strict.accounts.createAccount("A001", "alice", "USD", "10"));
        }
    }

    @Nested
    @DisplayName("Transfer balance")
    class TransferBalance {

        @BeforeEach
        void createAccounts() {
            accounts.createAccount("A001", "alice", "USD", "500.00");
            accounts.createAccount("B001", "bob", "USD", "0.00");
        }

        @Test
        @DisplayName("Moves 200.00 from A001 to B001")
        void transfersBetweenAccounts() {
            AccountLedger.Transfer transfer = accounts.transferBalance("A001", "B001", "200.00");

            assertEquals("300.00", transfer.getFrom().getBalance().toPlainString());
            assertEquals("200.00", transfer.getTo().getBalance().toPlainString());
            assertEquals("300.00", accounts.getAccount("A001").getBalance().toPlainString());
            assertEquals("200.00", accounts.getAccount("B001").getBalance().toPlainString());
        }

        @Test
        @DisplayName("Insufficient funds leaves both balances unchanged")
        void insufficientFunds() {
            accounts.transferBalance("A001", "B001", "200.00");

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                () -> accounts.transferBalance("A001", "B001", "999.00"));

            assertEquals("A001", e.getAccountNumber());
            assertEquals("300.00", accounts.getAccount("A001").getBalance().toPlainString());
            assertEquals("200.00", accounts.getAccount("B001").getBalance().toPlainString());
        }

        @Test
        @DisplayName("Combined balance is conserved across many transfers")
        void conservesTotal() {
            String[] amounts = {"0.01", "123.45", "1E+1", "99.99", "0.10", "50"};
            for (int i = 0; i < amounts.length; i++) {
                String from = i % 2 == 0 ? "A001" : "B001";
                String to = i % 2 == 0 ? "B001" : "A001";
                try {
                    accounts.transferBalance(from, to, amounts[i]);
                } catch (InsufficientFundsException e) {
                    // rejected transfers must not move anything either
                }
                BigDecimal total = accounts.getAccount("A001").getBalance()
                    .add(accounts.getAccount("B001").getBalance());
                assertEquals(0, new BigDecimal("500.00").compareTo(total), "after transfer " + i);
            }
        }

        @Test
        @DisplayName("Exactly the full balance can be moved")
        void transfersWholeBalance() {
            accounts.transferBalance("A001", "B001", "500.00");
            assertEquals(0, accounts.getAccount("A001").getBalance().signum());
        }

        @Test
        @DisplayName("Rejects non-positive or malformed amounts")
        void rejectsInvalidAmount() {
            assertThrows(ValidationException.class, () -> accounts.transferBalance("A001", "B001", "0"));
            assertThrows(ValidationException.class, () -> accounts.transferBalance("A001", "B001", "-5"));
            assertThrows(ValidationException.class, () -> accounts.transferBalance("A001", "B001", "ten"));
        }

        @Test
        @DisplayName("Rejects amounts with extreme exponents and leaves both balances unchanged")
        void rejectsOutOfRangeAmount() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> accounts.transferBalance("A001", "B001", "1E-999999999"));
            assertTrue(e.getMessage().startsWith("amount"));
            assertThrows(ValidationException.class,
                () -> accounts.transferBalance("A001", "B001", "1E+999999999"));

            assertEquals("500.00", accounts.getAccount("A001").getBalance().toPlainString());
            assertEquals("0.00", accounts.getAccount("B001").getBalance().toPlainString());
        }

        @Test
        @DisplayName("A credit that would overflow the supported range is rejected")
        void rejectsOverflowingCredit() {
            accounts.createAccount("C001", "carol", "USD", "999999999999999999999999999999");
            accounts.createAccount("D001", "dave", "USD", "1");

            assertThrows(ValidationException.class, () -> accounts.transferBalance("D001", "C001", "1"));

            assertEquals("1", accounts.getAccount("D001").getBalance().toPlainString());
        }

        @Test
        @DisplayName("Rejects a transfer to the same account")
        void rejectsSelfTransfer() {
            assertThrows(ValidationException.class, () -> accounts.transferBalance("A001", "A001", "1"));
        }

        @Test
        @DisplayName("Rejects accounts held in different currencies")
        void rejectsCurrencyMismatch() {
            accounts.createAccount("E001", "eve", "EUR", "10");
            assertThrows(ValidationException.class, () -> accounts.transferBalance("A001", "E001", "1"));
            assertEquals("500.00", accounts.getAccount("A001").getBalance().toPlainString());
        }

        @Test
        @DisplayName("Unknown account is reported as not found")
        void unknownAccount() {
            NotFoundException e = assertThrows(NotFoundException.class,
                () -> accounts.transferBalance("A001", "Z999", "1"));
            assertEquals("Z999", e.getKey());
        }
    }

    @Nested
    @DisplayName("Delete and list")
    class DeleteAndList {

        @Test
        @DisplayName("Lists accounts in creation order")
        void listsInCreationOrder() {
            accounts.createAccount("C003", "carol", "USD", "1");
            accounts.createAccount("A001", "alice", "USD", "2");
            accounts.createAccount("B002", "bob", "USD", "3");

            List<String> listed = accounts.listAccounts().stream().map(Account::getAccountNumber).toList();
            assertEquals(List.of("C003", "A001", "B002"), listed);
        }

        @Test
        @DisplayName("Delete removes the record and its index entry")
        void deleteRemovesRecordAndEntry() {
            accounts.createAccount("A001", "alice", "USD", "1");
            accounts.createAccount("B001", "bob", "USD", "1");

            assertTrue(accounts.deleteAccount("A001"));

            assertThrows(NotFoundException.class, () -> accounts.getAccount("A001"));
            assertEquals(List.of("B001"), accounts.accountNumbers());
        }

        @Test
        @DisplayName("Delete of an unindexed key still removes the record")
        void deleteUnindexedKey() {
            ledger.store.put("loose", "{}".getBytes(StandardCharsets.UTF_8));

            assertFalse(accounts.deleteAccount("loose"));
            assertTrue(ledger.store.get("loose").isEmpty());
        }

        @Test
        @DisplayName("Reserved keys cannot be deleted")
        void deleteReservedKey() {
            assertThrows(ValidationException.class, () -> accounts.deleteAccount("_accountindex"));
        }

        @Test
        @DisplayName("Empty ledger lists nothing, also before the index exists")
        void emptyLedger() {
            TestLedger fresh = new TestLedger(new InMemoryLedgerStore());
            assertTrue(fresh.accounts.listAccounts().isEmpty());
        }
    }
}
