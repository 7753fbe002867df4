package com.flagship.trade_ledger.operation;

import com.flagship.trade_ledger.account.AccountLedger;
import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.InvalidStateException;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.identity.RoleRegistry;
import com.flagship.trade_ledger.invoice.InvoiceLedger;
import com.flagship.trade_ledger.store.LedgerStore;
import com.flagship.trade_ledger.store.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ledger initialisation: empty indexes plus participant role records.
 *
 * {@link #initialize} backs the {@code init} operation and is one-time setup:
 * once either index exists it is refused, so an index is never emptied under
 * live records. {@link #bootstrap} runs at startup and only creates what is
 * missing. Neither replaces a role record that is already present.
 */
@Component
@Slf4j
public class LedgerBootstrap {

    private final LedgerStore store;
    private final AccountLedger accountLedger;
    private final InvoiceLedger invoiceLedger;
    private final RoleRegistry roleRegistry;
    private final LedgerProperties properties;

    public LedgerBootstrap(LedgerStore store, AccountLedger accountLedger, InvoiceLedger invoiceLedger,
                           RoleRegistry roleRegistry, LedgerProperties properties) {
        this.store = store;
        this.accountLedger = accountLedger;
        this.invoiceLedger = invoiceLedger;
        this.roleRegistry = roleRegistry;
        this.properties = properties;
    }

    /**
     * Creates both indexes empty and registers each {@code name, role} pair.
     *
     * @param pairs alternating principal names and role labels; may be empty
     * @throws ValidationException if the list has an odd length or names an unknown role
     * @throws InvalidStateException if either index already exists
     */
    public void initialize(List<String> pairs) {
        if (pairs.size() % 2 != 0) {
            throw new ValidationException(
                "Incorrect number of arguments for init. Expecting name/role pairs, got " + pairs.size());
        }

        store.exclusively(() -> {
            LedgerProperties.Keys keys = properties.getKeys();
            LedgerTransaction tx = new LedgerTransaction(store);
            if (tx.get(keys.getAccountIndex()).isPresent() || tx.get(keys.getInvoiceIndex()).isPresent()) {
                throw new InvalidStateException("Ledger is already initialised");
            }
            accountLedger.initializeIndex(tx);
            invoiceLedger.initializeIndex(tx);
            for (int i = 0; i < pairs.size(); i += 2) {
                roleRegistry.register(tx, pairs.get(i), pairs.get(i + 1));
            }
            tx.commit();
            return null;
        });

        log.info("Ledger initialised: participants={}", pairs.size() / 2);
    }

    /**
     * Creates missing indexes and registers the participants listed under
     * {@code ledger.participants}. Existing indexes and role records are left as they are.
     */
    public void bootstrap() {
        store.exclusively(() -> {
            LedgerProperties.Keys keys = properties.getKeys();
            LedgerTransaction tx = new LedgerTransaction(store);
            if (tx.get(keys.getAccountIndex()).isEmpty()) {
                accountLedger.initializeIndex(tx);
                log.info("Created empty account index at {}", keys.getAccountIndex());
            }
            if (tx.get(keys.getInvoiceIndex()).isEmpty()) {
                invoiceLedger.initializeIndex(tx);
                log.info("Created empty invoice index at {}", keys.getInvoiceIndex());
            }
            for (LedgerProperties.Participant participant : properties.getParticipants()) {
                roleRegistry.register(tx, participant.getName(), participant.getRole());
            }
            tx.commit();
            return null;
        });
    }
}
