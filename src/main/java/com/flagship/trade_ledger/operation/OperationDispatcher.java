package com.flagship.trade_ledger.operation;

import com.flagship.trade_ledger.account.AccountLedger;
import com.flagship.trade_ledger.codec.FieldValidator;
import com.flagship.trade_ledger.codec.RecordCodec;
import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.LedgerException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.exception.PermissionDeniedException;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.identity.IdentityProvider;
import com.flagship.trade_ledger.invoice.Invoice;
import com.flagship.trade_ledger.invoice.InvoiceLedger;
import com.flagship.trade_ledger.observability.CorrelationContext;
import com.flagship.trade_ledger.observability.LedgerMetrics;
import com.flagship.trade_ledger.store.LedgerStore;
import com.flagship.trade_ledger.store.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * Routes named operations with positional string arguments to the ledgers.
 *
 * {@code invoke} operations may write; {@code query} operations never do.
 * Every call is one serial unit of work and returns bytes: JSON records for
 * ledger objects, plain UTF-8 text for the small informational queries, and
 * an empty array when an operation has nothing to return.
 *
 * Where an operation accepts an explicit caller argument, it must name the
 * authenticated principal.
 */
@Component
@Slf4j
public class OperationDispatcher {

    public static final String INVOKE = "invoke";
    public static final String QUERY = "query";

    static final byte[] EMPTY = new byte[0];
    static final String PING_REPLY = "Hello, world!";

    private final AccountLedger accountLedger;
    private final InvoiceLedger invoiceLedger;
    private final LedgerBootstrap bootstrap;
    private final LedgerStore store;
    private final RecordCodec codec;
    private final LedgerProperties.Keys keys;
    private final LedgerMetrics metrics;

    public OperationDispatcher(AccountLedger accountLedger, InvoiceLedger invoiceLedger, LedgerBootstrap bootstrap,
                               LedgerStore store, RecordCodec codec, LedgerProperties properties,
                               LedgerMetrics metrics) {
        this.accountLedger = accountLedger;
        this.invoiceLedger = invoiceLedger;
        this.bootstrap = bootstrap;
        this.store = store;
        this.codec = codec;
        this.keys = properties.getKeys();
        this.metrics = metrics;
    }

    public byte[] invoke(String operation, List<String> args, IdentityProvider identity) {
        return dispatch(INVOKE, operation, () -> switch (operation) {
            case "init" -> {
                bootstrap.initialize(args);
                yield EMPTY;
            }
            case "init_account" -> {
                requireArgs(operation, args, 4);
                yield codec.encodeAccount(
                    accountLedger.createAccount(args.get(0), args.get(1), args.get(2), args.get(3)));
            }
            case "transfer_balance" -> {
                requireArgs(operation, args, 3);
                AccountLedger.Transfer transfer = accountLedger.transferBalance(args.get(0), args.get(1), args.get(2));
                metrics.recordTransfer(transfer.getFrom().getCurrency(), transfer.getAmount());
                yield codec.encodeAccounts(List.of(transfer.getFrom(), transfer.getTo()));
            }
            case "delete" -> {
                requireArgs(operation, args, 1);
                accountLedger.deleteAccount(args.get(0));
                yield EMPTY;
            }
            case "write" -> {
                requireArgs(operation, args, 2);
                yield write(args.get(0), args.get(1));
            }
            case "create_invoice" -> createInvoice(args, identity);
            case "offer_trade" -> {
                requireArgs(operation, args, 2, 3);
                String caller = caller(args, 2, identity);
                yield codec.encodeInvoice(invoiceLedger.offerTrade(args.get(0), args.get(1), caller));
            }
            case "accept_trade" -> {
                requireArgs(operation, args, 1, 2);
                String caller = caller(args, 1, identity);
                yield codec.encodeInvoice(invoiceLedger.acceptTrade(args.get(0), caller));
            }
            case "reconcile_indexes" -> {
                requireArgs(operation, args, 0);
                yield reconcileIndexes();
            }
            default -> throw unknown(operation);
        });
    }

    public byte[] query(String operation, List<String> args, IdentityProvider identity) {
        return dispatch(QUERY, operation, () -> switch (operation) {
            case "read" -> {
                requireArgs(operation, args, 1);
                String key = args.get(0);
                FieldValidator.requireNonEmpty(key, "key");
                yield store.exclusively(() -> store.get(key)
                    .orElseThrow(() -> new NotFoundException(key, "No state found for key " + key)));
            }
            case "get_account" -> {
                requireArgs(operation, args, 1);
                yield codec.encodeAccount(accountLedger.getAccount(args.get(0)));
            }
            case "get_accounts" -> {
                requireArgs(operation, args, 0);
                yield codec.encodeAccounts(accountLedger.listAccounts());
            }
            case "get_invoice_details" -> {
                requireArgs(operation, args, 1, 2);
                String caller = caller(args, 1, identity);
                yield codec.encodeInvoice(invoiceLedger.getInvoiceDetails(args.get(0), caller));
            }
            case "get_invoices" -> {
                requireArgs(operation, args, 0, 1);
                String caller = caller(args, 0, identity);
                yield codec.encodeInvoices(invoiceLedger.listInvoices(caller));
            }
            case "get_opening_trade_invoices" -> {
                requireArgs(operation, args, 0);
                yield codec.encodeInvoices(invoiceLedger.listOpenTradeOffers());
            }
            case "check_unique_invoice" -> {
                requireArgs(operation, args, 1);
                yield text(String.valueOf(invoiceLedger.checkUniqueInvoice(args.get(0))));
            }
            case "get_username" -> {
                requireArgs(operation, args, 0);
                yield text(identity.findAttribute("username").orElseGet(identity::currentPrincipal));
            }
            case "ping" -> {
                requireArgs(operation, args, 0);
                yield text(PING_REPLY);
            }
            default -> throw unknown(operation);
        });
    }

    private byte[] dispatch(String verb, String operation, Supplier<byte[]> handler) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.OPERATION_MDC_KEY, operation);
        try {
            log.debug("Dispatching {} {}", verb, operation);
            byte[] result = handler.get();
            metrics.recordOperation(operation, verb, "success", System.currentTimeMillis() - startTime);
            return result;
        } catch (LedgerException e) {
            metrics.recordOperation(operation, verb, e.getErrorCode().name().toLowerCase(),
                System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.OPERATION_MDC_KEY);
        }
    }

    /**
     * Three arguments take the supplier from the caller's identity; four or
     * five assert the supplier explicitly and may add a due date.
     */
    private byte[] createInvoice(List<String> args, IdentityProvider identity) {
        requireArgs("create_invoice", args, 3, 5);
        String caller = identity.currentPrincipal();
        Invoice invoice;
        if (args.size() == 3) {
            invoice = invoiceLedger.createInvoice(caller, args.get(0), args.get(1), caller, args.get(2), null);
        } else {
            String dueDate = args.size() == 5 ? args.get(4) : null;
            invoice = invoiceLedger.createInvoice(caller, args.get(0), args.get(1), args.get(2), args.get(3), dueDate);
        }
        return codec.encodeInvoice(invoice);
    }

    private byte[] write(String key, String value) {
        FieldValidator.requireNonEmpty(key, "key");
        if (keys.isReserved(key)) {
            throw new ValidationException(
                "Key '" + key + "' uses the reserved prefix '" + keys.getReservedPrefix() + "'");
        }
        store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            tx.put(key, value.getBytes(StandardCharsets.UTF_8));
            tx.commit();
            return null;
        });
        log.info("Raw state written: key={}", key);
        return EMPTY;
    }

    private byte[] reconcileIndexes() {
        var reports = List.of(accountLedger.reconcileIndex(), invoiceLedger.reconcileIndex());
        reports.stream()
            .filter(report -> report.isRepaired())
            .forEach(report -> metrics.incrementIndexRepairs());
        return codec.encodeRepairReports(reports);
    }

    /**
     * The caller named at {@code position} when present, else the authenticated principal.
     */
    private static String caller(List<String> args, int position, IdentityProvider identity) {
        String authenticated = identity.currentPrincipal();
        if (args.size() <= position) {
            return authenticated;
        }
        String asserted = args.get(position);
        if (!authenticated.equals(asserted)) {
            throw new PermissionDeniedException(String.format(
                "Permission Denied. Caller %s cannot act as %s", authenticated, asserted));
        }
        return asserted;
    }

    private static void requireArgs(String operation, List<String> args, int expected) {
        if (args.size() != expected) {
            throw new ValidationException(String.format(
                "Incorrect number of arguments for %s. Expecting %d", operation, expected));
        }
    }

    private static void requireArgs(String operation, List<String> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new ValidationException(String.format(
                "Incorrect number of arguments for %s. Expecting %d to %d", operation, min, max));
        }
    }

    private static ValidationException unknown(String operation) {
        return new ValidationException("Received unknown function invocation: " + operation);
    }

    private static byte[] text(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
