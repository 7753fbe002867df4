package com.flagship.trade_ledger.invoice;

import com.flagship.trade_ledger.authorization.Action;
import com.flagship.trade_ledger.authorization.AuthorizationPolicy;
import com.flagship.trade_ledger.codec.DecimalCodec;
import com.flagship.trade_ledger.codec.FieldValidator;
import com.flagship.trade_ledger.codec.RecordCodec;
import com.flagship.trade_ledger.config.LedgerProperties;
import com.flagship.trade_ledger.exception.AlreadyExistsException;
import com.flagship.trade_ledger.exception.CorruptRecordException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.exception.PermissionDeniedException;
import com.flagship.trade_ledger.exception.ValidationException;
import com.flagship.trade_ledger.identity.Role;
import com.flagship.trade_ledger.identity.RoleRegistry;
import com.flagship.trade_ledger.index.IndexMaintainer;
import com.flagship.trade_ledger.index.IndexRepairReport;
import com.flagship.trade_ledger.observability.CorrelationContext;
import com.flagship.trade_ledger.store.LedgerStore;
import com.flagship.trade_ledger.store.LedgerTransaction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Invoice lifecycle and the invoice index.
 *
 * This service enforces the invoice state machine rules:
 * - CREATED → OFFERED (by the invoice's supplier, with a discount)
 * - OFFERED → ACCEPTED (by any principal registered as buyer, who becomes the buyer)
 * - ACCEPTED is terminal
 *
 * Roles are read from the {@link RoleRegistry} on every call and judged by the
 * {@link AuthorizationPolicy}. Invoices are visible only to their supplier,
 * payer and buyer, except through {@link #listOpenTradeOffers()}.
 */
@Service
@Slf4j
public class InvoiceLedger {

    static final String INDEX_FIELD = "invoiceids";

    private final LedgerStore store;
    private final RecordCodec codec;
    private final RoleRegistry roleRegistry;
    private final AuthorizationPolicy policy;
    private final LedgerProperties.Keys keys;
    private final LedgerProperties.Invoices settings;
    private final IndexMaintainer invoiceIndex;

    public InvoiceLedger(LedgerStore store, RecordCodec codec, RoleRegistry roleRegistry,
                         AuthorizationPolicy policy, LedgerProperties properties) {
        this.store = store;
        this.codec = codec;
        this.roleRegistry = roleRegistry;
        this.policy = policy;
        this.keys = properties.getKeys();
        this.settings = properties.getInvoices();
        this.invoiceIndex = new IndexMaintainer(
            keys.getInvoiceIndex(), INDEX_FIELD, keys.getReservedPrefix(), codec);
    }

    /**
     * Creates an invoice in CREATED status and appends it to the invoice index.
     *
     * @param caller   authenticated principal; must be the supplier
     * @param dueDate  ISO-8601 date, or null/empty when not known yet
     * @throws PermissionDeniedException if the caller is not the supplier, the
     *         supplier is not registered as supplier, or the payer is not registered as payer
     * @throws AlreadyExistsException if any record exists under the invoice id
     */
    public Invoice createInvoice(String caller, String invoiceId, String amount,
                                 String supplier, String payer, String dueDate) {
        FieldValidator.requireNonEmpty(invoiceId, "invoiceId");
        FieldValidator.requireNonEmpty(supplier, "supplier");
        FieldValidator.requireNonEmpty(payer, "payer");
        BigDecimal value = DecimalCodec.parsePositive(amount, "amount");
        String due = FieldValidator.optionalIsoDate(dueDate, "dueDate");
        requireUnreserved(invoiceId);

        if (!supplier.equals(caller)) {
            throw new PermissionDeniedException(String.format(
                "Permission Denied. create_invoice. %s cannot raise an invoice as %s", caller, supplier));
        }

        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId);
        try {
            return store.exclusively(() -> {
                LedgerTransaction tx = new LedgerTransaction(store);
                policy.enforce(supplier, roleOf(tx, supplier), Action.CREATE_INVOICE, null);
                if (settings.isValidatePayerRole()) {
                    policy.enforce(payer, roleOf(tx, payer), Action.RECEIVE_INVOICE, null);
                }
                if (tx.get(invoiceId).isPresent()) {
                    throw new AlreadyExistsException("Invoice already exists: " + invoiceId);
                }

                Invoice invoice = Invoice.create(invoiceId, value, settings.getDefaultCurrency(), supplier, payer, due);
                tx.put(invoiceId, codec.encodeInvoice(invoice));
                invoiceIndex.append(tx, invoiceId);
                tx.commit();

                log.info("Invoice created: supplier={}, payer={}, amount={}", supplier, payer, DecimalCodec.format(value));
                return invoice;
            });
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Puts an invoice up for trade (CREATED → OFFERED).
     *
     * @param discount decimal between zero and the invoice amount
     * @throws NotFoundException if the invoice does not exist
     * @throws PermissionDeniedException if the caller is not the invoice's supplier
     * @throws com.flagship.trade_ledger.exception.InvalidStateException if the invoice is not CREATED
     */
    public Invoice offerTrade(String invoiceId, String discount, String caller) {
        FieldValidator.requireNonEmpty(invoiceId, "invoiceId");
        BigDecimal value = DecimalCodec.parseNonNegative(discount, "discount");

        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId);
        try {
            return store.exclusively(() -> {
                LedgerTransaction tx = new LedgerTransaction(store);
                Invoice invoice = loadInvoice(tx, invoiceId);
                policy.enforce(caller, roleOf(tx, caller), Action.OFFER_TRADE, invoice);

                Invoice offered = invoice.offer(value);
                if (value.compareTo(invoice.getAmount()) > 0) {
                    throw new ValidationException(String.format(
                        "discount %s exceeds invoice amount %s",
                        DecimalCodec.format(value), DecimalCodec.format(invoice.getAmount())));
                }

                tx.put(invoiceId, codec.encodeInvoice(offered));
                tx.commit();

                log.info("Invoice offered for trade: supplier={}, discount={}", caller, DecimalCodec.format(value));
                return offered;
            });
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Buys an offered invoice (OFFERED → ACCEPTED) and binds the caller as buyer.
     *
     * @throws NotFoundException if the invoice does not exist
     * @throws PermissionDeniedException if the caller is not registered as buyer
     * @throws com.flagship.trade_ledger.exception.InvalidStateException if the invoice is not OFFERED
     */
    public Invoice acceptTrade(String invoiceId, String caller) {
        FieldValidator.requireNonEmpty(invoiceId, "invoiceId");

        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId);
        try {
            return store.exclusively(() -> {
                LedgerTransaction tx = new LedgerTransaction(store);
                Invoice invoice = loadInvoice(tx, invoiceId);
                policy.enforce(caller, roleOf(tx, caller), Action.ACCEPT_TRADE, invoice);

                Invoice accepted = invoice.accept(caller);
                tx.put(invoiceId, codec.encodeInvoice(accepted));
                tx.commit();

                log.info("Invoice trade accepted: buyer={}", caller);
                return accepted;
            });
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * @throws PermissionDeniedException unless the caller is supplier, payer or buyer on the invoice
     */
    public Invoice getInvoiceDetails(String invoiceId, String caller) {
        FieldValidator.requireNonEmpty(invoiceId, "invoiceId");
        return store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            Invoice invoice = loadInvoice(tx, invoiceId);
            policy.enforce(caller, roleOf(tx, caller), Action.VIEW_INVOICE, invoice);
            return invoice;
        });
    }

    /**
     * Invoices the caller may view, in creation order. Invoices the caller is not
     * a participant of are left out without error.
     */
    public List<Invoice> listInvoices(String caller) {
        return store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            List<Invoice> visible = invoiceIndex.entries(tx).stream()
                .map(invoiceId -> loadInvoice(tx, invoiceId))
                .filter(invoice -> policy.decide(caller, null, Action.VIEW_INVOICE, invoice).isAllowed())
                .toList();
            log.debug("Listed {} invoices visible to {}", visible.size(), caller);
            return visible;
        });
    }

    /**
     * Every invoice currently OFFERED, regardless of who asks.
     */
    public List<Invoice> listOpenTradeOffers() {
        policy.enforce(null, null, Action.LIST_OPEN_OFFERS, null);
        return store.exclusively(() -> {
            LedgerTransaction tx = new LedgerTransaction(store);
            return invoiceIndex.entries(tx).stream()
                .map(invoiceId -> loadInvoice(tx, invoiceId))
                .filter(invoice -> invoice.getStatus() == InvoiceStatus.OFFERED)
                .toList();
        });
    }

    /**
     * @return true when no record exists under the invoice id
     * @throws AlreadyExistsException otherwise
     */
    public boolean checkUniqueInvoice(String invoiceId) {
        FieldValidator.requireNonEmpty(invoiceId, "invoiceId");
        return store.exclusively(() -> {
            if (store.get(invoiceId).isPresent()) {
                throw new AlreadyExistsException("Invoice is not unique: " + invoiceId);
            }
            return true;
        });
    }

    public List<String> invoiceIds() {
        return store.exclusively(() -> invoiceIndex.entries(new LedgerTransaction(store)));
    }

    public void initializeIndex(LedgerTransaction tx) {
        invoiceIndex.initialize(tx);
    }

    public IndexRepairReport reconcileIndex() {
        return store.exclusively(() -> invoiceIndex.reconcile(store, this::isInvoiceRecord));
    }

    private boolean isInvoiceRecord(String key, byte[] bytes) {
        try {
            return key.equals(codec.decodeInvoice(key, bytes).getInvoiceId());
        } catch (NotFoundException | CorruptRecordException e) {
            log.debug("Key {} does not hold an invoice: {}", key, e.getMessage());
            return false;
        }
    }

    private Invoice loadInvoice(LedgerTransaction tx, String invoiceId) {
        byte[] bytes = tx.get(invoiceId)
            .orElseThrow(() -> new NotFoundException(invoiceId, "Invoice not found: " + invoiceId));
        Invoice invoice = codec.decodeInvoice(invoiceId, bytes);
        if (!invoiceId.equals(invoice.getInvoiceId())) {
            throw new NotFoundException(invoiceId, String.format(
                "Record at key '%s' belongs to invoice %s", invoiceId, invoice.getInvoiceId()));
        }
        return invoice;
    }

    private Role roleOf(LedgerTransaction tx, String principal) {
        return principal == null ? null : roleRegistry.roleOf(tx, principal).orElse(null);
    }

    private void requireUnreserved(String key) {
        if (keys.isReserved(key)) {
            throw new ValidationException(
                "Key '" + key + "' uses the reserved prefix '" + keys.getReservedPrefix() + "'");
        }
    }
}
