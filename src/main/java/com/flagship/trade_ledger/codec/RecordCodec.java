package com.flagship.trade_ledger.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.trade_ledger.account.Account;
import com.flagship.trade_ledger.exception.CorruptRecordException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.index.IndexRepairReport;
import com.flagship.trade_ledger.invoice.Invoice;
import com.flagship.trade_ledger.invoice.InvoiceStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JSON encoding of the records kept in the world state.
 *
 * Records are built as Jackson trees from typed values and written as UTF-8
 * JSON objects with lower-case field names. Every field is a string except the
 * invoice {@code status}, which is the integer status code. Unset optional
 * invoice fields are stored as {@value #UNDEFINED}.
 *
 * Decoding distinguishes two failures: bytes that are not JSON raise
 * {@link CorruptRecordException}; JSON that is not the requested kind of
 * record raises {@link NotFoundException}.
 */
@Component
public class RecordCodec {

    public static final String UNDEFINED = "UNDEFINED";

    static final String ACCOUNT_NUMBER = "accountnumber";
    static final String OWNER_NAME = "ownername";
    static final String CURRENCY = "currency";
    static final String BALANCE = "balance";

    static final String INVOICE_ID = "invoiceid";
    static final String AMOUNT = "amount";
    static final String SUPPLIER = "supplier";
    static final String PAYER = "payer";
    static final String BUYER = "buyer";
    static final String DUE_DATE = "duedate";
    static final String DISCOUNT = "discount";
    static final String STATUS = "status";

    private final ObjectMapper objectMapper;

    public RecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ==================== Accounts ====================

    public byte[] encodeAccount(Account account) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(ACCOUNT_NUMBER, account.getAccountNumber());
        node.put(OWNER_NAME, account.getOwnerName());
        node.put(CURRENCY, account.getCurrency());
        node.put(BALANCE, DecimalCodec.format(account.getBalance()));
        return write(node);
    }

    public Account decodeAccount(String key, byte[] bytes) {
        JsonNode node = parse(key, bytes);
        if (!node.isObject() || !node.hasNonNull(ACCOUNT_NUMBER)) {
            throw new NotFoundException(key, "Record at key '" + key + "' is not an account");
        }
        return Account.builder()
            .accountNumber(node.get(ACCOUNT_NUMBER).asText())
            .ownerName(text(node, OWNER_NAME))
            .currency(text(node, CURRENCY))
            .balance(DecimalCodec.decodeStored(key, BALANCE, text(node, BALANCE)))
            .build();
    }

    /**
     * Lenient decode used for existence checks: anything that is not a readable
     * account yields empty instead of an error.
     */
    public Optional<Account> peekAccount(String key, byte[] bytes) {
        try {
            return Optional.of(decodeAccount(key, bytes));
        } catch (NotFoundException | CorruptRecordException e) {
            return Optional.empty();
        }
    }

    // ==================== Invoices ====================

    public byte[] encodeInvoice(Invoice invoice) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(INVOICE_ID, invoice.getInvoiceId());
        node.put(AMOUNT, DecimalCodec.format(invoice.getAmount()));
        node.put(CURRENCY, invoice.getCurrency());
        node.put(SUPPLIER, invoice.getSupplier());
        node.put(PAYER, invoice.getPayer());
        node.put(BUYER, orUndefined(invoice.getBuyer()));
        node.put(DUE_DATE, orUndefined(invoice.getDueDate()));
        node.put(DISCOUNT, invoice.getDiscount() == null ? UNDEFINED : DecimalCodec.format(invoice.getDiscount()));
        node.put(STATUS, invoice.getStatus().getCode());
        return write(node);
    }

    public Invoice decodeInvoice(String key, byte[] bytes) {
        JsonNode node = parse(key, bytes);
        if (!node.isObject() || !node.hasNonNull(INVOICE_ID)) {
            throw new NotFoundException(key, "Record at key '" + key + "' is not an invoice");
        }
        String discount = undefinedToNull(text(node, DISCOUNT));
        return Invoice.builder()
            .invoiceId(node.get(INVOICE_ID).asText())
            .amount(DecimalCodec.decodeStored(key, AMOUNT, text(node, AMOUNT)))
            .currency(text(node, CURRENCY))
            .supplier(text(node, SUPPLIER))
            .payer(text(node, PAYER))
            .buyer(undefinedToNull(text(node, BUYER)))
            .dueDate(undefinedToNull(text(node, DUE_DATE)))
            .discount(discount == null ? null : DecimalCodec.decodeStored(key, DISCOUNT, discount))
            .status(decodeStatus(key, node.get(STATUS)))
            .build();
    }

    /**
     * Encodes a sequence of invoices as one JSON array of invoice records.
     */
    public byte[] encodeInvoices(List<Invoice> invoices) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Invoice invoice : invoices) {
            array.add(parse(invoice.getInvoiceId(), encodeInvoice(invoice)));
        }
        return write(array);
    }

    public byte[] encodeAccounts(List<Account> accounts) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Account account : accounts) {
            array.add(parse(account.getAccountNumber(), encodeAccount(account)));
        }
        return write(array);
    }

    // ==================== Indexes ====================

    public byte[] encodeIndex(String field, List<String> ids) {
        ObjectNode node = objectMapper.createObjectNode();
        ArrayNode entries = node.putArray(field);
        ids.forEach(entries::add);
        return write(node);
    }

    /**
     * Decodes an index record. A JSON {@code null} list reads as empty.
     */
    public List<String> decodeIndex(String key, String field, byte[] bytes) {
        JsonNode node = parse(key, bytes);
        if (!node.isObject() || !node.has(field)) {
            throw new CorruptRecordException(key, "index record has no '" + field + "' list");
        }
        JsonNode entries = node.get(field);
        List<String> ids = new ArrayList<>();
        if (entries.isNull()) {
            return ids;
        }
        if (!entries.isArray()) {
            throw new CorruptRecordException(key, "index field '" + field + "' is not a list");
        }
        entries.forEach(entry -> ids.add(entry.asText()));
        return ids;
    }

    /**
     * Encodes reconciliation outcomes as a JSON array, one object per index.
     */
    public byte[] encodeRepairReports(List<IndexRepairReport> reports) {
        ArrayNode array = objectMapper.createArrayNode();
        for (IndexRepairReport report : reports) {
            ObjectNode node = array.addObject();
            node.put("index", report.getIndexKey());
            node.put("entriesbefore", report.getEntriesBefore());
            node.put("entriesafter", report.getEntriesAfter());
            report.getRemoved().forEach(node.putArray("removed")::add);
            report.getAdded().forEach(node.putArray("added")::add);
            node.put("scanned", report.isScanned());
            node.put("rebuilt", report.isRebuilt());
        }
        return write(array);
    }

    // ==================== Helpers ====================

    private InvoiceStatus decodeStatus(String key, JsonNode status) {
        if (status == null || status.isNull()) {
            throw new CorruptRecordException(key, "invoice has no status");
        }
        int code;
        if (status.isInt()) {
            code = status.asInt();
        } else if (status.isTextual() && status.asText().matches("\\d+")) {
            code = Integer.parseInt(status.asText());
        } else {
            throw new CorruptRecordException(key, "invoice status is not a number: " + status);
        }
        return InvoiceStatus.fromCode(code)
            .orElseThrow(() -> new CorruptRecordException(key, "unknown invoice status " + code));
    }

    private JsonNode parse(String key, byte[] bytes) {
        try {
            JsonNode node = objectMapper.readTree(bytes);
            if (node == null || node.isMissingNode()) {
                throw new CorruptRecordException(key, "record is empty");
            }
            return node;
        } catch (IOException e) {
            throw new CorruptRecordException(key, e);
        }
    }

    private byte[] write(JsonNode node) {
        try {
            return objectMapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode record", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String orUndefined(String value) {
        return value == null ? UNDEFINED : value;
    }

    private static String undefinedToNull(String value) {
        return value == null || UNDEFINED.equals(value) ? null : value;
    }
}
