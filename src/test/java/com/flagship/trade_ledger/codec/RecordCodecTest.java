package com.flagship.trade_ledger.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.trade_ledger.account.Account;
import com.flagship.trade_ledger.config.JacksonConfig;
import com.flagship.trade_ledger.exception.CorruptRecordException;
import com.flagship.trade_ledger.exception.NotFoundException;
import com.flagship.trade_ledger.invoice.Invoice;
import com.flagship.trade_ledger.invoice.InvoiceStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the stored JSON form of accounts, invoices and indexes.
 */
class RecordCodecTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private final RecordCodec codec = new RecordCodec(objectMapper);

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Accounts")
    class Accounts {

        @Test
        @DisplayName("Encodes lower-case string fields and decodes back to the same account")
        void roundTrip() throws Exception {
            Account account = Account.builder()
                .accountNumber("A001")
                .ownerName("alice")
                .currency("USD")
                .balance(new BigDecimal("500.00"))
                .build();

            byte[] bytes = codec.encodeAccount(account);
            JsonNode node = objectMapper.readTree(bytes);

            assertEquals("A001", node.get("accountnumber").asText());
            assertEquals("alice", node.get("ownername").asText());
            assertEquals("USD", node.get("currency").asText());
            assertTrue(node.get("balance").isTextual());
            assertEquals("500.00", node.get("balance").asText());
            assertEquals(account, codec.decodeAccount("A001", bytes));
        }

        @Test
        @DisplayName("Reads balances written in exponential notation")
        void readsExponentialBalance() {
            Account account = codec.decodeAccount("A001", json(
                "{\"accountnumber\":\"A001\",\"ownername\":\"alice\",\"currency\":\"USD\",\"balance\":\"3E+2\"}"));

            assertEquals(0, new BigDecimal("300").compareTo(account.getBalance()));
        }

        @Test
        @DisplayName("Non-JSON bytes are corrupt; JSON of another shape is not found")
        void distinguishesCorruptFromWrongShape() {
            assertThrows(CorruptRecordException.class, () -> codec.decodeAccount("A001", json("garbage")));
            assertThrows(NotFoundException.class, () -> codec.decodeAccount("A001", json("{\"invoiceid\":\"X\"}")));
            assertThrows(NotFoundException.class, () -> codec.decodeAccount("A001", json("[1,2]")));
        }

        @Test
        @DisplayName("A balance that is not a decimal makes the record corrupt")
        void badBalance() {
            assertThrows(CorruptRecordException.class, () -> codec.decodeAccount("A001", json(
                "{\"accountnumber\":\"A001\",\"ownername\":\"a\",\"currency\":\"USD\",\"balance\":\"lots\"}")));
        }

        @Test
        @DisplayName("A stored balance outside the supported range makes the record corrupt")
        void outOfRangeBalance() {
            assertThrows(CorruptRecordException.class, () -> codec.decodeAccount("A001", json(
                "{\"accountnumber\":\"A001\",\"ownername\":\"a\",\"currency\":\"USD\",\"balance\":\"1E-999999999\"}")));
        }

        @Test
        @DisplayName("Peek yields empty instead of failing")
        void peekIsLenient() {
            assertTrue(codec.peekAccount("A001", json("garbage")).isEmpty());
            assertTrue(codec.peekAccount("A001", json("{}")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Invoices")
    class Invoices {

        @Test
        @DisplayName("Unset fields are written as UNDEFINED and read back as null")
        void undefinedSentinel() throws Exception {
            Invoice invoice = Invoice.create("INV1", new BigDecimal("100.00"), "USD", "supplier1", "payer1", null);

            byte[] bytes = codec.encodeInvoice(invoice);
            JsonNode node = objectMapper.readTree(bytes);

            assertEquals(RecordCodec.UNDEFINED, node.get("buyer").asText());
            assertEquals(RecordCodec.UNDEFINED, node.get("duedate").asText());
            assertEquals(RecordCodec.UNDEFINED, node.get("discount").asText());
            assertTrue(node.get("status").isInt());
            assertEquals(0, node.get("status").asInt());
            assertEquals(invoice, codec.decodeInvoice("INV1", bytes));
        }

        @Test
        @DisplayName("Accepted invoice round-trips with every field set")
        void acceptedRoundTrip() {
            Invoice invoice = Invoice.create("INV1", new BigDecimal("100.00"), "USD", "supplier1", "payer1", "2026-12-31")
                .offer(new BigDecimal("5.00"))
                .accept("buyer1");

            Invoice decoded = codec.decodeInvoice("INV1", codec.encodeInvoice(invoice));

            assertEquals(invoice, decoded);
            assertEquals(InvoiceStatus.ACCEPTED, decoded.getStatus());
        }

        @Test
        @DisplayName("Status stored as a numeric string is accepted; unknown codes are corrupt")
        void statusForms() {
            String template = "{\"invoiceid\":\"INV1\",\"amount\":\"1\",\"currency\":\"USD\",\"supplier\":\"s\","
                + "\"payer\":\"p\",\"buyer\":\"UNDEFINED\",\"duedate\":\"UNDEFINED\",\"discount\":\"UNDEFINED\","
                + "\"status\":%s}";

            assertEquals(InvoiceStatus.OFFERED,
                codec.decodeInvoice("INV1", json(String.format(template, "\"1\""))).getStatus());
            assertThrows(CorruptRecordException.class,
                () -> codec.decodeInvoice("INV1", json(String.format(template, "7"))));
            assertThrows(CorruptRecordException.class,
                () -> codec.decodeInvoice("INV1", json(String.format(template, "\"open\""))));
        }

        @Test
        @DisplayName("A list of invoices encodes as a JSON array")
        void encodesList() throws Exception {
            Invoice first = Invoice.create("INV1", BigDecimal.ONE, "USD", "s", "p", null);
            Invoice second = Invoice.create("INV2", BigDecimal.TEN, "USD", "s", "p", null);

            JsonNode array = objectMapper.readTree(codec.encodeInvoices(List.of(first, second)));

            assertTrue(array.isArray());
            assertEquals(2, array.size());
            assertEquals("INV2", array.get(1).get("invoiceid").asText());
            assertEquals("[]", new String(codec.encodeInvoices(List.of()), StandardCharsets.UTF_8));
        }
    }

    @Nested
    @DisplayName("Indexes")
    class Indexes {

        @Test
        @DisplayName("Index keeps entry order")
        void indexRoundTrip() {
            byte[] bytes = codec.encodeIndex("accountnumbers", List.of("B", "A", "C"));

            assertEquals("{\"accountnumbers\":[\"B\",\"A\",\"C\"]}", new String(bytes, StandardCharsets.UTF_8));
            assertEquals(List.of("B", "A", "C"), codec.decodeIndex("_accountindex", "accountnumbers", bytes));
        }

        @Test
        @DisplayName("Null list reads as empty; missing field is corrupt")
        void indexEdgeCases() {
            assertTrue(codec.decodeIndex("_i", "invoiceids", json("{\"invoiceids\":null}")).isEmpty());
            assertThrows(CorruptRecordException.class,
                () -> codec.decodeIndex("_i", "invoiceids", json("{\"accountnumbers\":[]}")));
            assertThrows(CorruptRecordException.class,
                () -> codec.decodeIndex("_i", "invoiceids", json("{\"invoiceids\":\"INV1\"}")));
        }
    }
}
