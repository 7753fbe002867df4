package com.flagship.trade_ledger.invoice;

import com.flagship.trade_ledger.exception.InvalidStateException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Invoice domain object with an explicit state machine.
 *
 * Key principles:
 * - Status transitions are explicit and validated
 * - Transitions return a new Invoice, the current one is never modified
 * - Supplier never changes after creation; buyer never changes once bound
 *
 * {@code buyer}, {@code dueDate} and {@code discount} are null while unset.
 */
@Value
@Builder(toBuilder = true)
public class Invoice {
    String invoiceId;
    BigDecimal amount;
    String currency;
    String supplier;
    String payer;
    String buyer;
    String dueDate;
    BigDecimal discount;
    InvoiceStatus status;

    /**
     * Creates a new invoice in CREATED status.
     */
    public static Invoice create(String invoiceId, BigDecimal amount, String currency,
                                 String supplier, String payer, String dueDate) {
        return Invoice.builder()
            .invoiceId(invoiceId)
            .amount(amount)
            .currency(currency)
            .supplier(supplier)
            .payer(payer)
            .dueDate(dueDate)
            .status(InvoiceStatus.CREATED)
            .build();
    }

    /**
     * Puts the invoice up for trade. Only valid from CREATED.
     *
     * @throws InvalidStateException if the invoice is not in CREATED status
     */
    public Invoice offer(BigDecimal discount) {
        requireTransition(InvoiceStatus.OFFERED);
        return toBuilder()
            .discount(discount)
            .status(InvoiceStatus.OFFERED)
            .build();
    }

    /**
     * Binds the buyer. Only valid from OFFERED.
     *
     * @throws InvalidStateException if the invoice is not in OFFERED status
     */
    public Invoice accept(String buyer) {
        requireTransition(InvoiceStatus.ACCEPTED);
        return toBuilder()
            .buyer(buyer)
            .status(InvoiceStatus.ACCEPTED)
            .build();
    }

    /**
     * Checks whether the principal is recorded on this invoice as supplier, payer or buyer.
     */
    public boolean isParticipant(String principal) {
        return principal != null
            && (principal.equals(supplier) || principal.equals(payer) || principal.equals(buyer));
    }

    private void requireTransition(InvoiceStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateException(String.format(
                "Cannot move invoice %s from %s to %s", invoiceId, status, target));
        }
    }
}
