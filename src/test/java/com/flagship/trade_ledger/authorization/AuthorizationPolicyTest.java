package com.flagship.trade_ledger.authorization;

import com.flagship.trade_ledger.exception.PermissionDeniedException;
import com.flagship.trade_ledger.identity.Role;
import com.flagship.trade_ledger.invoice.Invoice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The policy is a pure function, so every rule is checked without a store.
 */
class AuthorizationPolicyTest {

    private final AuthorizationPolicy policy = new AuthorizationPolicy();
    private final Invoice invoice = Invoice.create("INV1", new BigDecimal("100"), "USD", "sup", "pay", null);

    @Test
    @DisplayName("Role-based actions require the matching role")
    void roleBasedActions() {
        assertTrue(policy.decide("sup", Role.SUPPLIER, Action.CREATE_INVOICE, null).isAllowed());
        assertFalse(policy.decide("sup", Role.BUYER, Action.CREATE_INVOICE, null).isAllowed());
        assertFalse(policy.decide("sup", null, Action.CREATE_INVOICE, null).isAllowed());

        assertTrue(policy.decide("pay", Role.PAYER, Action.RECEIVE_INVOICE, null).isAllowed());
        assertFalse(policy.decide("pay", Role.SUPPLIER, Action.RECEIVE_INVOICE, null).isAllowed());

        assertTrue(policy.decide("b", Role.BUYER, Action.ACCEPT_TRADE, invoice).isAllowed());
        assertFalse(policy.decide("b", Role.PAYER, Action.ACCEPT_TRADE, invoice).isAllowed());
    }

    @Test
    @DisplayName("Only the invoice's own supplier may offer it, whatever the role")
    void offerRequiresOwnership() {
        assertTrue(policy.decide("sup", Role.SUPPLIER, Action.OFFER_TRADE, invoice).isAllowed());
        assertFalse(policy.decide("other", Role.SUPPLIER, Action.OFFER_TRADE, invoice).isAllowed());
        assertFalse(policy.decide("sup", Role.SUPPLIER, Action.OFFER_TRADE, null).isAllowed());
    }

    @Test
    @DisplayName("Viewing requires being supplier, payer or buyer on the invoice")
    void viewRequiresParticipation() {
        Invoice accepted = invoice.offer(BigDecimal.ONE).accept("b");

        assertTrue(policy.decide("sup", null, Action.VIEW_INVOICE, accepted).isAllowed());
        assertTrue(policy.decide("pay", null, Action.VIEW_INVOICE, accepted).isAllowed());
        assertTrue(policy.decide("b", null, Action.VIEW_INVOICE, accepted).isAllowed());
        assertFalse(policy.decide("x", Role.BUYER, Action.VIEW_INVOICE, accepted).isAllowed());
    }

    @Test
    @DisplayName("Open offers are listable by anyone")
    void openOffersAllowed() {
        assertTrue(policy.decide(null, null, Action.LIST_OPEN_OFFERS, null).isAllowed());
    }

    @Test
    @DisplayName("Enforce raises PermissionDenied with action and reason")
    void enforceThrows() {
        PermissionDeniedException e = assertThrows(PermissionDeniedException.class,
            () -> policy.enforce("mallory", Role.PAYER, Action.CREATE_INVOICE, null));

        assertTrue(e.getMessage().startsWith("Permission Denied. create_invoice."));
        assertTrue(e.getMessage().contains("mallory"));
    }
}
