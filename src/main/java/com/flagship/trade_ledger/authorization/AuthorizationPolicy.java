package com.flagship.trade_ledger.authorization;

import com.flagship.trade_ledger.exception.PermissionDeniedException;
import com.flagship.trade_ledger.identity.Role;
import com.flagship.trade_ledger.invoice.Invoice;
import org.springframework.stereotype.Component;

/**
 * Decides whether a principal may perform an action on an invoice.
 *
 * Pure function of its inputs: the caller's role is looked up by the ledger
 * and passed in, so the rules can be exercised without any storage.
 *
 * Rules:
 * - CREATE_INVOICE: role is supplier
 * - RECEIVE_INVOICE: role is payer
 * - OFFER_TRADE: principal is the invoice's supplier
 * - ACCEPT_TRADE: role is buyer
 * - VIEW_INVOICE: principal is supplier, payer or buyer on the invoice
 * - LIST_OPEN_OFFERS: anyone
 */
@Component
public class AuthorizationPolicy {

    /**
     * @param role     the principal's registered role, null when none is registered
     * @param resource the invoice acted upon, null for actions on no existing invoice
     */
    public Decision decide(String principal, Role role, Action action, Invoice resource) {
        return switch (action) {
            case CREATE_INVOICE -> requireRole(principal, role, Role.SUPPLIER);
            case RECEIVE_INVOICE -> requireRole(principal, role, Role.PAYER);
            case ACCEPT_TRADE -> requireRole(principal, role, Role.BUYER);
            case OFFER_TRADE -> resource != null && principal != null && principal.equals(resource.getSupplier())
                ? Decision.allow()
                : Decision.deny(String.format("%s is not the supplier of the invoice", principal));
            case VIEW_INVOICE -> resource != null && resource.isParticipant(principal)
                ? Decision.allow()
                : Decision.deny(String.format("%s is not a participant of the invoice", principal));
            case LIST_OPEN_OFFERS -> Decision.allow();
        };
    }

    /**
     * @throws PermissionDeniedException if the decision is a denial
     */
    public void enforce(String principal, Role role, Action action, Invoice resource) {
        Decision decision = decide(principal, role, action, resource);
        if (!decision.isAllowed()) {
            throw new PermissionDeniedException(
                String.format("Permission Denied. %s. %s", action.name().toLowerCase(), decision.getReason()));
        }
    }

    private static Decision requireRole(String principal, Role actual, Role required) {
        if (actual == required) {
            return Decision.allow();
        }
        return Decision.deny(String.format("%s has role %s, requires %s",
            principal, actual == null ? "none" : actual.getLabel(), required.getLabel()));
    }
}
