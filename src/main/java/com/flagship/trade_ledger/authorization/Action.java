package com.flagship.trade_ledger.authorization;

/**
 * Invoice actions subject to authorization.
 */
public enum Action {
    CREATE_INVOICE,
    /** The counterparty named as payer on a new invoice. */
    RECEIVE_INVOICE,
    OFFER_TRADE,
    ACCEPT_TRADE,
    VIEW_INVOICE,
    LIST_OPEN_OFFERS
}
