package com.flagship.trade_ledger.invoice;

import java.util.Arrays;
import java.util.Optional;

/**
 * Invoice lifecycle: CREATED → OFFERED → ACCEPTED.
 *
 * The code is the integer persisted in the invoice record. Status only moves
 * one step forward; ACCEPTED is terminal.
 */
public enum InvoiceStatus {
    /**
     * Raised by the supplier against a payer.
     */
    CREATED(0),

    /**
     * Put up for trade by the supplier with a discount.
     */
    OFFERED(1),

    /**
     * Bought by a buyer. Terminal.
     */
    ACCEPTED(2);

    private final int code;

    InvoiceStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static Optional<InvoiceStatus> fromCode(int code) {
        return Arrays.stream(values())
            .filter(status -> status.code == code)
            .findFirst();
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        return target.code == this.code + 1;
    }
}
