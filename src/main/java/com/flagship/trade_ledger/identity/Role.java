package com.flagship.trade_ledger.identity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Participant roles. The label is what the role registry stores.
 */
public enum Role {
    SUPPLIER("supplier"),
    PAYER("payer"),
    BUYER("buyer");

    private final String label;

    Role(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<Role> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(role -> role.label.equals(label))
            .findFirst();
    }
}
