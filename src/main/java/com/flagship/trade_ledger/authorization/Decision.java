package com.flagship.trade_ledger.authorization;

import lombok.Value;

@Value
public class Decision {
    boolean allowed;
    String reason;

    public static Decision allow() {
        return new Decision(true, null);
    }

    public static Decision deny(String reason) {
        return new Decision(false, reason);
    }
}
