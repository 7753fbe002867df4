package com.flagship.trade_ledger.account;

import com.flagship.trade_ledger.codec.DecimalCodec;
import com.flagship.trade_ledger.exception.InsufficientFundsException;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An account record as held in the world state under its account number.
 *
 * Balances are exact decimals and never negative. Balance changes return a
 * new instance; the stored record is only replaced when the surrounding
 * operation commits.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    String accountNumber;
    String ownerName;
    String currency;
    BigDecimal balance;

    /**
     * @throws InsufficientFundsException if the balance would drop below zero
     */
    public Account debit(BigDecimal amount) {
        BigDecimal remaining = balance.subtract(amount);
        if (remaining.signum() < 0) {
            throw new InsufficientFundsException(accountNumber, balance, amount);
        }
        return toBuilder().balance(remaining).build();
    }

    /**
     * @throws com.flagship.trade_ledger.exception.ValidationException if the new
     *         balance would leave the supported decimal range
     */
    public Account credit(BigDecimal amount) {
        BigDecimal updated = balance.add(amount);
        DecimalCodec.requireWithinBounds(updated, "balance of " + accountNumber);
        return toBuilder().balance(updated).build();
    }
}
