package com.flagship.trade_ledger.exception;

import java.math.BigDecimal;

/**
 * A transfer would leave the source account with a negative balance.
 */
public class InsufficientFundsException extends LedgerException {

    private final String accountNumber;
    private final BigDecimal balance;
    private final BigDecimal requested;

    public InsufficientFundsException(String accountNumber, BigDecimal balance, BigDecimal requested) {
        super(ErrorCode.INSUFFICIENT_FUNDS,
            String.format("%s doesn't have enough balance to complete transaction: balance=%s, requested=%s",
                accountNumber, balance.toPlainString(), requested.toPlainString()));
        this.accountNumber = accountNumber;
        this.balance = balance;
        this.requested = requested;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public BigDecimal getBalance() {
        return balance;
    }

    public BigDecimal getRequested() {
        return requested;
    }
}
