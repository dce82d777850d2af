package com.weblens.credits.exception;

import com.weblens.credits.model.Money;

public class InsufficientFundsException extends CreditLedgerException {

    private final long available;
    private final long requested;

    public InsufficientFundsException(String walletAddress, long available, long requested) {
        super("INSUFFICIENT_FUNDS", String.format(
            "Insufficient credits for wallet %s: available=%s, requested=%s",
            walletAddress, Money.toUsd(available).toPlainString(), Money.toUsd(requested).toPlainString()
        ));
        this.available = available;
        this.requested = requested;
    }

    public long getAvailable() {
        return available;
    }

    public long getRequested() {
        return requested;
    }
}
