package com.weblens.credits.exception;

public class AccountNotFoundException extends CreditLedgerException {
    public AccountNotFoundException(String walletAddress) {
        super("ACCOUNT_NOT_FOUND", "Credit account not found: wallet='" + walletAddress + "'");
    }
}
