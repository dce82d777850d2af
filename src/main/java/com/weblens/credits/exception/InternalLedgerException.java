package com.weblens.credits.exception;

public class InternalLedgerException extends CreditLedgerException {
    public InternalLedgerException(String message, Throwable cause) {
        super("INTERNAL_ERROR", message, cause);
    }
}
