package com.weblens.credits.exception;

public class ValidationException extends CreditLedgerException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
