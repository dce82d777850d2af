package com.weblens.credits.exception;

/**
 * Base type for every failure the ledger reports to its callers.
 * The code is stable and is what HTTP clients see in the error body.
 */
public abstract class CreditLedgerException extends RuntimeException {

    private final String code;

    protected CreditLedgerException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected CreditLedgerException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
