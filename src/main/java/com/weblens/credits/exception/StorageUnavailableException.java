package com.weblens.credits.exception;

/**
 * Transient persistence failure. The outcome of the operation is unknown to the
 * caller; retrying with the same transaction or request id is safe.
 */
public class StorageUnavailableException extends CreditLedgerException {
    public StorageUnavailableException(String message) {
        super("STORAGE_UNAVAILABLE", message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super("STORAGE_UNAVAILABLE", message, cause);
    }
}
