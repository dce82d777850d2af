package com.weblens.credits.model;

import com.weblens.credits.exception.ValidationException;

import java.util.Locale;

public final class WalletAddresses {

    private WalletAddresses() {
    }

    /**
     * Canonical storage and routing key: trimmed, lower-cased.
     * {@code 0xABC} and {@code 0xabc} address the same account.
     */
    public static String canonicalize(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw new ValidationException("wallet address is required");
        }
        return walletAddress.trim().toLowerCase(Locale.ROOT);
    }
}
