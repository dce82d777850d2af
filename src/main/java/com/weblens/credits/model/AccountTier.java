package com.weblens.credits.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification derived from cumulative deposits. Used by pricing for discounts.
 */
public enum AccountTier {
    STANDARD("standard", 0L),
    GOLD("gold", Money.usd(100)),
    PLATINUM("platinum", Money.usd(1000));

    private final String value;
    private final long minTotalDeposited;

    AccountTier(String value, long minTotalDeposited) {
        this.value = value;
        this.minTotalDeposited = minTotalDeposited;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public long getMinTotalDeposited() {
        return minTotalDeposited;
    }

    /**
     * Highest threshold is checked first so the best satisfied tier wins.
     */
    public static AccountTier forTotalDeposited(long totalDepositedUnits) {
        if (totalDepositedUnits >= PLATINUM.minTotalDeposited) return PLATINUM;
        if (totalDepositedUnits >= GOLD.minTotalDeposited)     return GOLD;
        return STANDARD;
    }
}
