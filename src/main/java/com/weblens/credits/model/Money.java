package com.weblens.credits.model;

import com.weblens.credits.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between USD amounts and the ledger's integer minor units.
 *
 * One unit is a hundredth of a cent, so 1 USD = 10 000 units. Every balance and
 * counter in the ledger is a {@code long} of units; {@link BigDecimal} only
 * appears at the HTTP boundary.
 */
public final class Money {

    public static final int SCALE = 4;
    public static final long UNITS_PER_USD = 10_000L;

    private static final BigDecimal UNITS_PER_USD_DECIMAL = BigDecimal.valueOf(UNITS_PER_USD);

    private Money() {
    }

    /**
     * Converts a positive USD amount to units.
     *
     * @throws ValidationException if the amount is missing, not positive, or more
     *                             precise than a hundredth of a cent
     */
    public static long toUnits(BigDecimal usd) {
        if (usd == null) {
            throw new ValidationException("amount is required");
        }
        if (usd.signum() <= 0) {
            throw new ValidationException("amount must be greater than zero");
        }
        BigDecimal normalized = usd.stripTrailingZeros();
        if (normalized.scale() > SCALE) {
            throw new ValidationException("amount must have at most " + SCALE + " decimal places");
        }
        try {
            return normalized.multiply(UNITS_PER_USD_DECIMAL).longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("amount is too large");
        }
    }

    public static BigDecimal toUsd(long units) {
        return BigDecimal.valueOf(units).divide(UNITS_PER_USD_DECIMAL, SCALE, RoundingMode.UNNECESSARY);
    }

    public static long usd(long wholeDollars) {
        return Math.multiplyExact(wholeDollars, UNITS_PER_USD);
    }
}
