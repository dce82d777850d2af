package com.weblens.credits.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Snapshot of one wallet's prepaid credit account. Amounts are in {@link Money} units.
 *
 * The tier is not stored: it is recomputed from {@code totalDeposited} on every read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CreditAccount {
    private String walletAddress;
    private long balance;
    private long totalDeposited;
    private long totalSpent;
    private OffsetDateTime createdAt;
    private OffsetDateTime lastActivityAt;

    public AccountTier getTier() {
        return AccountTier.forTotalDeposited(totalDeposited);
    }

    /** A zero-balance, standard-tier account that has not been persisted yet. */
    public static CreditAccount open(String walletAddress, OffsetDateTime now) {
        return CreditAccount.builder()
                .walletAddress(walletAddress)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }
}
