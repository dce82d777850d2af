package com.weblens.credits.model.dto;

import com.weblens.credits.model.AccountTier;
import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.Money;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Account as shown to API clients, amounts in USD.
 */
@Data
@AllArgsConstructor
public class AccountResponse {
    private String walletAddress;
    private BigDecimal balance;
    private BigDecimal totalDeposited;
    private BigDecimal totalSpent;
    private AccountTier tier;
    private OffsetDateTime createdAt;
    private OffsetDateTime lastActivityAt;

    public static AccountResponse from(CreditAccount account) {
        return new AccountResponse(
                account.getWalletAddress(),
                Money.toUsd(account.getBalance()),
                Money.toUsd(account.getTotalDeposited()),
                Money.toUsd(account.getTotalSpent()),
                account.getTier(),
                account.getCreatedAt(),
                account.getLastActivityAt());
    }

    /** View of a wallet that has never deposited. */
    public static AccountResponse empty(String walletAddress) {
        return new AccountResponse(
                walletAddress, Money.toUsd(0), Money.toUsd(0), Money.toUsd(0),
                AccountTier.STANDARD, null, null);
    }
}
