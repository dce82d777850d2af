package com.weblens.credits.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class AccountTierTest {

    @ParameterizedTest
    @CsvSource({
            "0,       STANDARD",
            "99,      STANDARD",
            "99.9999, STANDARD",
            "100,     GOLD",
            "999,     GOLD",
            "1000,    PLATINUM",
            "25000,   PLATINUM"
    })
    void tierFollowsTotalDeposited(String totalUsd, AccountTier expected) {
        long units = new BigDecimal(totalUsd).multiply(BigDecimal.valueOf(Money.UNITS_PER_USD)).longValueExact();
        assertThat(AccountTier.forTotalDeposited(units)).isEqualTo(expected);
    }

    @Test
    void accountTierIsDerivedFromDeposits() {
        CreditAccount account = CreditAccount.builder().totalDeposited(Money.usd(150)).build();
        assertThat(account.getTier()).isEqualTo(AccountTier.GOLD);

        account.setTotalDeposited(Money.usd(1200));
        assertThat(account.getTier()).isEqualTo(AccountTier.PLATINUM);
    }
}
