package com.weblens.credits.model;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DepositResult {
    private CreditAccount account;
    /** Bonus credited on top of the deposit, in {@link Money} units. */
    private long bonusAccrued;
}
