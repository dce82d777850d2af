package com.weblens.credits.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class DepositResponse {
    private String transactionId;
    private AccountResponse account;
    private BigDecimal bonusAccrued;
}
