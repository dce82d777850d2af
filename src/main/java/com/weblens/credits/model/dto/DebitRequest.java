package com.weblens.credits.model.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class DebitRequest {

    @NotBlank(message = "wallet_address is required")
    private String walletAddress;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0", inclusive = false, message = "amount must be greater than zero")
    @Digits(integer = 12, fraction = 4, message = "amount must have at most 4 decimal places")
    private BigDecimal amount;

    private String description;
}
