package com.weblens.credits.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class DebitResponse {
    private String requestId;
    private AccountResponse account;
}
