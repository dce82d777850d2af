package com.weblens.credits.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One entry of a wallet's transaction log.
 * Amount is signed: positive for deposit and bonus, negative for spend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreditTransaction {
    private String id;
    private TransactionType type;
    private long amount;
    private String description;
    private OffsetDateTime timestamp;
    private Map<String, String> metadata;
}
