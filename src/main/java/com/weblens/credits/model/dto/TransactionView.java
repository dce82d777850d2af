package com.weblens.credits.model.dto;

import com.weblens.credits.model.CreditTransaction;
import com.weblens.credits.model.Money;
import com.weblens.credits.model.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

@Data
@AllArgsConstructor
public class TransactionView {
    private String id;
    private TransactionType type;
    private BigDecimal amount;
    private String description;
    private OffsetDateTime timestamp;
    private Map<String, String> metadata;

    public static TransactionView from(CreditTransaction tx) {
        return new TransactionView(
                tx.getId(), tx.getType(), Money.toUsd(tx.getAmount()),
                tx.getDescription(), tx.getTimestamp(), tx.getMetadata());
    }
}
