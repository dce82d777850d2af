package com.weblens.credits.model.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Most recent transactions, newest first. Older entries are not retained.
 */
@Data
@AllArgsConstructor
public class HistoryResponse {
    private String walletAddress;
    private List<TransactionView> entries;
}
