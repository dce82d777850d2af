package com.weblens.credits.controller;

import com.weblens.credits.model.WalletAddresses;
import com.weblens.credits.model.dto.AccountResponse;
import com.weblens.credits.model.dto.HistoryResponse;
import com.weblens.credits.model.dto.TransactionView;
import com.weblens.credits.service.CreditLedgerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class AccountController {

    private final CreditLedgerService ledgerService;

    /**
     * GET /health
     * Liveness probe.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * GET /api/v1/credits/{wallet}/balance
     * Wallets that never deposited get a zero-balance standard-tier view.
     */
    @GetMapping("/api/v1/credits/{wallet}/balance")
    public ResponseEntity<AccountResponse> getBalance(@PathVariable("wallet") String wallet) {
        AccountResponse response = ledgerService.getAccount(wallet)
                .map(AccountResponse::from)
                .orElseGet(() -> AccountResponse.empty(WalletAddresses.canonicalize(wallet)));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/v1/credits/{wallet}/history
     * Up to the 50 most recent transactions, newest first.
     */
    @GetMapping("/api/v1/credits/{wallet}/history")
    public ResponseEntity<HistoryResponse> getHistory(@PathVariable("wallet") String wallet) {
        HistoryResponse response = new HistoryResponse(
                WalletAddresses.canonicalize(wallet),
                ledgerService.getHistory(wallet).stream().map(TransactionView::from).toList());
        return ResponseEntity.ok(response);
    }
}
