package com.weblens.credits.controller;

import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.DepositResult;
import com.weblens.credits.model.Money;
import com.weblens.credits.model.dto.AccountResponse;
import com.weblens.credits.model.dto.DebitRequest;
import com.weblens.credits.model.dto.DebitResponse;
import com.weblens.credits.model.dto.DepositRequest;
import com.weblens.credits.model.dto.DepositResponse;
import com.weblens.credits.service.CreditLedgerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/credits")
@RequiredArgsConstructor
public class TransactionController {

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final CreditLedgerService ledgerService;

    /**
     * POST /api/v1/credits/deposits
     *
     * Called by the settlement layer after a credit purchase has been paid.
     * The deposit plus any bonus is credited to the wallet.
     */
    @PostMapping("/deposits")
    public ResponseEntity<DepositResponse> deposit(@Valid @RequestBody DepositRequest req) {
        DepositResult result = ledgerService.deposit(req.getWalletAddress(), req.getAmount(), req.getTransactionId());
        DepositResponse body = new DepositResponse(
                req.getTransactionId(),
                AccountResponse.from(result.getAccount()),
                Money.toUsd(result.getBonusAccrued()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * POST /api/v1/credits/debits
     *
     * Charges a metered request. Returns 402 when the balance is too low.
     * Optional header: X-Request-Id (generated when absent; reuse it to retry safely)
     */
    @PostMapping("/debits")
    public ResponseEntity<DebitResponse> debit(
            @RequestHeader(value = REQUEST_ID_HEADER, required = false) String requestId,
            @Valid @RequestBody DebitRequest req) {

        String id = requestId != null && !requestId.isBlank() ? requestId : "req_" + UUID.randomUUID();
        CreditAccount account = ledgerService.debit(req.getWalletAddress(), req.getAmount(), req.getDescription(), id);
        return ResponseEntity.ok()
                .header(REQUEST_ID_HEADER, id)
                .body(new DebitResponse(id, AccountResponse.from(account)));
    }
}
