package com.weblens.credits.controller;

import com.weblens.credits.exception.AccountNotFoundException;
import com.weblens.credits.exception.InsufficientFundsException;
import com.weblens.credits.exception.StorageUnavailableException;
import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.DepositResult;
import com.weblens.credits.model.Money;
import com.weblens.credits.service.CreditLedgerService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TransactionController.class)
@DisplayName("TransactionController")
class TransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CreditLedgerService ledgerService;

    private static CreditAccount account(long balance, long deposited, long spent) {
        OffsetDateTime now = OffsetDateTime.parse("2026-03-01T12:00:00Z");
        return CreditAccount.builder()
                .walletAddress("0xabc")
                .balance(balance)
                .totalDeposited(deposited)
                .totalSpent(spent)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
    }

    @Test
    @DisplayName("POST /deposits credits the wallet and reports the bonus")
    void deposit_returnsCreated() throws Exception {
        when(ledgerService.deposit(eq("0xABC"), any(BigDecimal.class), eq("tx-1")))
                .thenReturn(new DepositResult(account(Money.usd(140), Money.usd(100), 0), Money.usd(40)));

        mockMvc.perform(post("/api/v1/credits/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xABC", "amount": 100.00, "transaction_id": "tx-1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.transaction_id").value("tx-1"))
                .andExpect(jsonPath("$.bonus_accrued").value(40.0))
                .andExpect(jsonPath("$.account.balance").value(140.0))
                .andExpect(jsonPath("$.account.tier").value("gold"));
    }

    @Test
    @DisplayName("POST /deposits rejects a non-positive amount")
    void deposit_rejectsZeroAmount() throws Exception {
        mockMvc.perform(post("/api/v1/credits/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 0, "transaction_id": "tx-1"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.amount").exists());

        verify(ledgerService, never()).deposit(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("POST /deposits rejects amounts above the purchase limit")
    void deposit_rejectsOversizedAmount() throws Exception {
        mockMvc.perform(post("/api/v1/credits/deposits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 1000.01, "transaction_id": "tx-1"}
                                """))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /debits charges the wallet using the supplied request id")
    void debit_usesRequestIdHeader() throws Exception {
        when(ledgerService.debit(eq("0xabc"), any(BigDecimal.class), eq("fetch"), eq("req-42")))
                .thenReturn(account(Money.usd(147), Money.usd(110), Money.usd(5)));

        mockMvc.perform(post("/api/v1/credits/debits")
                        .header("X-Request-Id", "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 5, "description": "fetch"}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-42"))
                .andExpect(jsonPath("$.request_id").value("req-42"))
                .andExpect(jsonPath("$.account.balance").value(147.0))
                .andExpect(jsonPath("$.account.total_spent").value(5.0));
    }

    @Test
    @DisplayName("POST /debits generates a request id when none is sent")
    void debit_generatesRequestId() throws Exception {
        when(ledgerService.debit(eq("0xabc"), any(BigDecimal.class), any(), anyString()))
                .thenReturn(account(Money.usd(1), Money.usd(2), Money.usd(1)));

        mockMvc.perform(post("/api/v1/credits/debits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 1}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", startsWith("req_")));
    }

    @Test
    @DisplayName("POST /debits answers 402 when the balance is too low")
    void debit_insufficientFundsIsPaymentRequired() throws Exception {
        when(ledgerService.debit(anyString(), any(BigDecimal.class), any(), anyString()))
                .thenThrow(new InsufficientFundsException("0xabc", Money.usd(147), Money.usd(1000)));

        mockMvc.perform(post("/api/v1/credits/debits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 1000, "description": "usage"}
                                """))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"));
    }

    @Test
    @DisplayName("POST /debits answers 404 for a wallet without an account")
    void debit_unknownAccount() throws Exception {
        when(ledgerService.debit(anyString(), any(BigDecimal.class), any(), anyString()))
                .thenThrow(new AccountNotFoundException("0xnew"));

        mockMvc.perform(post("/api/v1/credits/debits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xnew", "amount": 1}
                                """))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("ACCOUNT_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /debits answers 503 when storage is unavailable")
    void debit_storageUnavailable() throws Exception {
        when(ledgerService.debit(anyString(), any(BigDecimal.class), any(), anyString()))
                .thenThrow(new StorageUnavailableException("database down"));

        mockMvc.perform(post("/api/v1/credits/debits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"wallet_address": "0xabc", "amount": 1}
                                """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("STORAGE_UNAVAILABLE"));
    }
}
