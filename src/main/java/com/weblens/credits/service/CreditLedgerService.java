package com.weblens.credits.service;

import com.weblens.credits.actor.LedgerActorRegistry;
import com.weblens.credits.config.CreditProperties;
import com.weblens.credits.exception.CreditLedgerException;
import com.weblens.credits.exception.InternalLedgerException;
import com.weblens.credits.exception.StorageUnavailableException;
import com.weblens.credits.exception.ValidationException;
import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.CreditTransaction;
import com.weblens.credits.model.DepositResult;
import com.weblens.credits.model.Money;
import com.weblens.credits.model.WalletAddresses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for everything that touches a credit balance.
 *
 * Validates input, canonicalizes the wallet, hands the work to the wallet's
 * actor and waits for the outcome. Failures come back as
 * {@link CreditLedgerException} subtypes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditLedgerService {

    private final LedgerActorRegistry actors;
    private final CreditProperties properties;

    // =========================================================================
    // MUTATIONS
    // =========================================================================

    /**
     * Credits a confirmed payment. Called by the settlement layer once funds
     * have been received.
     *
     * @param amountUsd deposit in USD, positive, at most four decimal places
     * @param txId      settlement transaction id; a repeat within the idempotency
     *                  window returns the earlier result
     */
    public DepositResult deposit(String walletAddress, BigDecimal amountUsd, String txId) {
        String walletKey = WalletAddresses.canonicalize(walletAddress);
        long amount = Money.toUnits(amountUsd);
        requireText(txId, "transaction id");

        return await(walletKey, "deposit " + txId,
                actors.dispatch(walletKey, actor -> actor.deposit(amount, txId)));
    }

    /**
     * Charges a metered request. Throws
     * {@link com.weblens.credits.exception.InsufficientFundsException} when the
     * balance does not cover the amount; callers answer that with payment required.
     */
    public CreditAccount debit(String walletAddress, BigDecimal amountUsd, String description, String requestId) {
        String walletKey = WalletAddresses.canonicalize(walletAddress);
        long amount = Money.toUnits(amountUsd);
        requireText(requestId, "request id");
        String label = description == null || description.isBlank() ? "API usage" : description;

        return await(walletKey, "debit " + requestId,
                actors.dispatch(walletKey, actor -> actor.debit(amount, label, requestId)));
    }

    // =========================================================================
    // QUERIES
    // =========================================================================

    public Optional<CreditAccount> getAccount(String walletAddress) {
        String walletKey = WalletAddresses.canonicalize(walletAddress);
        return await(walletKey, "account lookup",
                actors.dispatch(walletKey, actor -> actor.getAccount()));
    }

    public List<CreditTransaction> getHistory(String walletAddress) {
        String walletKey = WalletAddresses.canonicalize(walletAddress);
        return await(walletKey, "history lookup",
                actors.dispatch(walletKey, actor -> actor.getHistory()));
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private <T> T await(String walletKey, String operation, CompletableFuture<T> pending) {
        long timeoutMillis = properties.getActor().getOperationTimeout().toMillis();
        try {
            return pending.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Timed out after {} ms waiting for {} on wallet {}", timeoutMillis, operation, walletKey);
            throw new StorageUnavailableException(
                    "Timed out waiting for " + operation + "; outcome unknown", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InternalLedgerException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CreditLedgerException) {
                throw (CreditLedgerException) cause;
            }
            log.error("Unexpected failure during {} on wallet {}", operation, walletKey, cause);
            throw new InternalLedgerException("Unexpected failure during " + operation, cause);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " is required");
        }
    }
}
