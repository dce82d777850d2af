package com.weblens.credits.actor;

import com.weblens.credits.exception.AccountNotFoundException;
import com.weblens.credits.exception.InsufficientFundsException;
import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.CreditTransaction;
import com.weblens.credits.model.DepositResult;
import com.weblens.credits.model.Money;
import com.weblens.credits.model.TransactionType;
import com.weblens.credits.repository.AccountStore;
import com.weblens.credits.service.BonusCalculator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Single writer for one wallet.
 *
 * Operations are queued in a mailbox and run one at a time, in the order they
 * were enqueued, on the shared worker pool. Each operation reads the latest
 * persisted state, so it sees everything that ran before it. The public
 * operation methods must only be called from a task running in this actor's
 * mailbox; {@link LedgerActorRegistry} is the only way in.
 */
@Slf4j
public class LedgerActor {

    static final String DEPOSIT = "deposit";
    static final String DEBIT = "debit";

    private final String walletKey;
    private final AccountStore store;
    private final BonusCalculator bonusCalculator;
    private final IdempotencyCache idempotency;
    private final Clock clock;
    private final Executor executor;

    // guarded by this
    private CompletableFuture<?> tail = CompletableFuture.completedFuture(null);
    private int pending;

    LedgerActor(String walletKey,
                AccountStore store,
                BonusCalculator bonusCalculator,
                IdempotencyCache idempotency,
                Clock clock,
                Executor executor) {
        this.walletKey = walletKey;
        this.store = store;
        this.bonusCalculator = bonusCalculator;
        this.idempotency = idempotency;
        this.clock = clock;
        this.executor = executor;
    }

    public String getWalletKey() {
        return walletKey;
    }

    /**
     * Appends an operation to the mailbox. It starts once every earlier operation
     * has finished, whether that one succeeded or failed.
     */
    <T> CompletableFuture<T> enqueue(Function<LedgerActor, T> operation) {
        CompletableFuture<T> result;
        synchronized (this) {
            pending++;
            result = tail
                    .handle((ignored, previousFailure) -> null)
                    .thenApplyAsync(ignored -> operation.apply(this), executor);
            tail = result;
        }
        return result;
    }

    synchronized boolean isIdle() {
        return pending == 0;
    }

    /**
     * Marks one queued operation as finished.
     *
     * @return true if the mailbox is now empty
     */
    synchronized boolean finishOne() {
        pending--;
        return pending == 0;
    }

    // =========================================================================
    // OPERATIONS (run inside the mailbox)
    // =========================================================================

    /**
     * Credits the deposit plus its bonus. Creates the account on first use.
     * Never rejected on business grounds.
     */
    public DepositResult deposit(long amount, String txId) {
        Optional<DepositResult> replay = idempotency.find(walletKey, DEPOSIT, txId, DepositResult.class);
        if (replay.isPresent()) {
            log.info("Deposit {} for wallet {} already applied, returning previous result", txId, walletKey);
            return replay.get();
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        CreditAccount current = store.get(walletKey).orElseGet(() -> CreditAccount.open(walletKey, now));
        long bonus = bonusCalculator.bonusFor(amount);

        CreditAccount updated = current.toBuilder()
                .balance(Math.addExact(current.getBalance(), Math.addExact(amount, bonus)))
                .totalDeposited(Math.addExact(current.getTotalDeposited(), amount))
                .build();

        CreditAccount stored = store.put(walletKey, updated);
        store.appendTransaction(walletKey, CreditTransaction.builder()
                .id(txId)
                .type(TransactionType.DEPOSIT)
                .amount(amount)
                .description("Credit purchase")
                .timestamp(now)
                .metadata(Map.of(
                        "originalAmount", Money.toUsd(amount).toPlainString(),
                        "bonus", Money.toUsd(bonus).toPlainString()))
                .build());
        if (bonus > 0) {
            store.appendTransaction(walletKey, CreditTransaction.builder()
                    .id(txId + "-bonus")
                    .type(TransactionType.BONUS)
                    .amount(bonus)
                    .description("Deposit bonus")
                    .timestamp(now)
                    .metadata(Map.of("depositId", txId))
                    .build());
        }

        log.info("Deposited {} (+{} bonus) to wallet {}: balance={}, tier={}",
                Money.toUsd(amount), Money.toUsd(bonus), walletKey,
                Money.toUsd(stored.getBalance()), stored.getTier().getValue());

        DepositResult result = new DepositResult(stored, bonus);
        idempotency.record(walletKey, DEPOSIT, txId, result);
        return result;
    }

    /**
     * Charges the account. The balance check happens before anything is written,
     * so a rejected debit leaves the account and its log untouched.
     */
    public CreditAccount debit(long amount, String description, String requestId) {
        Optional<CreditAccount> replay = idempotency.find(walletKey, DEBIT, requestId, CreditAccount.class);
        if (replay.isPresent()) {
            log.info("Debit {} for wallet {} already applied, returning previous result", requestId, walletKey);
            return replay.get();
        }

        CreditAccount current = store.get(walletKey)
                .orElseThrow(() -> new AccountNotFoundException(walletKey));

        if (current.getBalance() < amount) {
            log.warn("Rejected debit {} for wallet {}: balance={}, requested={}",
                    requestId, walletKey, Money.toUsd(current.getBalance()), Money.toUsd(amount));
            throw new InsufficientFundsException(walletKey, current.getBalance(), amount);
        }

        CreditAccount updated = current.toBuilder()
                .balance(current.getBalance() - amount)
                .totalSpent(Math.addExact(current.getTotalSpent(), amount))
                .build();

        CreditAccount stored = store.put(walletKey, updated);
        store.appendTransaction(walletKey, CreditTransaction.builder()
                .id(requestId)
                .type(TransactionType.SPEND)
                .amount(-amount)
                .description(description)
                .timestamp(OffsetDateTime.now(clock))
                .metadata(Map.of("requestId", requestId))
                .build());

        log.info("Debited {} from wallet {} for '{}': balance={}",
                Money.toUsd(amount), walletKey, description, Money.toUsd(stored.getBalance()));

        idempotency.record(walletKey, DEBIT, requestId, stored);
        return stored;
    }

    public Optional<CreditAccount> getAccount() {
        return store.get(walletKey);
    }

    public List<CreditTransaction> getHistory() {
        return store.getTransactions(walletKey);
    }
}
