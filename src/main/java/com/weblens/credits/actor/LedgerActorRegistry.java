package com.weblens.credits.actor;

import com.weblens.credits.repository.AccountStore;
import com.weblens.credits.service.BonusCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Routes each canonical wallet key to its {@link LedgerActor}.
 *
 * The wallet key is the actor's name, so the same wallet always reaches the same
 * mailbox and the mapping does not depend on pool size. At most one actor exists
 * per key at any time: creation, enqueueing and removal of idle actors all happen
 * under the map's per-key lock. Actors with nothing queued are dropped so the map
 * only holds wallets with work in flight.
 */
@Slf4j
@Component
public class LedgerActorRegistry {

    private final ConcurrentMap<String, LedgerActor> actors = new ConcurrentHashMap<>();

    private final AccountStore store;
    private final BonusCalculator bonusCalculator;
    private final IdempotencyCache idempotency;
    private final Clock clock;
    private final ExecutorService ledgerWorkers;

    public LedgerActorRegistry(AccountStore store,
                               BonusCalculator bonusCalculator,
                               IdempotencyCache idempotency,
                               Clock clock,
                               ExecutorService ledgerWorkers) {
        this.store = store;
        this.bonusCalculator = bonusCalculator;
        this.idempotency = idempotency;
        this.clock = clock;
        this.ledgerWorkers = ledgerWorkers;
    }

    /**
     * Queues an operation on the actor that owns {@code walletKey}.
     *
     * @param walletKey canonical wallet key
     * @return completes with the operation's result, or exceptionally with whatever it threw
     */
    public <T> CompletableFuture<T> dispatch(String walletKey, Function<LedgerActor, T> operation) {
        AtomicReference<CompletableFuture<T>> queued = new AtomicReference<>();
        LedgerActor actor = actors.compute(walletKey, (key, existing) -> {
            LedgerActor target = existing != null ? existing : newActor(key);
            queued.set(target.enqueue(operation));
            return target;
        });
        // Registered outside compute: an already finished operation runs this inline.
        CompletableFuture<T> result = queued.get();
        result.whenComplete((value, failure) -> {
            if (actor.finishOne()) {
                release(actor);
            }
        });
        return result;
    }

    /** Number of wallets with queued or running operations. */
    public int activeActorCount() {
        return actors.size();
    }

    private LedgerActor newActor(String walletKey) {
        log.debug("Starting ledger actor for wallet {}", walletKey);
        return new LedgerActor(walletKey, store, bonusCalculator, idempotency, clock, ledgerWorkers);
    }

    private void release(LedgerActor actor) {
        actors.computeIfPresent(actor.getWalletKey(),
                (key, current) -> current == actor && current.isIdle() ? null : current);
    }
}
