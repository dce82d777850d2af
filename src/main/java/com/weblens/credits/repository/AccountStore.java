package com.weblens.credits.repository;

import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.CreditTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Durable state of the credit ledger: one account snapshot and one bounded
 * transaction list per canonical wallet key.
 *
 * Each write is atomic on its own; a snapshot write and a transaction append are
 * not atomic together. Callers must be the single writer for the wallet.
 * Implementations report persistence failures as
 * {@link com.weblens.credits.exception.StorageUnavailableException}.
 */
public interface AccountStore {

    Optional<CreditAccount> get(String walletKey);

    /**
     * Overwrites the snapshot, stamping {@code lastActivityAt} with the current time.
     *
     * @return the snapshot as stored
     */
    CreditAccount put(String walletKey, CreditAccount account);

    /** Prepends to the wallet's log and truncates it to the configured capacity. */
    void appendTransaction(String walletKey, CreditTransaction transaction);

    /** Newest first. Empty for unknown wallets. */
    List<CreditTransaction> getTransactions(String walletKey);
}
