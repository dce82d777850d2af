package com.weblens.credits.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weblens.credits.config.CreditProperties;
import com.weblens.credits.exception.InternalLedgerException;
import com.weblens.credits.exception.StorageUnavailableException;
import com.weblens.credits.model.CreditAccount;
import com.weblens.credits.model.CreditTransaction;
import com.weblens.credits.model.TransactionLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed {@link AccountStore}.
 *
 * credit_accounts holds one row per wallet. credit_transaction_logs holds one row
 * per wallet whose {@code entries} column is the bounded log as a JSONB array.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcAccountStore implements AccountStore {

    private static final TypeReference<List<CreditTransaction>> ENTRIES_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate namedJdbc;
    private final ObjectMapper objectMapper;
    private final CreditProperties properties;
    private final Clock clock;

    private static final RowMapper<CreditAccount> ROW_MAPPER = (rs, rowNum) -> CreditAccount.builder()
            .walletAddress(rs.getString("wallet_address"))
            .balance(rs.getLong("balance"))
            .totalDeposited(rs.getLong("total_deposited"))
            .totalSpent(rs.getLong("total_spent"))
            .createdAt(rs.getObject("created_at", OffsetDateTime.class))
            .lastActivityAt(rs.getObject("last_activity_at", OffsetDateTime.class))
            .build();

    @Override
    public Optional<CreditAccount> get(String walletKey) {
        return withStorage("read account " + walletKey, () -> namedJdbc.query(
                "SELECT wallet_address, balance, total_deposited, total_spent, created_at, last_activity_at " +
                "FROM credit_accounts WHERE wallet_address = :wallet",
                new MapSqlParameterSource("wallet", walletKey),
                ROW_MAPPER
        ).stream().findFirst());
    }

    /**
     * Upsert of the full snapshot. created_at is kept from the first insert.
     */
    @Override
    public CreditAccount put(String walletKey, CreditAccount account) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        CreditAccount stamped = account.toBuilder()
                .walletAddress(walletKey)
                .createdAt(account.getCreatedAt() != null ? account.getCreatedAt() : now)
                .lastActivityAt(now)
                .build();

        withStorage("write account " + walletKey, () -> namedJdbc.update(
                "INSERT INTO credit_accounts " +
                "       (wallet_address, balance, total_deposited, total_spent, created_at, last_activity_at) " +
                "VALUES (:wallet, :balance, :totalDeposited, :totalSpent, :createdAt, :lastActivityAt) " +
                "ON CONFLICT (wallet_address) DO UPDATE SET " +
                "       balance          = EXCLUDED.balance, " +
                "       total_deposited  = EXCLUDED.total_deposited, " +
                "       total_spent      = EXCLUDED.total_spent, " +
                "       last_activity_at = EXCLUDED.last_activity_at",
                new MapSqlParameterSource()
                        .addValue("wallet", walletKey)
                        .addValue("balance", stamped.getBalance())
                        .addValue("totalDeposited", stamped.getTotalDeposited())
                        .addValue("totalSpent", stamped.getTotalSpent())
                        .addValue("createdAt", stamped.getCreatedAt())
                        .addValue("lastActivityAt", stamped.getLastActivityAt())
        ));
        return stamped;
    }

    /**
     * Read-prepend-write inside one database transaction; the row lock keeps the
     * update atomic even if a second writer ever appeared.
     */
    @Override
    @Transactional
    public void appendTransaction(String walletKey, CreditTransaction transaction) {
        List<CreditTransaction> current = withStorage("lock transaction log " + walletKey, () -> namedJdbc.query(
                "SELECT entries FROM credit_transaction_logs WHERE wallet_address = :wallet FOR UPDATE",
                new MapSqlParameterSource("wallet", walletKey),
                (rs, rowNum) -> readEntries(rs.getString("entries"))
        ).stream().findFirst().orElse(List.of()));

        TransactionLog log = TransactionLog.of(current, properties.getHistoryLimit()).prepend(transaction);

        withStorage("write transaction log " + walletKey, () -> namedJdbc.update(
                "INSERT INTO credit_transaction_logs (wallet_address, entries, updated_at) " +
                "VALUES (:wallet, CAST(:entries AS jsonb), :updatedAt) " +
                "ON CONFLICT (wallet_address) DO UPDATE SET " +
                "       entries    = EXCLUDED.entries, " +
                "       updated_at = EXCLUDED.updated_at",
                new MapSqlParameterSource()
                        .addValue("wallet", walletKey)
                        .addValue("entries", writeEntries(log.entries()))
                        .addValue("updatedAt", OffsetDateTime.now(clock))
        ));
    }

    @Override
    public List<CreditTransaction> getTransactions(String walletKey) {
        List<CreditTransaction> entries = withStorage("read transaction log " + walletKey, () -> namedJdbc.query(
                "SELECT entries FROM credit_transaction_logs WHERE wallet_address = :wallet",
                new MapSqlParameterSource("wallet", walletKey),
                (rs, rowNum) -> readEntries(rs.getString("entries"))
        ).stream().findFirst().orElse(List.of()));
        return TransactionLog.of(entries, properties.getHistoryLimit()).entries();
    }

    private <T> T withStorage(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.warn("Storage failure during '{}': {}", operation, e.getMessage());
            throw new StorageUnavailableException("Credit storage unavailable: " + operation, e);
        }
    }

    private List<CreditTransaction> readEntries(String json) {
        if (json == null) return List.of();
        try {
            return objectMapper.readValue(json, ENTRIES_TYPE);
        } catch (JsonProcessingException e) {
            throw new InternalLedgerException("Corrupt transaction log entry", e);
        }
    }

    private String writeEntries(List<CreditTransaction> entries) {
        try {
            return objectMapper.writeValueAsString(entries);
        } catch (JsonProcessingException e) {
            throw new InternalLedgerException("Unable to serialize transaction log", e);
        }
    }
}
