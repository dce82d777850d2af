package com.weblens.credits.config;

import com.weblens.credits.model.TransactionLog;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings under the {@code credits.*} prefix.
 */
@Data
@ConfigurationProperties(prefix = "credits")
public class CreditProperties {

    /** Deposit bonus tiers. Order matters only for tiers sharing a minimum deposit. */
    private List<BonusTier> bonusTiers = new ArrayList<>(List.of(
            new BonusTier(new BigDecimal("10"), new BigDecimal("0.20")),
            new BonusTier(new BigDecimal("50"), new BigDecimal("0.30")),
            new BonusTier(new BigDecimal("100"), new BigDecimal("0.40"))
    ));

    /** Number of transactions kept per wallet. */
    private int historyLimit = TransactionLog.DEFAULT_CAPACITY;

    private Actor actor = new Actor();
    private Storage storage = new Storage();
    private Idempotency idempotency = new Idempotency();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BonusTier {
        private BigDecimal minDeposit;
        private BigDecimal bonusMultiplier;
    }

    @Data
    public static class Actor {
        /** Worker threads shared by all wallet actors. */
        private int workerThreads = 8;
        /** How long a caller waits for its operation before reporting storage as unavailable. */
        private Duration operationTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Storage {
        private Duration queryTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class Idempotency {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(10);
        private long maximumSize = 100_000;
    }
}
