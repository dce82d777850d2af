package com.weblens.credits.service;

import com.weblens.credits.config.CreditProperties;
import com.weblens.credits.config.CreditProperties.BonusTier;
import com.weblens.credits.model.Money;
import lombok.Value;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps a deposit amount to the bonus credited on top of it.
 *
 * Tiers are sorted by minimum deposit, highest first, and the first tier the
 * amount reaches decides the multiplier. The sort is {@link List#sort} and
 * therefore stable: tiers with equal minimums keep their configured order, so
 * the one configured first wins. Bonuses are rounded toward zero.
 */
@Component
public class BonusCalculator {

    private final List<Tier> tiers;

    @Autowired
    public BonusCalculator(CreditProperties properties) {
        this(properties.getBonusTiers());
    }

    public BonusCalculator(List<BonusTier> configured) {
        List<Tier> sorted = new ArrayList<>(configured.size());
        for (BonusTier tier : configured) {
            if (tier.getBonusMultiplier() == null || tier.getBonusMultiplier().signum() < 0) {
                throw new IllegalArgumentException("bonus multiplier must be non-negative: " + tier);
            }
            sorted.add(new Tier(Money.toUnits(tier.getMinDeposit()), tier.getBonusMultiplier()));
        }
        sorted.sort(Comparator.comparingLong(Tier::getMinDeposit).reversed());
        this.tiers = List.copyOf(sorted);
    }

    /**
     * @param depositUnits deposit in {@link Money} units
     * @return bonus in units, 0 when no tier qualifies
     */
    public long bonusFor(long depositUnits) {
        for (Tier tier : tiers) {
            if (depositUnits >= tier.getMinDeposit()) {
                return BigDecimal.valueOf(depositUnits)
                        .multiply(tier.getMultiplier())
                        .setScale(0, RoundingMode.DOWN)
                        .longValueExact();
            }
        }
        return 0L;
    }

    @Value
    private static class Tier {
        long minDeposit;
        BigDecimal multiplier;
    }
}
