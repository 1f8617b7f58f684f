package com.minerpayout.payout;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Reward for one share: rewardPerShare × difficultyMultiplier × networkMultiplier, truncated to wei precision.
 */
@Component
@RequiredArgsConstructor
public class RewardCalculator {

    static final int SCALE = 18;
    static final BigDecimal DIFFICULTY_SCALE = new BigDecimal("1000000000");

    private static final BigDecimal LOW_GAS_GWEI = new BigDecimal("20");
    private static final BigDecimal HIGH_GAS_GWEI = new BigDecimal("50");
    private static final BigDecimal LOW_GAS_MULTIPLIER = new BigDecimal("1.2");
    private static final BigDecimal HIGH_GAS_MULTIPLIER = new BigDecimal("0.8");

    private final PayoutProperties properties;

    public BigDecimal calculate(BigDecimal difficulty, BigDecimal gasPriceGwei) {
        return properties.getRewardPerShare()
                .multiply(difficultyMultiplier(difficulty))
                .multiply(networkMultiplier(gasPriceGwei))
                .setScale(SCALE, RoundingMode.DOWN);
    }

    /**
     * min(difficulty / 1e9, 1).
     */
    public static BigDecimal difficultyMultiplier(BigDecimal difficulty) {
        return difficulty.divide(DIFFICULTY_SCALE, SCALE, RoundingMode.DOWN).min(BigDecimal.ONE);
    }

    /**
     * Cheap gas pays more: below 20 Gwei 1.2, below 50 Gwei 1.0, otherwise 0.8.
     */
    public static BigDecimal networkMultiplier(BigDecimal gasPriceGwei) {
        if (gasPriceGwei.compareTo(LOW_GAS_GWEI) < 0) return LOW_GAS_MULTIPLIER;
        if (gasPriceGwei.compareTo(HIGH_GAS_GWEI) < 0) return BigDecimal.ONE;
        return HIGH_GAS_MULTIPLIER;
    }
}
