package com.olend.risk;

import com.olend.exception.InvalidConfigException;
import com.olend.math.SafeMath;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Dynamic liquidation penalty parameters.
 *
 * <p>{@code rate = base x assetMultiplier x (1 + volatilityAdj) x (1 + liquidityAdj)}, clipped to
 * {@code [minRateBps, maxRateBps]}. Multipliers are in bps of 1x (10000 = 100%).
 */
@Value
@Builder(toBuilder = true)
public class PenaltyRateConfig {

    /** Upper bound for an asset multiplier: 10x. */
    public static final long MAX_MULTIPLIER_BPS = 100_000L;

    long baseRateBps;
    long minRateBps;
    long maxRateBps;

    /** Asset symbol -> multiplier bps. Unconfigured assets use 10000. */
    Map<String, Long> assetMultiplierBps;

    @Builder.Default
    int highVolatilityLevel = 70;

    @Builder.Default
    int mediumVolatilityLevel = 40;

    @Builder.Default
    long highVolatilityAdjustmentBps = 5000;

    @Builder.Default
    long mediumVolatilityAdjustmentBps = 2500;

    /** Liquidity depth at or below which the high adjustment applies. */
    @Builder.Default
    int lowLiquidityDepth = 30;

    @Builder.Default
    int mediumLiquidityDepth = 60;

    @Builder.Default
    long lowLiquidityAdjustmentBps = 5000;

    @Builder.Default
    long mediumLiquidityAdjustmentBps = 2500;

    @Builder.Default
    long maxFactorAgeSeconds = 86_400;

    public long multiplierFor(String asset) {
        Long multiplier = assetMultiplierBps != null ? assetMultiplierBps.get(asset) : null;
        return multiplier != null ? multiplier : SafeMath.BPS_DENOMINATOR;
    }

    public void validate() {
        requireBps("minRateBps", minRateBps);
        requireBps("maxRateBps", maxRateBps);
        requireBps("baseRateBps", baseRateBps);
        if (minRateBps > maxRateBps) {
            throw new InvalidConfigException("minRateBps", minRateBps, "must not exceed maxRateBps " + maxRateBps);
        }
        if (assetMultiplierBps != null) {
            assetMultiplierBps.forEach((asset, multiplier) -> {
                if (multiplier == null || multiplier <= 0 || multiplier > MAX_MULTIPLIER_BPS) {
                    throw new InvalidConfigException(
                            "assetMultiplierBps." + asset, multiplier, "must be within (0, " + MAX_MULTIPLIER_BPS + "]");
                }
            });
        }
        if (mediumVolatilityLevel > highVolatilityLevel || highVolatilityLevel > 100 || mediumVolatilityLevel < 0) {
            throw new InvalidConfigException("volatility levels must satisfy 0 <= medium <= high <= 100");
        }
        if (lowLiquidityDepth > mediumLiquidityDepth || mediumLiquidityDepth > 100 || lowLiquidityDepth < 0) {
            throw new InvalidConfigException("liquidity depths must satisfy 0 <= low <= medium <= 100");
        }
        requireBps("highVolatilityAdjustmentBps", highVolatilityAdjustmentBps);
        requireBps("mediumVolatilityAdjustmentBps", mediumVolatilityAdjustmentBps);
        requireBps("lowLiquidityAdjustmentBps", lowLiquidityAdjustmentBps);
        requireBps("mediumLiquidityAdjustmentBps", mediumLiquidityAdjustmentBps);
        if (maxFactorAgeSeconds <= 0) {
            throw new InvalidConfigException("maxFactorAgeSeconds", maxFactorAgeSeconds, "must be positive");
        }
    }

    private static void requireBps(String field, long value) {
        if (value < 0 || value > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException(field, value, "must be within [0, 10000] bps");
        }
    }
}
