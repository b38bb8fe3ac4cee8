package com.olend.risk;

import com.olend.exception.InvalidConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Market-wide factors feeding the dynamic penalty rate. All levels are scores in [0, 100].
 *
 * <p>Factors older than {@link PenaltyRateConfig#getMaxFactorAgeSeconds()} are ignored and the
 * worst case is assumed.
 */
@Value
@Builder(toBuilder = true)
public class MarketConditionFactors {

    /** 100 = extremely volatile. */
    int volatilityLevel;

    /** 100 = deep liquidity. */
    int liquidityDepth;

    /** 100 = fully stable. */
    int priceStability;

    long updatedAt;

    public void validate() {
        requireScore("volatilityLevel", volatilityLevel);
        requireScore("liquidityDepth", liquidityDepth);
        requireScore("priceStability", priceStability);
        if (updatedAt < 0) {
            throw new InvalidConfigException("updatedAt", updatedAt, "must not be negative");
        }
    }

    private static void requireScore(String field, int value) {
        if (value < 0 || value > 100) {
            throw new InvalidConfigException(field, value, "must be within [0, 100]");
        }
    }
}
