package com.olend.risk;

import com.olend.exception.InvalidConfigException;
import com.olend.math.SafeMath;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Admin-owned LTV policy.
 *
 * <p>{@code maxAllowedLtv = baseCap[assetClass] + tierBonus[tier]}, clipped to {@code globalHardCapBps}.
 * Positions are classified against {@code warningThresholdBps} and {@code liquidationThresholdBps}.
 */
@Value
@Builder(toBuilder = true)
public class CollateralPolicy {

    /** Collateral asset symbol -> class. Assets not listed are not accepted as collateral. */
    Map<String, AssetClass> assetClasses;

    Map<AssetClass, Long> classMaxLtvBps;

    /** Missing tiers get no bonus. */
    Map<BorrowerTier, Long> tierBonusBps;

    long globalHardCapBps;
    long warningThresholdBps;
    long liquidationThresholdBps;

    public long tierBonus(BorrowerTier tier) {
        Long bonus = tierBonusBps != null ? tierBonusBps.get(tier) : null;
        return bonus != null ? bonus : 0L;
    }

    /**
     * @throws InvalidConfigException on the first violated bound
     */
    public void validate() {
        if (assetClasses == null || classMaxLtvBps == null) {
            throw new InvalidConfigException("Collateral policy requires asset classes and class caps");
        }
        requireBps("globalHardCapBps", globalHardCapBps, 1);
        requireBps("warningThresholdBps", warningThresholdBps, 1);
        requireBps("liquidationThresholdBps", liquidationThresholdBps, 1);
        if (warningThresholdBps >= liquidationThresholdBps) {
            throw new InvalidConfigException(
                    "warningThresholdBps", warningThresholdBps, "must be below liquidationThresholdBps");
        }
        classMaxLtvBps.forEach((assetClass, cap) -> requireBps("classMaxLtvBps." + assetClass, cap, 1));
        if (tierBonusBps != null) {
            tierBonusBps.forEach((tier, bonus) -> requireBps("tierBonusBps." + tier, bonus, 0));
        }
        assetClasses.forEach((asset, assetClass) -> {
            if (!classMaxLtvBps.containsKey(assetClass)) {
                throw new InvalidConfigException(
                        "assetClasses." + asset, assetClass, "has no configured class cap");
            }
        });
    }

    private static void requireBps(String field, Long value, long min) {
        if (value == null || value < min || value > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException(field, value, "must be within [" + min + ", 10000] bps");
        }
    }
}
