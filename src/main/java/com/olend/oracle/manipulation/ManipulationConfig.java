package com.olend.oracle.manipulation;

import com.olend.exception.InvalidConfigException;
import com.olend.math.SafeMath;
import lombok.Builder;
import lombok.Value;

/**
 * Thresholds for the adversarial-pattern checks. The spike threshold is per feed
 * ({@code PriceFeedConfig.maxDeviationBps}); everything else is global.
 */
@Value
@Builder(toBuilder = true)
public class ManipulationConfig {

    /** Number of most recent points whose signed moves are summed by the drift check. */
    @Builder.Default
    int cumulativeWindowPoints = 10;

    /** Absolute summed move (bps) above which the drift check fires. */
    @Builder.Default
    long cumulativeThresholdBps = 2_000;

    /** Single-step move (bps) considered sharp for the confidence mismatch check. */
    @Builder.Default
    long mismatchMoveBps = 500;

    /** Relative tightening of the confidence ratio (bps of the previous ratio) considered suspicious. */
    @Builder.Default
    long confidenceImprovementBps = 5_000;

    /** Look-back window for the pump/dump check. */
    @Builder.Default
    long oscillationWindowSeconds = 300;

    /** Minimum rise (bps above the pre-rise level) that counts as a pump. */
    @Builder.Default
    long oscillationMinMoveBps = 500;

    public static ManipulationConfig defaults() {
        return ManipulationConfig.builder().build();
    }

    public void validate() {
        if (cumulativeWindowPoints < 2 || cumulativeWindowPoints > 1_000) {
            throw new InvalidConfigException("cumulativeWindowPoints", cumulativeWindowPoints, "must be within [2, 1000]");
        }
        requireBps("cumulativeThresholdBps", cumulativeThresholdBps, 100_000);
        requireBps("mismatchMoveBps", mismatchMoveBps, SafeMath.BPS_DENOMINATOR);
        requireBps("confidenceImprovementBps", confidenceImprovementBps, SafeMath.BPS_DENOMINATOR);
        if (oscillationWindowSeconds <= 0) {
            throw new InvalidConfigException("oscillationWindowSeconds", oscillationWindowSeconds, "must be positive");
        }
        requireBps("oscillationMinMoveBps", oscillationMinMoveBps, SafeMath.BPS_DENOMINATOR);
    }

    private static void requireBps(String field, long value, long max) {
        if (value <= 0 || value > max) {
            throw new InvalidConfigException(field, value, "must be within (0, " + max + "]");
        }
    }
}
