package com.olend.penalty;

import com.olend.exception.InvalidConfigException;
import com.olend.math.SafeMath;
import lombok.Builder;
import lombok.Value;

/**
 * Split of a liquidation penalty. The three explicit shares sum to at most 10000 bps; the
 * remainder belongs to borrower protection when enabled, otherwise to the platform.
 */
@Value
@Builder(toBuilder = true)
public class PenaltyDistributionConfig {

    long liquidatorShareBps;
    long platformShareBps;
    long insuranceShareBps;
    boolean borrowerProtectionEnabled;

    public long borrowerProtectionShareBps() {
        return SafeMath.BPS_DENOMINATOR - liquidatorShareBps - platformShareBps - insuranceShareBps;
    }

    public void validate() {
        requireBps("liquidatorShareBps", liquidatorShareBps);
        requireBps("platformShareBps", platformShareBps);
        requireBps("insuranceShareBps", insuranceShareBps);
        long sum = liquidatorShareBps + platformShareBps + insuranceShareBps;
        if (sum > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException("shares", sum, "must sum to at most 10000 bps");
        }
    }

    private static void requireBps(String field, long value) {
        if (value < 0 || value > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException(field, value, "must be within [0, 10000] bps");
        }
    }
}
