package com.olend.oracle;

import com.olend.math.SafeMath;
import com.olend.oracle.manipulation.ManipulationCheck;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Result of validating one price quote. Recomputed on every request; only the latest
 * result per asset is cached.
 */
@Value
@Builder(toBuilder = true)
public class ValidatedPriceInfo {

    String asset;
    long price;
    long confidence;
    int exponent;
    long timestamp;

    /** Composite confidence in this price, 0-100. */
    int validationScore;

    /** Manipulation risk level, 0-3. */
    int manipulationRisk;

    /** False when the detector flagged manipulation (risk level 2 or higher). */
    boolean valid;

    Set<ManipulationCheck> triggeredChecks;

    /** Lower edge of the confidence interval: used to value collateral. */
    public long lowerBound() {
        return confidence >= price ? 0 : SafeMath.sub(price, confidence);
    }

    /** Upper edge of the confidence interval: used to value debt. */
    public long upperBound() {
        return SafeMath.add(price, confidence);
    }

    /** Scale dividing raw prices into whole units: 10^-exponent. */
    public long priceScale() {
        return SafeMath.pow10(-exponent);
    }
}
