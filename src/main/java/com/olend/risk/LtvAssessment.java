package com.olend.risk;

import lombok.Builder;
import lombok.Value;

/**
 * Result of pricing a position: its LTV, the limit that applies to it and the resulting tier.
 *
 * <p>Collateral is valued at the lower confidence bound and debt at the upper bound.
 */
@Value
@Builder
public class LtvAssessment {

    String positionId;
    long collateralValue;
    long borrowedValue;
    long ltvBps;
    long maxAllowedLtvBps;
    BorrowerTier borrowerTier;
    RiskTier riskTier;

    public boolean exceedsMaxAllowed() {
        return ltvBps > maxAllowedLtvBps;
    }
}
