package com.olend.risk;

import com.olend.penalty.PenaltySplit;
import lombok.Builder;
import lombok.Value;

/**
 * Amounts for executing a liquidation: the penalty charged on the borrowed value and its split.
 */
@Value
@Builder
public class LiquidationPlan {

    String positionId;
    long ltvBps;
    long borrowedValue;
    long penaltyRateBps;
    long penaltyAmount;
    PenaltySplit split;
}
