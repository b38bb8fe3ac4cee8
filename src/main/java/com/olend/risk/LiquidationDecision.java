package com.olend.risk;

import lombok.Getter;

/**
 * Outcome of a liquidation check: none, warn, or liquidatable with the dynamic penalty rate.
 */
@Getter
public class LiquidationDecision {

    public enum Action {
        NONE,
        WARN,
        LIQUIDATABLE
    }

    private final String positionId;
    private final Action action;
    private final long ltvBps;
    private final long penaltyRateBps;

    private LiquidationDecision(String positionId, Action action, long ltvBps, long penaltyRateBps) {
        this.positionId = positionId;
        this.action = action;
        this.ltvBps = ltvBps;
        this.penaltyRateBps = penaltyRateBps;
    }

    public static LiquidationDecision none(String positionId, long ltvBps) {
        return new LiquidationDecision(positionId, Action.NONE, ltvBps, 0);
    }

    public static LiquidationDecision warn(String positionId, long ltvBps) {
        return new LiquidationDecision(positionId, Action.WARN, ltvBps, 0);
    }

    public static LiquidationDecision liquidatable(String positionId, long ltvBps, long penaltyRateBps) {
        return new LiquidationDecision(positionId, Action.LIQUIDATABLE, ltvBps, penaltyRateBps);
    }

    public boolean isLiquidatable() {
        return action == Action.LIQUIDATABLE;
    }
}
