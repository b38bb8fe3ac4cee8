package com.olend.risk;

/**
 * Position health derived from its LTV.
 *
 * <ul>
 *   <li>HEALTHY: ltv below the warning threshold</li>
 *   <li>WARNING: at or above warning, below liquidation (alert only)</li>
 *   <li>LIQUIDATABLE: at or above the liquidation threshold</li>
 * </ul>
 */
public enum RiskTier {
    HEALTHY,
    WARNING,
    LIQUIDATABLE
}
