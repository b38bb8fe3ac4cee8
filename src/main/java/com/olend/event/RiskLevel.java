package com.olend.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for routine changes, WARNING for conditions that need attention,
 * and CRITICAL for conditions that block operations (breaker trips, manipulation,
 * global emergency, liquidation).
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
