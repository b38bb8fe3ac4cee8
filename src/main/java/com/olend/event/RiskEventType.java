package com.olend.event;

/**
 * Classifies the condition that produced a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A quote failed staleness, confidence or structural validation. */
    PRICE_VALIDATION_FAILED,

    /** The manipulation detector raised the risk level of a price update to 2 or more. */
    MANIPULATION_DETECTED,

    /** A circuit breaker changed phase (Closed/Open/HalfOpen). */
    CIRCUIT_BREAKER_TRANSITION,

    /** The registry-wide emergency flag was set or cleared. */
    GLOBAL_EMERGENCY_CHANGED,

    /** A position entered the warning band (alert only, no forced action). */
    LTV_WARNING,

    /** A position crossed the liquidation threshold. */
    LIQUIDATION_TRIGGERED,

    /** A liquidation penalty was split among stakeholders. */
    PENALTY_DISTRIBUTED,

    /** An admin configuration update was applied. */
    CONFIG_UPDATED
}
