package com.olend.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Audit record of one admin configuration change.
 *
 * <p>Old and new values are the configs' string forms. {@code changedBy} is the id of the
 * capability that authorised the change.
 */
@Data
@Builder
public class ConfigChange {

    private Long id;

    /** FEED, THRESHOLDS, COLLATERAL_POLICY, DISTRIBUTION, MARKET_CONDITIONS, PENALTY_RATES, MANIPULATION, EMERGENCY, BREAKER_RESET, CAPABILITY. */
    private String configType;

    /** Asset, operation key or scope the change applies to; "GLOBAL" when not keyed. */
    private String configKey;

    private String oldValue;
    private String newValue;
    private String changedBy;

    /** Logical protocol time of the change. */
    private long logicalTimestamp;

    private LocalDateTime recordedAt;
}
