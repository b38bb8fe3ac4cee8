package com.olend.circuit;

import lombok.Builder;
import lombok.Value;

/** Point-in-time view of one circuit breaker. */
@Value
@Builder
public class CircuitBreakerState {

    String operationKey;
    CircuitPhase phase;

    /** Failures inside the current rolling window. */
    int failureCount;

    /** Volume inside the current rolling window. */
    long windowVolume;

    long lastFailureTime;
    long lastSuccessTime;
    long phaseChangeTime;

    /** Why the breaker last opened, or null. */
    String lastTripReason;
}
