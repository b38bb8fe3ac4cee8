package com.olend.circuit;

import com.olend.exception.InvalidConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * Trip and recovery thresholds for a circuit breaker.
 */
@Value
@Builder(toBuilder = true)
public class ThresholdConfig {

    static final long MAX_WINDOW_SECONDS = 7L * 24 * 60 * 60;
    static final int MAX_FAILURE_THRESHOLD = 1_000;

    /** The breaker opens when failures inside the window exceed this count. */
    int failureThreshold;

    /** Rolling window (seconds) over which failures and volume are counted. */
    long timeWindowSeconds;

    /** Seconds an open breaker waits before letting trial operations through. */
    long recoveryTimeoutSeconds;

    /** The breaker opens when in-window volume exceeds this amount. 0 disables the volume trip. */
    long volumeThreshold;

    public boolean isVolumeTripEnabled() {
        return volumeThreshold > 0;
    }

    public void validate() {
        if (failureThreshold < 1 || failureThreshold > MAX_FAILURE_THRESHOLD) {
            throw new InvalidConfigException("failureThreshold", failureThreshold, "must be within [1, 1000]");
        }
        if (timeWindowSeconds < 1 || timeWindowSeconds > MAX_WINDOW_SECONDS) {
            throw new InvalidConfigException("timeWindowSeconds", timeWindowSeconds, "must be within [1s, 7d]");
        }
        if (recoveryTimeoutSeconds < 1 || recoveryTimeoutSeconds > MAX_WINDOW_SECONDS) {
            throw new InvalidConfigException(
                    "recoveryTimeoutSeconds", recoveryTimeoutSeconds, "must be within [1s, 7d]");
        }
        if (volumeThreshold < 0) {
            throw new InvalidConfigException("volumeThreshold", volumeThreshold, "must not be negative");
        }
    }
}
