package com.olend.time;

/**
 * Monotonically non-decreasing logical clock supplied by the execution environment.
 * Staleness and recovery timeouts are evaluated against this, never against a local sleep.
 */
public interface TimeSource {

    /** Current logical timestamp in seconds. Never smaller than a previously returned value. */
    long nowSeconds();
}
