package com.olend.exception;

import java.util.Map;

/**
 * Thrown when a price observation is older than the feed's maximum price delay.
 * Staleness is judged against the logical clock only; the price value is irrelevant.
 */
public class StalePriceException extends BaseException {

    public StalePriceException(String asset, long ageSeconds, long maxDelaySeconds) {
        super(
                ErrorCode.STALE_PRICE,
                String.format("Price for %s is stale: age %ds exceeds max delay %ds", asset, ageSeconds, maxDelaySeconds),
                Map.of("asset", asset, "ageSeconds", ageSeconds, "maxDelaySeconds", maxDelaySeconds));
    }

    public StalePriceException(String asset, String message) {
        super(ErrorCode.STALE_PRICE, message, Map.of("asset", asset));
    }
}
