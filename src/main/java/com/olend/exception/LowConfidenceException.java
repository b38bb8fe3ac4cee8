package com.olend.exception;

import java.util.Map;

public class LowConfidenceException extends BaseException {

    public LowConfidenceException(String asset, long confidenceBps, long maxConfidenceBps) {
        super(
                ErrorCode.LOW_CONFIDENCE,
                String.format(
                        "Price for %s has too wide a confidence interval: %d bps > %d bps",
                        asset, confidenceBps, maxConfidenceBps),
                Map.of("asset", asset, "confidenceBps", confidenceBps, "maxConfidenceBps", maxConfidenceBps));
    }
}
