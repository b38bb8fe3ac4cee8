package com.olend.oracle;

import com.olend.exception.InvalidConfigException;
import com.olend.math.SafeMath;
import lombok.Builder;
import lombok.Value;

/**
 * Per-asset price feed configuration, owned by the {@link PriceFeedRegistry}.
 *
 * <p>Immutable; replaced wholesale through a capability-gated admin update.
 */
@Value
@Builder(toBuilder = true)
public class PriceFeedConfig {

    /** Asset symbol this feed prices (e.g. "BTC"). */
    String asset;

    /** External feed identifier (e.g. a Pyth price id). */
    String feedId;

    /** Decimal exponent of raw prices: real price = raw * 10^exponent. Range [-18, 0]. */
    int exponent;

    /** Expected update interval in seconds. Ages beyond this reduce the validation score. */
    long heartbeatSeconds;

    /** Hard staleness limit in seconds. Older observations are rejected. */
    long maxPriceDelaySeconds;

    /** Maximum single-step relative move (bps) before the spike check fires. */
    long maxDeviationBps;

    /** Maximum confidence / price ratio (bps) accepted. */
    long maxConfidenceBps;

    /** Scale dividing raw prices into whole units: 10^-exponent. */
    public long priceScale() {
        return SafeMath.pow10(-exponent);
    }

    /**
     * Rejects the whole config if any field is out of range.
     */
    public void validate() {
        if (asset == null || asset.isBlank()) {
            throw new InvalidConfigException("asset", asset, "must not be blank");
        }
        if (feedId == null || feedId.isBlank()) {
            throw new InvalidConfigException("feedId", feedId, "must not be blank");
        }
        if (exponent > 0 || exponent < -SafeMath.MAX_POW10_EXPONENT) {
            throw new InvalidConfigException("exponent", exponent, "must be within [-18, 0]");
        }
        if (heartbeatSeconds <= 0) {
            throw new InvalidConfigException("heartbeatSeconds", heartbeatSeconds, "must be positive");
        }
        if (maxPriceDelaySeconds < heartbeatSeconds) {
            throw new InvalidConfigException(
                    "maxPriceDelaySeconds", maxPriceDelaySeconds, "must be >= heartbeatSeconds " + heartbeatSeconds);
        }
        if (maxDeviationBps <= 0 || maxDeviationBps > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException("maxDeviationBps", maxDeviationBps, "must be within (0, 10000]");
        }
        if (maxConfidenceBps <= 0 || maxConfidenceBps > SafeMath.BPS_DENOMINATOR) {
            throw new InvalidConfigException("maxConfidenceBps", maxConfidenceBps, "must be within (0, 10000]");
        }
    }
}
