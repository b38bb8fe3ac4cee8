package com.olend.oracle;

import com.olend.exception.InvalidPriceException;
import com.olend.exception.LowConfidenceException;
import com.olend.exception.StalePriceException;
import com.olend.math.SafeMath;
import com.olend.oracle.manipulation.ManipulationAssessment;
import com.olend.oracle.manipulation.ManipulationDetector;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-asset price validation producing a {@link ValidatedPriceInfo}.
 *
 * <p>Checks, in order:
 * <ol>
 *   <li>Structural: price must be positive, observation may not lie in the future</li>
 *   <li>Staleness: {@code now - observedAt <= maxPriceDelay}, else {@link StalePriceException}</li>
 *   <li>Confidence: {@code confidence / price <= maxConfidence}, else {@link LowConfidenceException}</li>
 *   <li>Ordering: observation may not be older than the newest history point</li>
 * </ol>
 *
 * <p>On success the point is scored by the {@link ManipulationDetector} and appended to the
 * asset's bounded history. Re-validating the newest observation (same timestamp, price and
 * confidence) recomputes the same result without appending a duplicate. Every check runs before the append, so a failed validation leaves
 * the history untouched.
 *
 * <p><b>Thread safety:</b> each asset's {@link PriceHistory} instance is its lock. Different
 * assets validate concurrently; the same asset serializes.
 */
public class PriceValidator {

    /** Validation score penalty per manipulation risk level. */
    static final int RISK_PENALTY = 25;

    /** Maximum penalty each of staleness and confidence width can contribute. */
    static final int MAX_QUALITY_PENALTY = 10;

    private final PriceFeedRegistry priceFeedRegistry;
    private final ManipulationDetector manipulationDetector;
    private final int historyCapacity;
    private final Map<String, PriceHistory> histories = new ConcurrentHashMap<>();

    public PriceValidator(
            PriceFeedRegistry priceFeedRegistry, ManipulationDetector manipulationDetector, int historyCapacity) {
        this.priceFeedRegistry = priceFeedRegistry;
        this.manipulationDetector = manipulationDetector;
        this.historyCapacity = historyCapacity;
    }

    public ValidatedPriceInfo validate(String asset, long rawPrice, long confidence, long observedAt, long now) {
        PriceFeedConfig feed = priceFeedRegistry.require(asset);

        if (rawPrice <= 0) {
            throw new InvalidPriceException(asset, "Price for " + asset + " must be positive: " + rawPrice);
        }
        if (confidence < 0) {
            throw new InvalidPriceException(asset, "Confidence for " + asset + " must not be negative: " + confidence);
        }
        if (observedAt > now) {
            throw new InvalidPriceException(
                    asset, "Price for " + asset + " observed in the future: " + observedAt + " > " + now);
        }

        long age = now - observedAt;
        if (age > feed.getMaxPriceDelaySeconds()) {
            throw new StalePriceException(asset, age, feed.getMaxPriceDelaySeconds());
        }

        long confidenceBps = SafeMath.mulDiv(confidence, SafeMath.BPS_DENOMINATOR, rawPrice);
        if (SafeMath.exceedsBps(confidence, rawPrice, feed.getMaxConfidenceBps())) {
            throw new LowConfidenceException(asset, confidenceBps, feed.getMaxConfidenceBps());
        }

        PricePoint point = new PricePoint(rawPrice, confidence, observedAt);
        PriceHistory history = histories.computeIfAbsent(asset, a -> new PriceHistory(historyCapacity));

        synchronized (history) {
            PricePoint last = history.last();
            if (last != null && observedAt < last.getTimestamp()) {
                throw new InvalidPriceException(
                        asset,
                        "Price for " + asset + " is older than history: " + observedAt + " < " + last.getTimestamp());
            }

            // a re-read of the newest observation is scored against the history before it, not appended twice
            boolean reRead = point.equals(last);
            List<PricePoint> prior = history.snapshot();
            if (reRead) {
                prior.remove(prior.size() - 1);
            }

            ManipulationAssessment assessment = manipulationDetector.assess(prior, point, feed);
            int score = score(feed, age, confidenceBps, assessment.getRiskLevel());

            if (!reRead) {
                history.append(point);
            }

            return ValidatedPriceInfo.builder()
                    .asset(asset)
                    .price(rawPrice)
                    .confidence(confidence)
                    .exponent(feed.getExponent())
                    .timestamp(observedAt)
                    .validationScore(score)
                    .manipulationRisk(assessment.getRiskLevel())
                    .valid(!assessment.isManipulation())
                    .triggeredChecks(assessment.getTriggeredChecks())
                    .build();
        }
    }

    /**
     * Oldest-first copy of an asset's accepted price history.
     */
    public List<PricePoint> history(String asset) {
        PriceHistory history = histories.get(asset);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return history.snapshot();
        }
    }

    public Optional<PricePoint> lastPoint(String asset) {
        PriceHistory history = histories.get(asset);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return Optional.ofNullable(history.last());
        }
    }

    // ========================
    // SCORING
    // ========================

    /**
     * 100 minus staleness (0-10), confidence width (0-10) and manipulation (25 per level) penalties.
     */
    private int score(PriceFeedConfig feed, long age, long confidenceBps, int riskLevel) {
        long stalenessPenalty = 0;
        if (age > feed.getHeartbeatSeconds()) {
            long span = feed.getMaxPriceDelaySeconds() - feed.getHeartbeatSeconds();
            stalenessPenalty = span == 0
                    ? MAX_QUALITY_PENALTY
                    : SafeMath.min(
                            MAX_QUALITY_PENALTY,
                            SafeMath.mulDiv(age - feed.getHeartbeatSeconds(), MAX_QUALITY_PENALTY, span));
        }
        long confidencePenalty = SafeMath.mulDiv(confidenceBps, MAX_QUALITY_PENALTY, feed.getMaxConfidenceBps());
        long penalty = stalenessPenalty + confidencePenalty + (long) RISK_PENALTY * riskLevel;
        return (int) SafeMath.clamp(100 - penalty, 0, 100);
    }
}
