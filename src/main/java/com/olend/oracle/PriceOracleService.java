package com.olend.oracle;

import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.CircuitDecision;
import com.olend.circuit.OperationKey;
import com.olend.circuit.OperationType;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.exception.BaseException;
import com.olend.exception.CircuitOpenException;
import com.olend.exception.InvalidPriceException;
import com.olend.exception.ManipulationDetectedException;
import com.olend.exception.StalePriceException;
import com.olend.oracle.manipulation.ManipulationAssessment;
import com.olend.time.TimeSource;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Entry point for price consumers: fetches the latest quote, validates it and feeds the
 * outcome into the asset's {@code PRICE_FEED} circuit breaker.
 *
 * <p>Flow for {@link #getValidatedPrice(String, long)}:
 * <ol>
 *   <li>Gate on the {@code PRICE_FEED:asset} breaker (open -> {@link CircuitOpenException})</li>
 *   <li>Read the newest quote from the {@link PriceFeed}</li>
 *   <li>Validate via {@link PriceValidator}; a validation failure is recorded on the breaker,
 *       published, and rethrown</li>
 *   <li>Risk level 2+ trips every manipulation-sensitive breaker of the asset; the info is
 *       returned with {@code valid = false}</li>
 *   <li>Otherwise the success closes a half-open breaker</li>
 * </ol>
 *
 * <p>The latest info per asset is cached; only that single slot is kept.
 */
@Service
public class PriceOracleService {

    private static final Logger log = LoggerFactory.getLogger(PriceOracleService.class);

    private final PriceFeedRegistry priceFeedRegistry;
    private final PriceValidator priceValidator;
    private final PriceFeed priceFeed;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeSource timeSource;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final Map<String, ValidatedPriceInfo> latestByAsset = new ConcurrentHashMap<>();

    public PriceOracleService(
            PriceFeedRegistry priceFeedRegistry,
            PriceValidator priceValidator,
            PriceFeed priceFeed,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TimeSource timeSource,
            ApplicationEventPublisher applicationEventPublisher) {
        this.priceFeedRegistry = priceFeedRegistry;
        this.priceValidator = priceValidator;
        this.priceFeed = priceFeed;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeSource = timeSource;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public ValidatedPriceInfo getValidatedPrice(String asset) {
        return getValidatedPrice(asset, timeSource.nowSeconds());
    }

    /**
     * Validates the newest quote for {@code asset} at logical time {@code now}.
     *
     * @return the validated info; {@code valid} is false when manipulation was flagged
     * @throws CircuitOpenException if the asset's price breaker is open or a global emergency is active
     */
    public ValidatedPriceInfo getValidatedPrice(String asset, long now) {
        PriceFeedConfig feed = priceFeedRegistry.require(asset);
        OperationKey key = OperationKey.of(OperationType.PRICE_FEED, asset);

        CircuitDecision decision = circuitBreakerRegistry.check(key, now);
        if (decision.isRejected()) {
            throw new CircuitOpenException(key.toString(), decision.getReason());
        }

        ValidatedPriceInfo info;
        try {
            RawPriceQuote quote = priceFeed
                    .latest(feed.getFeedId())
                    .orElseThrow(() -> new StalePriceException(asset, "No quote available for " + asset));
            if (quote.exponent() != feed.getExponent()) {
                throw new InvalidPriceException(
                        asset,
                        "Quote exponent " + quote.exponent() + " does not match feed exponent " + feed.getExponent());
            }
            info = priceValidator.validate(asset, quote.price(), quote.confidence(), quote.observedAt(), now);
        } catch (BaseException e) {
            log.warn("Price validation failed for {}: {}", asset, e.getMessage());
            circuitBreakerRegistry.recordFailure(key, now, e.getErrorCode().getCode());
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.PRICE_VALIDATION_FAILED,
                    RiskLevel.WARNING,
                    asset,
                    e.getMessage(),
                    Map.of("errorCode", e.getErrorCode().getCode()),
                    now));
            throw e;
        }

        if (!info.isValid()) {
            if (info.getManipulationRisk() >= ManipulationAssessment.RISK_CRITICAL) {
                log.error("Critical price manipulation for {}: checks {}", asset, info.getTriggeredChecks());
            } else {
                log.warn("Price manipulation for {}: checks {}", asset, info.getTriggeredChecks());
            }
            circuitBreakerRegistry.reportManipulation(asset, info.getManipulationRisk(), now);
            ValidatedPriceInfo before = latestByAsset.get(asset);
            applicationEventPublisher.publishEvent(new RiskEvent(
                    this,
                    RiskEventType.MANIPULATION_DETECTED,
                    RiskLevel.CRITICAL,
                    asset,
                    "Manipulation detected for " + asset + " (risk level " + info.getManipulationRisk() + ")",
                    Map.of(
                            "before", before != null ? before.getPrice() : "none",
                            "after", info.getPrice(),
                            "riskLevel", info.getManipulationRisk(),
                            "checks", info.getTriggeredChecks().toString()),
                    now));
        } else {
            circuitBreakerRegistry.recordSuccess(key, now);
        }

        latestByAsset.put(asset, info);
        return info;
    }

    public ValidatedPriceInfo requireTrustedPrice(String asset) {
        return requireTrustedPrice(asset, timeSource.nowSeconds());
    }

    /**
     * Like {@link #getValidatedPrice(String, long)} but refuses a price flagged as manipulated.
     *
     * @throws ManipulationDetectedException if the price is not valid
     */
    public ValidatedPriceInfo requireTrustedPrice(String asset, long now) {
        ValidatedPriceInfo info = getValidatedPrice(asset, now);
        if (!info.isValid()) {
            throw new ManipulationDetectedException(asset, info.getManipulationRisk());
        }
        return info;
    }

    /** Last validated info for the asset, without fetching or re-validating. */
    public Optional<ValidatedPriceInfo> cachedPrice(String asset) {
        return Optional.ofNullable(latestByAsset.get(asset));
    }
}
