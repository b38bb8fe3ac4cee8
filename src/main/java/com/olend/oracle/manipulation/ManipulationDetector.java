package com.olend.oracle.manipulation;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.math.SafeMath;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PricePoint;
import java.math.BigInteger;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores a new price point against the asset's recent history for adversarial patterns.
 *
 * <p>Four independent checks, each able to raise the risk level:
 * <ol>
 *   <li><b>Spike:</b> single-step move above the feed's deviation threshold (2), or above
 *       twice the threshold (3).</li>
 *   <li><b>Cumulative drift:</b> the signed moves over the last N points sum past the
 *       cumulative threshold (2). Catches slow walks that stay under the spike limit.</li>
 *   <li><b>Confidence mismatch:</b> the confidence ratio tightens sharply while the price
 *       moves sharply (1).</li>
 *   <li><b>Oscillation:</b> within the window the price rose by at least the minimum move and
 *       the new point falls below the pre-rise level (2).</li>
 * </ol>
 *
 * <p>Stateless apart from its configuration; the caller owns the history and holds the
 * per-asset lock while assessing and appending.
 */
@Service
public class ManipulationDetector {

    private static final Logger log = LoggerFactory.getLogger(ManipulationDetector.class);

    private final AdminCapabilityAuthority authority;
    private final AtomicReference<ManipulationConfig> config;

    public ManipulationDetector(ManipulationConfig initialConfig, AdminCapabilityAuthority authority) {
        initialConfig.validate();
        this.config = new AtomicReference<>(initialConfig);
        this.authority = authority;
    }

    /**
     * Assesses {@code candidate} against {@code history} (oldest first, not including the candidate).
     */
    public ManipulationAssessment assess(List<PricePoint> history, PricePoint candidate, PriceFeedConfig feed) {
        if (history.isEmpty()) {
            return ManipulationAssessment.clean();
        }
        ManipulationConfig cfg = config.get();
        PricePoint previous = history.get(history.size() - 1);

        int risk = ManipulationAssessment.RISK_NONE;
        Set<ManipulationCheck> triggered = EnumSet.noneOf(ManipulationCheck.class);

        long step = SafeMath.absDiff(previous.getPrice(), candidate.getPrice());

        int spike = spikeSeverity(step, previous.getPrice(), feed.getMaxDeviationBps());
        if (spike > 0) {
            triggered.add(ManipulationCheck.SPIKE);
            risk = Math.max(risk, spike);
        }

        if (isCumulativeDrift(history, candidate, cfg)) {
            triggered.add(ManipulationCheck.CUMULATIVE_DRIFT);
            risk = Math.max(risk, ManipulationAssessment.RISK_HIGH);
        }

        if (isConfidenceMismatch(previous, candidate, step, cfg)) {
            triggered.add(ManipulationCheck.CONFIDENCE_MISMATCH);
            risk = Math.max(risk, ManipulationAssessment.RISK_LOW);
        }

        if (isOscillation(history, candidate, cfg)) {
            triggered.add(ManipulationCheck.OSCILLATION);
            risk = Math.max(risk, ManipulationAssessment.RISK_HIGH);
        }

        if (risk > ManipulationAssessment.RISK_NONE) {
            log.debug("Manipulation checks {} raised risk to {} for {}", triggered, risk, feed.getAsset());
        }
        return ManipulationAssessment.of(risk, triggered);
    }

    public ManipulationConfig getConfig() {
        return config.get();
    }

    /**
     * Replaces the detector thresholds. Validated in full before being applied.
     *
     * @return the previous configuration
     */
    public ManipulationConfig updateConfig(AdminCapability capability, ManipulationConfig newConfig) {
        authority.verify(capability);
        newConfig.validate();
        ManipulationConfig previous = config.getAndSet(newConfig);
        log.info("Manipulation detector config updated: {} -> {}", previous, newConfig);
        return previous;
    }

    // ========================
    // CHECKS
    // ========================

    private int spikeSeverity(long step, long previousPrice, long maxDeviationBps) {
        if (SafeMath.exceedsBps(step, previousPrice, SafeMath.mul(maxDeviationBps, 2))) {
            return ManipulationAssessment.RISK_CRITICAL;
        }
        if (SafeMath.exceedsBps(step, previousPrice, maxDeviationBps)) {
            return ManipulationAssessment.RISK_HIGH;
        }
        return ManipulationAssessment.RISK_NONE;
    }

    private boolean isCumulativeDrift(List<PricePoint> history, PricePoint candidate, ManipulationConfig cfg) {
        // last N points including the candidate yield N-1 moves
        int from = Math.max(0, history.size() - (cfg.getCumulativeWindowPoints() - 1));
        // signed sum of relative moves, held as an exact fraction
        BigInteger numerator = BigInteger.ZERO;
        BigInteger denominator = BigInteger.ONE;
        long prevPrice = history.get(from).getPrice();
        for (int i = from + 1; i <= history.size(); i++) {
            long price = i < history.size() ? history.get(i).getPrice() : candidate.getPrice();
            BigInteger base = BigInteger.valueOf(prevPrice);
            numerator = numerator.multiply(base)
                    .add(BigInteger.valueOf(price - prevPrice).multiply(denominator));
            denominator = denominator.multiply(base);
            BigInteger gcd = numerator.gcd(denominator);
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
            prevPrice = price;
        }
        BigInteger scaledDrift = numerator.abs().multiply(BigInteger.valueOf(SafeMath.BPS_DENOMINATOR));
        return scaledDrift.compareTo(BigInteger.valueOf(cfg.getCumulativeThresholdBps()).multiply(denominator)) > 0;
    }

    private boolean isConfidenceMismatch(
            PricePoint previous, PricePoint candidate, long step, ManipulationConfig cfg) {
        if (!SafeMath.reachesBps(step, previous.getPrice(), cfg.getMismatchMoveBps())) {
            return false;
        }
        if (previous.getConfidence() == 0) {
            return false;
        }
        // candConf / candPrice <= prevConf / prevPrice * (10000 - improvement) / 10000, cross-multiplied
        BigInteger candidateSide = BigInteger.valueOf(candidate.getConfidence())
                .multiply(BigInteger.valueOf(previous.getPrice()))
                .multiply(BigInteger.valueOf(SafeMath.BPS_DENOMINATOR));
        BigInteger ceilingSide = BigInteger.valueOf(previous.getConfidence())
                .multiply(BigInteger.valueOf(candidate.getPrice()))
                .multiply(BigInteger.valueOf(
                        SafeMath.sub(SafeMath.BPS_DENOMINATOR, cfg.getConfidenceImprovementBps())));
        return candidateSide.compareTo(ceilingSide) <= 0;
    }

    private boolean isOscillation(List<PricePoint> history, PricePoint candidate, ManipulationConfig cfg) {
        long windowStart = candidate.getTimestamp() - cfg.getOscillationWindowSeconds();
        long maxAfter = -1;
        for (int i = history.size() - 1; i >= 0; i--) {
            PricePoint base = history.get(i);
            if (base.getTimestamp() < windowStart) {
                break;
            }
            boolean pumped = maxAfter >= base.getPrice()
                    && SafeMath.reachesBps(maxAfter - base.getPrice(), base.getPrice(), cfg.getOscillationMinMoveBps());
            if (pumped && candidate.getPrice() < base.getPrice()) {
                return true;
            }
            maxAfter = Math.max(maxAfter, base.getPrice());
        }
        return false;
    }
}
