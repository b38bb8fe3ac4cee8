package com.olend.risk;

import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.CircuitDecision;
import com.olend.circuit.OperationKey;
import com.olend.circuit.OperationType;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.exception.BaseException;
import com.olend.exception.CircuitOpenException;
import com.olend.exception.LtvLimitExceededException;
import com.olend.oracle.PriceOracleService;
import com.olend.oracle.ValidatedPriceInfo;
import com.olend.penalty.PenaltyDistributor;
import com.olend.penalty.PenaltySplit;
import com.olend.time.TimeSource;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Orchestrates position risk for the borrowing and liquidation layer.
 *
 * <p>Every call fetches trusted prices for all assets of the position through the
 * {@link PriceOracleService}, resolves the borrower tier, and delegates the math to the
 * {@link RiskEngine}. Operations that gate an action (origination, liquidation) consult the
 * relevant circuit breakers first.
 *
 * <p>Events published:
 * <ul>
 *   <li>{@code LTV_WARNING} when a position is in the warning band</li>
 *   <li>{@code LIQUIDATION_TRIGGERED} when a position is liquidatable</li>
 * </ul>
 */
@Service
public class RiskManager {

    private static final Logger log = LoggerFactory.getLogger(RiskManager.class);

    private final PriceOracleService priceOracleService;
    private final RiskEngine riskEngine;
    private final BorrowerTierProvider borrowerTierProvider;
    private final PenaltyDistributor penaltyDistributor;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeSource timeSource;
    private final ApplicationEventPublisher applicationEventPublisher;

    public RiskManager(
            PriceOracleService priceOracleService,
            RiskEngine riskEngine,
            BorrowerTierProvider borrowerTierProvider,
            PenaltyDistributor penaltyDistributor,
            CircuitBreakerRegistry circuitBreakerRegistry,
            TimeSource timeSource,
            ApplicationEventPublisher applicationEventPublisher) {
        this.priceOracleService = priceOracleService;
        this.riskEngine = riskEngine;
        this.borrowerTierProvider = borrowerTierProvider;
        this.penaltyDistributor = penaltyDistributor;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeSource = timeSource;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ========================
    // LTV
    // ========================

    public LtvAssessment computePositionLtv(BorrowPosition position) {
        return computePositionLtv(position, timeSource.nowSeconds());
    }

    /**
     * Prices the position at {@code now} and returns its LTV and tier. A position in the
     * warning band emits an alert; no action is forced.
     */
    public LtvAssessment computePositionLtv(BorrowPosition position, long now) {
        LtvAssessment assessment = assess(position, now);
        if (assessment.getRiskTier() == RiskTier.WARNING) {
            publishLtvWarning(assessment, now);
        }
        return assessment;
    }

    // ========================
    // LIQUIDATION
    // ========================

    public LiquidationDecision checkLiquidation(BorrowPosition position) {
        return checkLiquidation(position, timeSource.nowSeconds());
    }

    public LiquidationDecision checkLiquidation(BorrowPosition position, long now) {
        return decide(position, assess(position, now), now);
    }

    public Optional<LiquidationPlan> planLiquidation(BorrowPosition position) {
        return planLiquidation(position, timeSource.nowSeconds());
    }

    /**
     * Computes the penalty amount and its split for a liquidatable position.
     *
     * @return empty if the position is not liquidatable
     * @throws CircuitOpenException if liquidation is halted for any collateral asset
     */
    public Optional<LiquidationPlan> planLiquidation(BorrowPosition position, long now) {
        Map<OperationKey, CircuitDecision> gates = new LinkedHashMap<>();
        for (String asset : collateralAssets(position)) {
            OperationKey key = OperationKey.of(OperationType.LIQUIDATE, asset);
            gates.put(key, requireOpen(key, now));
        }

        LtvAssessment assessment;
        LiquidationDecision decision;
        try {
            assessment = assess(position, now);
            decision = decide(position, assessment, now);
        } catch (BaseException e) {
            recordTrialFailures(gates, now, e);
            throw e;
        }
        recordSuccesses(gates, now);
        if (!decision.isLiquidatable()) {
            return Optional.empty();
        }

        long borrowedValue = assessment.getBorrowedValue();
        long penaltyAmount = riskEngine.penaltyAmount(borrowedValue, decision.getPenaltyRateBps());
        PenaltySplit split = penaltyDistributor.split(penaltyAmount);

        return Optional.of(LiquidationPlan.builder()
                .positionId(position.getPositionId())
                .ltvBps(decision.getLtvBps())
                .borrowedValue(borrowedValue)
                .penaltyRateBps(decision.getPenaltyRateBps())
                .penaltyAmount(penaltyAmount)
                .split(split)
                .build());
    }

    // ========================
    // ORIGINATION
    // ========================

    public LtvAssessment validateOrigination(BorrowPosition position) {
        return validateOrigination(position, timeSource.nowSeconds());
    }

    /**
     * Approves a new or increased borrow. All checks run before the borrow volume is recorded
     * on the breaker. The outcome is reported to the gating breakers, so a half-open trial
     * closes them on approval and reopens them on rejection.
     *
     * @throws CircuitOpenException if borrowing the asset is halted
     * @throws LtvLimitExceededException if the position would exceed its maximum allowed LTV
     */
    public LtvAssessment validateOrigination(BorrowPosition position, long now) {
        OperationKey key = OperationKey.of(OperationType.BORROW, position.getBorrowedAsset());
        Map<OperationKey, CircuitDecision> gates = new LinkedHashMap<>();
        gates.put(OperationKey.of(OperationType.BORROW), requireOpen(OperationKey.of(OperationType.BORROW), now));
        gates.put(key, requireOpen(key, now));

        LtvAssessment assessment;
        try {
            assessment = assess(position, now);
            if (assessment.exceedsMaxAllowed()) {
                log.warn(
                        "Origination rejected for {}: ltv {} bps exceeds max {} bps",
                        position.getPositionId(),
                        assessment.getLtvBps(),
                        assessment.getMaxAllowedLtvBps());
                throw new LtvLimitExceededException(
                        position.getPositionId(), assessment.getLtvBps(), assessment.getMaxAllowedLtvBps());
            }
        } catch (BaseException e) {
            recordTrialFailures(gates, now, e);
            throw e;
        }

        // closes a half-open breaker before its volume window restarts
        recordSuccesses(gates, now);
        circuitBreakerRegistry.recordVolume(key, position.getBorrowedAmount(), now);
        return assessment;
    }

    // ========================
    // INTERNALS
    // ========================

    private LtvAssessment assess(BorrowPosition position, long now) {
        Map<String, ValidatedPriceInfo> prices = new LinkedHashMap<>();
        for (String asset : collateralAssets(position)) {
            prices.put(asset, priceOracleService.requireTrustedPrice(asset, now));
        }
        if (position.getBorrowedAmount() != 0 && !prices.containsKey(position.getBorrowedAsset())) {
            prices.put(
                    position.getBorrowedAsset(),
                    priceOracleService.requireTrustedPrice(position.getBorrowedAsset(), now));
        }
        BorrowerTier tier = borrowerTierProvider.tierOf(position.getBorrower());
        return riskEngine.assess(position, prices, tier);
    }

    private LiquidationDecision decide(BorrowPosition position, LtvAssessment assessment, long now) {
        switch (assessment.getRiskTier()) {
            case WARNING:
                publishLtvWarning(assessment, now);
                return LiquidationDecision.warn(position.getPositionId(), assessment.getLtvBps());
            case LIQUIDATABLE:
                long rate = riskEngine.penaltyRate(collateralAssets(position), now);
                log.warn(
                        "Position {} is liquidatable: ltv={} bps, penalty rate={} bps",
                        position.getPositionId(),
                        assessment.getLtvBps(),
                        rate);
                applicationEventPublisher.publishEvent(new RiskEvent(
                        this,
                        RiskEventType.LIQUIDATION_TRIGGERED,
                        RiskLevel.CRITICAL,
                        position.getPositionId(),
                        "Position " + position.getPositionId() + " is liquidatable at " + assessment.getLtvBps() + " bps",
                        Map.of(
                                "ltvBps", assessment.getLtvBps(),
                                "liquidationThresholdBps",
                                riskEngine.getCollateralPolicy().getLiquidationThresholdBps(),
                                "penaltyRateBps", rate),
                        now));
                return LiquidationDecision.liquidatable(position.getPositionId(), assessment.getLtvBps(), rate);
            default:
                return LiquidationDecision.none(position.getPositionId(), assessment.getLtvBps());
        }
    }

    private CircuitDecision requireOpen(OperationKey key, long now) {
        CircuitDecision decision = circuitBreakerRegistry.check(key, now);
        if (decision.isRejected()) {
            throw new CircuitOpenException(key.toString(), decision.getReason());
        }
        return decision;
    }

    private void recordSuccesses(Map<OperationKey, CircuitDecision> gates, long now) {
        gates.keySet().forEach(key -> circuitBreakerRegistry.recordSuccess(key, now));
    }

    /** Only breakers that admitted the call as a half-open trial count the rejection. */
    private void recordTrialFailures(Map<OperationKey, CircuitDecision> gates, long now, BaseException cause) {
        gates.forEach((key, decision) -> {
            if (decision.isTrial()) {
                log.warn("Trial for {} failed: {}", key, cause.getMessage());
                circuitBreakerRegistry.recordFailure(key, now, cause.getErrorCode().getCode());
            }
        });
    }

    private void publishLtvWarning(LtvAssessment assessment, long now) {
        log.warn(
                "Position {} in warning band: ltv={} bps, warning threshold={} bps",
                assessment.getPositionId(),
                assessment.getLtvBps(),
                riskEngine.getCollateralPolicy().getWarningThresholdBps());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.LTV_WARNING,
                RiskLevel.WARNING,
                assessment.getPositionId(),
                "Position " + assessment.getPositionId() + " LTV " + assessment.getLtvBps() + " bps is in the warning band",
                Map.of(
                        "ltvBps", assessment.getLtvBps(),
                        "collateralValue", assessment.getCollateralValue(),
                        "borrowedValue", assessment.getBorrowedValue()),
                now));
    }

    private static Set<String> collateralAssets(BorrowPosition position) {
        return position.getCollateral() != null ? new LinkedHashSet<>(position.getCollateral().keySet()) : Set.of();
    }
}
