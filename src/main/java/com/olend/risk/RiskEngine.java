package com.olend.risk;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.exception.DivisionByZeroException;
import com.olend.exception.ManipulationDetectedException;
import com.olend.exception.ResourceNotFoundException;
import com.olend.math.SafeMath;
import com.olend.oracle.ValidatedPriceInfo;
import java.math.BigInteger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LTV, risk tier and liquidation-penalty computations.
 *
 * <p>All methods are pure with respect to the position: validated prices are passed in and
 * nothing about the position is stored. The engine owns three admin-updatable configs
 * (collateral policy, penalty rates, market conditions); each call reads a single snapshot
 * of the config it needs.
 *
 * <p>Valuation: {@code value = amount x price / 10^-exponent}. Collateral uses the lower
 * confidence bound, debt the upper bound.
 */
public class RiskEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskEngine.class);

    private final AtomicReference<CollateralPolicy> collateralPolicy;
    private final AtomicReference<PenaltyRateConfig> penaltyRateConfig;
    private final AtomicReference<MarketConditionFactors> marketConditions;
    private final AdminCapabilityAuthority authority;

    public RiskEngine(
            CollateralPolicy collateralPolicy,
            PenaltyRateConfig penaltyRateConfig,
            MarketConditionFactors marketConditions,
            AdminCapabilityAuthority authority) {
        collateralPolicy.validate();
        penaltyRateConfig.validate();
        marketConditions.validate();
        this.collateralPolicy = new AtomicReference<>(collateralPolicy);
        this.penaltyRateConfig = new AtomicReference<>(penaltyRateConfig);
        this.marketConditions = new AtomicReference<>(marketConditions);
        this.authority = authority;
    }

    // ========================
    // LTV
    // ========================

    /**
     * Composite LTV of the position: total borrowed value over total collateral value, in bps.
     *
     * @throws DivisionByZeroException if the position has debt but no collateral value
     */
    public long computeLtv(BorrowPosition position, Map<String, ValidatedPriceInfo> prices) {
        return ltv(position, valuate(position, prices));
    }

    /**
     * Prices the position and classifies it against the current collateral policy.
     */
    public LtvAssessment assess(BorrowPosition position, Map<String, ValidatedPriceInfo> prices, BorrowerTier tier) {
        CollateralPolicy policy = collateralPolicy.get();
        Valuation valuation = valuate(position, prices);
        long ltvBps = ltv(position, valuation);
        long maxAllowed = maxAllowedLtv(policy, valuation, tier);

        return LtvAssessment.builder()
                .positionId(position.getPositionId())
                .collateralValue(valuation.totalCollateral)
                .borrowedValue(valuation.borrowed)
                .ltvBps(ltvBps)
                .maxAllowedLtvBps(maxAllowed)
                .borrowerTier(tier)
                .riskTier(classify(policy, ltvBps))
                .build();
    }

    /**
     * {@code classCap + tierBonus}, clipped to the global hard cap.
     */
    public long maxAllowedLtv(AssetClass assetClass, BorrowerTier tier) {
        CollateralPolicy policy = collateralPolicy.get();
        Long cap = policy.getClassMaxLtvBps().get(assetClass);
        if (cap == null) {
            throw ResourceNotFoundException.assetClass(assetClass);
        }
        return SafeMath.min(SafeMath.add(cap, policy.tierBonus(tier)), policy.getGlobalHardCapBps());
    }

    public RiskTier classify(long ltvBps) {
        return classify(collateralPolicy.get(), ltvBps);
    }

    // ========================
    // PENALTY RATE
    // ========================

    /**
     * Dynamic penalty rate for a position backed by {@code collateralAssets}. The highest asset
     * multiplier among the collateral applies.
     */
    public long penaltyRate(Collection<String> collateralAssets, long now) {
        PenaltyRateConfig config = penaltyRateConfig.get();
        MarketConditionFactors factors = marketConditions.get();

        long multiplier = collateralAssets.isEmpty() ? SafeMath.BPS_DENOMINATOR : 0L;
        for (String asset : collateralAssets) {
            multiplier = SafeMath.max(multiplier, config.multiplierFor(asset));
        }

        boolean stale = now > factors.getUpdatedAt() && now - factors.getUpdatedAt() > config.getMaxFactorAgeSeconds();
        long volatilityAdjustment;
        long liquidityAdjustment;
        if (stale) {
            log.warn(
                    "Market condition factors are stale (updated at {}, now {}); assuming worst case",
                    factors.getUpdatedAt(),
                    now);
            volatilityAdjustment = config.getHighVolatilityAdjustmentBps();
            liquidityAdjustment = config.getLowLiquidityAdjustmentBps();
        } else {
            volatilityAdjustment = volatilityAdjustment(config, factors);
            liquidityAdjustment = liquidityAdjustment(config, factors);
        }

        long rate = SafeMath.percentage(config.getBaseRateBps(), multiplier);
        rate = SafeMath.percentage(rate, SafeMath.add(SafeMath.BPS_DENOMINATOR, volatilityAdjustment));
        rate = SafeMath.percentage(rate, SafeMath.add(SafeMath.BPS_DENOMINATOR, liquidityAdjustment));
        long clipped = SafeMath.clamp(rate, config.getMinRateBps(), config.getMaxRateBps());

        log.debug(
                "Penalty rate: base={}, multiplier={}, volAdj={}, liqAdj={}, raw={}, clipped={}",
                config.getBaseRateBps(),
                multiplier,
                volatilityAdjustment,
                liquidityAdjustment,
                rate,
                clipped);
        return clipped;
    }

    public long penaltyAmount(long borrowedValue, long penaltyRateBps) {
        return SafeMath.percentage(borrowedValue, penaltyRateBps);
    }

    // ========================
    // ADMIN
    // ========================

    public CollateralPolicy getCollateralPolicy() {
        return collateralPolicy.get();
    }

    public PenaltyRateConfig getPenaltyRateConfig() {
        return penaltyRateConfig.get();
    }

    public MarketConditionFactors getMarketConditions() {
        return marketConditions.get();
    }

    /**
     * @return the previous policy
     */
    public CollateralPolicy updateCollateralPolicy(AdminCapability capability, CollateralPolicy policy) {
        authority.verify(capability);
        policy.validate();
        CollateralPolicy previous = collateralPolicy.getAndSet(policy);
        log.info("Collateral policy updated: {} -> {}", previous, policy);
        return previous;
    }

    public PenaltyRateConfig updatePenaltyRates(AdminCapability capability, PenaltyRateConfig config) {
        authority.verify(capability);
        config.validate();
        PenaltyRateConfig previous = penaltyRateConfig.getAndSet(config);
        log.info("Penalty rates updated: {} -> {}", previous, config);
        return previous;
    }

    public MarketConditionFactors updateMarketConditions(AdminCapability capability, MarketConditionFactors factors) {
        authority.verify(capability);
        factors.validate();
        MarketConditionFactors previous = marketConditions.getAndSet(factors);
        log.info("Market conditions updated: {} -> {}", previous, factors);
        return previous;
    }

    // ========================
    // INTERNALS
    // ========================

    private static final class Valuation {
        private final Map<String, Long> collateralValues = new LinkedHashMap<>();
        private long totalCollateral;
        private long borrowed;
    }

    private Valuation valuate(BorrowPosition position, Map<String, ValidatedPriceInfo> prices) {
        Valuation valuation = new Valuation();
        Map<String, Long> collateral = position.getCollateral() != null ? position.getCollateral() : Map.of();
        for (Map.Entry<String, Long> entry : collateral.entrySet()) {
            ValidatedPriceInfo price = requirePrice(prices, entry.getKey());
            long value = value(entry.getValue(), price.lowerBound(), price.getExponent());
            valuation.collateralValues.put(entry.getKey(), value);
            valuation.totalCollateral = SafeMath.add(valuation.totalCollateral, value);
        }
        if (position.getBorrowedAmount() != 0) {
            ValidatedPriceInfo price = requirePrice(prices, position.getBorrowedAsset());
            valuation.borrowed = value(position.getBorrowedAmount(), price.upperBound(), price.getExponent());
        }
        return valuation;
    }

    private static long ltv(BorrowPosition position, Valuation valuation) {
        if (valuation.borrowed == 0) {
            return 0L;
        }
        if (valuation.totalCollateral == 0) {
            throw new DivisionByZeroException(
                    "Position " + position.getPositionId() + " has debt " + valuation.borrowed + " but no collateral value");
        }
        return SafeMath.mulDiv(valuation.borrowed, SafeMath.BPS_DENOMINATOR, valuation.totalCollateral);
    }

    /**
     * Value-weighted average of the collateral assets' class caps, plus the tier bonus.
     */
    private static long maxAllowedLtv(CollateralPolicy policy, Valuation valuation, BorrowerTier tier) {
        BigInteger weighted = BigInteger.ZERO;
        long minCap = Long.MAX_VALUE;
        for (Map.Entry<String, Long> entry : valuation.collateralValues.entrySet()) {
            long cap = classCap(policy, entry.getKey());
            minCap = SafeMath.min(minCap, cap);
            weighted = weighted.add(BigInteger.valueOf(entry.getValue()).multiply(BigInteger.valueOf(cap)));
        }

        long baseCap;
        if (valuation.collateralValues.isEmpty()) {
            baseCap = 0L;
        } else if (valuation.totalCollateral == 0) {
            baseCap = minCap;
        } else {
            baseCap = SafeMath.mulDiv(weighted, BigInteger.ONE, BigInteger.valueOf(valuation.totalCollateral));
        }
        return SafeMath.min(SafeMath.add(baseCap, policy.tierBonus(tier)), policy.getGlobalHardCapBps());
    }

    private static long classCap(CollateralPolicy policy, String asset) {
        AssetClass assetClass = policy.getAssetClasses().get(asset);
        if (assetClass == null) {
            throw ResourceNotFoundException.collateralAsset(asset);
        }
        return policy.getClassMaxLtvBps().get(assetClass);
    }

    private static RiskTier classify(CollateralPolicy policy, long ltvBps) {
        if (ltvBps >= policy.getLiquidationThresholdBps()) {
            return RiskTier.LIQUIDATABLE;
        }
        if (ltvBps >= policy.getWarningThresholdBps()) {
            return RiskTier.WARNING;
        }
        return RiskTier.HEALTHY;
    }

    private static long volatilityAdjustment(PenaltyRateConfig config, MarketConditionFactors factors) {
        int effective = Math.max(factors.getVolatilityLevel(), 100 - factors.getPriceStability());
        if (effective >= config.getHighVolatilityLevel()) {
            return config.getHighVolatilityAdjustmentBps();
        }
        if (effective >= config.getMediumVolatilityLevel()) {
            return config.getMediumVolatilityAdjustmentBps();
        }
        return 0L;
    }

    private static long liquidityAdjustment(PenaltyRateConfig config, MarketConditionFactors factors) {
        if (factors.getLiquidityDepth() <= config.getLowLiquidityDepth()) {
            return config.getLowLiquidityAdjustmentBps();
        }
        if (factors.getLiquidityDepth() <= config.getMediumLiquidityDepth()) {
            return config.getMediumLiquidityAdjustmentBps();
        }
        return 0L;
    }

    private static ValidatedPriceInfo requirePrice(Map<String, ValidatedPriceInfo> prices, String asset) {
        ValidatedPriceInfo price = prices.get(asset);
        if (price == null) {
            throw ResourceNotFoundException.validatedPrice(asset);
        }
        if (!price.isValid()) {
            throw new ManipulationDetectedException(asset, price.getManipulationRisk());
        }
        return price;
    }

    static long value(long amount, long price, int exponent) {
        return SafeMath.mulDiv(amount, price, SafeMath.pow10(-exponent));
    }
}
