package com.olend.config;

import com.olend.admin.AdminCapabilityAuthority;
import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.ThresholdConfig;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PriceFeedRegistry;
import com.olend.oracle.PriceValidator;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.oracle.manipulation.ManipulationDetector;
import com.olend.penalty.PenaltyDistributionConfig;
import com.olend.penalty.PenaltyDistributor;
import com.olend.risk.BorrowerTierProvider;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.ConfiguredBorrowerTierProvider;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import com.olend.risk.RiskEngine;
import com.olend.time.TimeSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the risk core components from {@link RiskProperties}.
 *
 * <p>Each config value object is validated by its component's constructor, so an invalid
 * {@code application.yml} fails start-up with an {@code InvalidConfigException}.
 *
 * <p>Properties prefix: {@code olend.risk.*}
 */
@Configuration
public class RiskConfig {

    @Bean
    public AdminCapabilityAuthority adminCapabilityAuthority(RiskProperties riskProperties) {
        return new AdminCapabilityAuthority(riskProperties.getAdmin().getBootstrapToken());
    }

    @Bean
    public ManipulationConfig manipulationConfig(RiskProperties riskProperties) {
        RiskProperties.Manipulation m = riskProperties.getManipulation();
        return ManipulationConfig.builder()
                .cumulativeWindowPoints(m.getCumulativeWindowPoints())
                .cumulativeThresholdBps(m.getCumulativeThresholdBps())
                .mismatchMoveBps(m.getMismatchMoveBps())
                .confidenceImprovementBps(m.getConfidenceImprovementBps())
                .oscillationWindowSeconds(m.getOscillationWindowSeconds())
                .oscillationMinMoveBps(m.getOscillationMinMoveBps())
                .build();
    }

    // ========================
    // ORACLE
    // ========================

    @Bean
    public PriceFeedRegistry priceFeedRegistry(RiskProperties riskProperties, AdminCapabilityAuthority authority) {
        List<PriceFeedConfig> feeds = riskProperties.getOracle().getFeeds().stream()
                .map(RiskConfig::toFeedConfig)
                .collect(Collectors.toList());
        return new PriceFeedRegistry(feeds, authority);
    }

    @Bean
    public PriceValidator priceValidator(
            RiskProperties riskProperties,
            PriceFeedRegistry priceFeedRegistry,
            ManipulationDetector manipulationDetector) {
        return new PriceValidator(
                priceFeedRegistry, manipulationDetector, riskProperties.getOracle().getHistoryCapacity());
    }

    // ========================
    // CIRCUIT BREAKERS
    // ========================

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            RiskProperties riskProperties,
            AdminCapabilityAuthority authority,
            ApplicationEventPublisher applicationEventPublisher) {
        RiskProperties.CircuitBreaker cb = riskProperties.getCircuitBreaker();
        Map<String, ThresholdConfig> overrides = new LinkedHashMap<>();
        cb.getOverrides().forEach((scope, thresholds) -> overrides.put(scope, toThresholdConfig(thresholds)));
        return new CircuitBreakerRegistry(
                toThresholdConfig(cb.getDefaults()),
                overrides,
                cb.getManipulationSensitiveOperations(),
                authority,
                applicationEventPublisher);
    }

    // ========================
    // RISK ENGINE & PENALTIES
    // ========================

    @Bean
    public RiskEngine riskEngine(
            RiskProperties riskProperties, AdminCapabilityAuthority authority, TimeSource timeSource) {
        RiskProperties.Collateral c = riskProperties.getCollateral();
        CollateralPolicy policy = CollateralPolicy.builder()
                .assetClasses(Map.copyOf(c.getAssetClasses()))
                .classMaxLtvBps(Map.copyOf(c.getClassMaxLtvBps()))
                .tierBonusBps(Map.copyOf(c.getTierBonusBps()))
                .globalHardCapBps(c.getGlobalHardCapBps())
                .warningThresholdBps(c.getWarningThresholdBps())
                .liquidationThresholdBps(c.getLiquidationThresholdBps())
                .build();

        RiskProperties.Penalty p = riskProperties.getPenalty();
        PenaltyRateConfig penaltyRates = PenaltyRateConfig.builder()
                .baseRateBps(p.getBaseRateBps())
                .minRateBps(p.getMinRateBps())
                .maxRateBps(p.getMaxRateBps())
                .assetMultiplierBps(Map.copyOf(p.getAssetMultiplierBps()))
                .maxFactorAgeSeconds(p.getMaxFactorAgeSeconds())
                .build();

        RiskProperties.Market m = riskProperties.getMarket();
        MarketConditionFactors market = MarketConditionFactors.builder()
                .volatilityLevel(m.getVolatilityLevel())
                .liquidityDepth(m.getLiquidityDepth())
                .priceStability(m.getPriceStability())
                .updatedAt(timeSource.nowSeconds())
                .build();

        return new RiskEngine(policy, penaltyRates, market, authority);
    }

    @Bean
    public PenaltyDistributor penaltyDistributor(
            RiskProperties riskProperties,
            AdminCapabilityAuthority authority,
            ApplicationEventPublisher applicationEventPublisher) {
        RiskProperties.Distribution d = riskProperties.getDistribution();
        PenaltyDistributionConfig config = PenaltyDistributionConfig.builder()
                .liquidatorShareBps(d.getLiquidatorShareBps())
                .platformShareBps(d.getPlatformShareBps())
                .insuranceShareBps(d.getInsuranceShareBps())
                .borrowerProtectionEnabled(d.isBorrowerProtectionEnabled())
                .build();
        return new PenaltyDistributor(config, authority, applicationEventPublisher);
    }

    @Bean
    public BorrowerTierProvider borrowerTierProvider(RiskProperties riskProperties) {
        RiskProperties.Tiers tiers = riskProperties.getTiers();
        return new ConfiguredBorrowerTierProvider(tiers.getBorrowers(), tiers.getDefaultTier());
    }

    private static PriceFeedConfig toFeedConfig(RiskProperties.Feed feed) {
        return PriceFeedConfig.builder()
                .asset(feed.getAsset())
                .feedId(feed.getFeedId() != null ? feed.getFeedId() : feed.getAsset())
                .exponent(feed.getExponent())
                .heartbeatSeconds(feed.getHeartbeatSeconds())
                .maxPriceDelaySeconds(feed.getMaxPriceDelaySeconds())
                .maxDeviationBps(feed.getMaxDeviationBps())
                .maxConfidenceBps(feed.getMaxConfidenceBps())
                .build();
    }

    private static ThresholdConfig toThresholdConfig(RiskProperties.Thresholds thresholds) {
        return ThresholdConfig.builder()
                .failureThreshold(thresholds.getFailureThreshold())
                .timeWindowSeconds(thresholds.getTimeWindowSeconds())
                .recoveryTimeoutSeconds(thresholds.getRecoveryTimeoutSeconds())
                .volumeThreshold(thresholds.getVolumeThreshold())
                .build();
    }
}
