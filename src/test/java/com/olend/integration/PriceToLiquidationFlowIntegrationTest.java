package com.olend.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;

import com.olend.admin.AdminCapabilityAuthority;
import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.CircuitPhase;
import com.olend.circuit.OperationKey;
import com.olend.circuit.OperationType;
import com.olend.circuit.ThresholdConfig;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.exception.CircuitOpenException;
import com.olend.exception.ManipulationDetectedException;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PriceFeedRegistry;
import com.olend.oracle.PriceOracleService;
import com.olend.oracle.PriceValidator;
import com.olend.oracle.PushPriceFeed;
import com.olend.oracle.RawPriceQuote;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.oracle.manipulation.ManipulationDetector;
import com.olend.penalty.PenaltyDistributionConfig;
import com.olend.penalty.PenaltyDistributor;
import com.olend.risk.AssetClass;
import com.olend.risk.BorrowPosition;
import com.olend.risk.BorrowerTier;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.ConfiguredBorrowerTierProvider;
import com.olend.risk.LiquidationDecision;
import com.olend.risk.LiquidationPlan;
import com.olend.risk.LtvAssessment;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import com.olend.risk.RiskEngine;
import com.olend.risk.RiskManager;
import com.olend.risk.RiskTier;
import com.olend.time.TimeSource;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Wires the real oracle, circuit breakers, risk engine and penalty distributor together, with
 * only the event publisher mocked, and drives a position from origination through a price drop,
 * a manipulated spike, the resulting halt and recovery.
 */
@ExtendWith(MockitoExtension.class)
class PriceToLiquidationFlowIntegrationTest {

    private static final long BTC_50K = 5_000_000_000_000L;
    private static final long ONE_USDC_PRICE = 100_000_000L;
    private static final long ONE_BTC = 100_000_000L;
    private static final long ONE_USDC = 100_000_000L;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private long now;
    private PushPriceFeed pushPriceFeed;
    private CircuitBreakerRegistry circuitBreakerRegistry;
    private PriceOracleService priceOracleService;
    private RiskManager riskManager;

    @BeforeEach
    void setUp() {
        now = 1_000;
        TimeSource timeSource = () -> now;
        AdminCapabilityAuthority authority = new AdminCapabilityAuthority("bootstrap-token");

        PriceFeedRegistry priceFeedRegistry = new PriceFeedRegistry(List.of(feed("BTC"), feed("USDC")), authority);
        ManipulationDetector manipulationDetector = new ManipulationDetector(ManipulationConfig.defaults(), authority);
        PriceValidator priceValidator = new PriceValidator(priceFeedRegistry, manipulationDetector, 100);
        pushPriceFeed = new PushPriceFeed();

        circuitBreakerRegistry = new CircuitBreakerRegistry(
                ThresholdConfig.builder()
                        .failureThreshold(3)
                        .timeWindowSeconds(60)
                        .recoveryTimeoutSeconds(120)
                        .build(),
                Map.of(),
                Set.of(OperationType.PRICE_FEED, OperationType.BORROW, OperationType.LIQUIDATE),
                authority,
                applicationEventPublisher);

        priceOracleService = new PriceOracleService(
                priceFeedRegistry,
                priceValidator,
                pushPriceFeed,
                circuitBreakerRegistry,
                timeSource,
                applicationEventPublisher);

        RiskEngine riskEngine = new RiskEngine(
                CollateralPolicy.builder()
                        .assetClasses(Map.of("BTC", AssetClass.MAJOR, "USDC", AssetClass.STABLECOIN))
                        .classMaxLtvBps(Map.of(AssetClass.MAJOR, 7_000L, AssetClass.STABLECOIN, 8_000L))
                        .tierBonusBps(Map.of())
                        .globalHardCapBps(9_000)
                        .warningThresholdBps(8_000)
                        .liquidationThresholdBps(8_500)
                        .build(),
                PenaltyRateConfig.builder()
                        .baseRateBps(500)
                        .minRateBps(300)
                        .maxRateBps(1_500)
                        .assetMultiplierBps(Map.of())
                        .build(),
                MarketConditionFactors.builder()
                        .volatilityLevel(30)
                        .liquidityDepth(80)
                        .priceStability(80)
                        .updatedAt(1_000)
                        .build(),
                authority);

        PenaltyDistributor penaltyDistributor = new PenaltyDistributor(
                PenaltyDistributionConfig.builder()
                        .liquidatorShareBps(3_000)
                        .platformShareBps(5_000)
                        .insuranceShareBps(2_000)
                        .build(),
                authority,
                applicationEventPublisher);

        riskManager = new RiskManager(
                priceOracleService,
                riskEngine,
                new ConfiguredBorrowerTierProvider(Map.of(), BorrowerTier.BRONZE),
                penaltyDistributor,
                circuitBreakerRegistry,
                timeSource,
                applicationEventPublisher);

        pushPriceFeed.push("BTC", new RawPriceQuote(BTC_50K, 0, -8, 1_000));
        pushPriceFeed.push("USDC", new RawPriceQuote(ONE_USDC_PRICE, 0, -8, 1_000));
    }

    private static PriceFeedConfig feed(String asset) {
        return PriceFeedConfig.builder()
                .asset(asset)
                .feedId(asset)
                .exponent(-8)
                .heartbeatSeconds(60)
                .maxPriceDelaySeconds(300)
                .maxDeviationBps(1_000)
                .maxConfidenceBps(200)
                .build();
    }

    private static BorrowPosition position(String id, Map<String, Long> collateral, long borrowedUsdc) {
        return BorrowPosition.builder()
                .positionId(id)
                .borrower("alice")
                .collateral(collateral)
                .borrowedAsset("USDC")
                .borrowedAmount(borrowedUsdc * ONE_USDC)
                .build();
    }

    @Test
    @DisplayName("Mixed collateral origination at 50% LTV is approved against the value-weighted cap")
    void originationApproved() {
        BorrowPosition position =
                position("pos-mixed", Map.of("BTC", 2 * ONE_BTC, "USDC", 10_000 * ONE_USDC), 55_000);

        LtvAssessment assessment = riskManager.validateOrigination(position);

        assertThat(assessment.getLtvBps()).isEqualTo(5_000);
        // (100000 x 7000 + 10000 x 8000) / 110000
        assertThat(assessment.getMaxAllowedLtvBps()).isEqualTo(7_090);
        assertThat(assessment.getRiskTier()).isEqualTo(RiskTier.HEALTHY);
        assertThat(circuitBreakerRegistry.snapshot(OperationKey.of(OperationType.PRICE_FEED, "BTC"), now).getPhase())
                .isEqualTo(CircuitPhase.CLOSED);
    }

    @Test
    @DisplayName("Price drop, manipulated spike, halt and recovery")
    void dropSpikeHaltRecover() {
        BorrowPosition levered = position("pos-levered", Map.of("BTC", ONE_BTC), 40_000);

        // 40000 / 50000: warning band
        LiquidationDecision atOrigin = riskManager.checkLiquidation(levered);
        assertThat(atOrigin.getAction()).isEqualTo(LiquidationDecision.Action.WARN);
        assertThat(atOrigin.getLtvBps()).isEqualTo(8_000);

        // 8% drop stays under the spike threshold; 40000 / 46000 is liquidatable
        now = 1_060;
        pushPriceFeed.push("BTC", new RawPriceQuote(4_600_000_000_000L, 0, -8, 1_060));
        Optional<LiquidationPlan> plan = riskManager.planLiquidation(levered);

        assertThat(plan).isPresent();
        assertThat(plan.get().getLtvBps()).isEqualTo(8_695);
        assertThat(plan.get().getPenaltyRateBps()).isEqualTo(500);
        assertThat(plan.get().getPenaltyAmount()).isEqualTo(200_000_000_000L);
        assertThat(plan.get().getSplit().getLiquidatorShare()).isEqualTo(60_000_000_000L);
        assertThat(plan.get().getSplit().getPlatformShare()).isEqualTo(100_000_000_000L);
        assertThat(plan.get().getSplit().getInsuranceShare()).isEqualTo(40_000_000_000L);

        // 46000 -> 60000 is more than twice the allowed deviation
        now = 1_100;
        pushPriceFeed.push("BTC", new RawPriceQuote(6_000_000_000_000L, 0, -8, 1_100));
        assertThatThrownBy(() -> riskManager.checkLiquidation(levered))
                .isInstanceOf(ManipulationDetectedException.class);

        ArgumentCaptor<ApplicationEvent> events = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, atLeastOnce()).publishEvent(events.capture());
        assertThat(events.getAllValues())
                .filteredOn(RiskEvent.class::isInstance)
                .map(event -> ((RiskEvent) event).getEventType())
                .contains(RiskEventType.MANIPULATION_DETECTED, RiskEventType.LTV_WARNING);

        now = 1_110;
        assertThatThrownBy(() -> riskManager.planLiquidation(levered)).isInstanceOf(CircuitOpenException.class);
        assertThatThrownBy(() -> priceOracleService.getValidatedPrice("BTC")).isInstanceOf(CircuitOpenException.class);
        assertThat(circuitBreakerRegistry.isOperationAllowed(OperationKey.of(OperationType.BORROW, "BTC"), now))
                .isFalse();
        assertThat(circuitBreakerRegistry.isOperationAllowed(OperationKey.of(OperationType.REPAY, "BTC"), now))
                .isTrue();

        // recovery timeout elapsed; a consistent quote closes the price breaker
        now = 1_220;
        pushPriceFeed.push("BTC", new RawPriceQuote(5_800_000_000_000L, 0, -8, 1_220));
        assertThat(priceOracleService.getValidatedPrice("BTC").isValid()).isTrue();
        assertThat(circuitBreakerRegistry.snapshot(OperationKey.of(OperationType.PRICE_FEED, "BTC"), now).getPhase())
                .isEqualTo(CircuitPhase.CLOSED);

        // 40000 / 58000 is healthy again
        assertThat(riskManager.planLiquidation(levered)).isEmpty();
    }
}
