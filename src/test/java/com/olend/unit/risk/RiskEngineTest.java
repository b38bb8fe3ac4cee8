package com.olend.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.exception.DivisionByZeroException;
import com.olend.exception.InvalidConfigException;
import com.olend.exception.ManipulationDetectedException;
import com.olend.exception.ResourceNotFoundException;
import com.olend.exception.UnauthorizedException;
import com.olend.oracle.ValidatedPriceInfo;
import com.olend.risk.AssetClass;
import com.olend.risk.BorrowPosition;
import com.olend.risk.BorrowerTier;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.LtvAssessment;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import com.olend.risk.RiskEngine;
import com.olend.risk.RiskTier;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RiskEngineTest {

    private static final long UNIT = 100_000_000L;
    private static final long T0 = 1_000;

    private AdminCapability admin;
    private RiskEngine riskEngine;

    @BeforeEach
    void setUp() {
        AdminCapabilityAuthority authority = new AdminCapabilityAuthority("t");
        admin = authority.resolve("t");
        CollateralPolicy policy = CollateralPolicy.builder()
                .assetClasses(Map.of(
                        "BTC", AssetClass.MAJOR,
                        "ETH", AssetClass.MAJOR,
                        "USDC", AssetClass.STABLECOIN,
                        "SUI", AssetClass.ALTCOIN))
                .classMaxLtvBps(Map.of(AssetClass.STABLECOIN, 8_000L, AssetClass.MAJOR, 7_000L, AssetClass.ALTCOIN, 5_000L))
                .tierBonusBps(Map.of(BorrowerTier.GOLD, 200L, BorrowerTier.DIAMOND, 400L))
                .globalHardCapBps(9_000)
                .warningThresholdBps(8_000)
                .liquidationThresholdBps(8_500)
                .build();
        PenaltyRateConfig rates = PenaltyRateConfig.builder()
                .baseRateBps(500)
                .minRateBps(300)
                .maxRateBps(1_500)
                .assetMultiplierBps(Map.of("SUI", 15_000L, "CHEAP", 5_000L))
                .build();
        MarketConditionFactors calm = MarketConditionFactors.builder()
                .volatilityLevel(30)
                .liquidityDepth(80)
                .priceStability(80)
                .updatedAt(T0)
                .build();
        riskEngine = new RiskEngine(policy, rates, calm, authority);
    }

    private static ValidatedPriceInfo price(String asset, long wholePrice, long confidence) {
        return ValidatedPriceInfo.builder()
                .asset(asset)
                .price(wholePrice * UNIT)
                .confidence(confidence)
                .exponent(-8)
                .timestamp(T0)
                .validationScore(100)
                .manipulationRisk(0)
                .valid(true)
                .triggeredChecks(Set.of())
                .build();
    }

    private static BorrowPosition position(Map<String, Long> collateral, String borrowedAsset, long borrowed) {
        return BorrowPosition.builder()
                .positionId("pos-1")
                .borrower("alice")
                .collateral(collateral)
                .borrowedAsset(borrowedAsset)
                .borrowedAmount(borrowed)
                .build();
    }

    private void setMarket(int volatility, int liquidity, int stability) {
        riskEngine.updateMarketConditions(admin, MarketConditionFactors.builder()
                .volatilityLevel(volatility)
                .liquidityDepth(liquidity)
                .priceStability(stability)
                .updatedAt(T0)
                .build());
    }

    // ========================
    // LTV
    // ========================

    @Nested
    @DisplayName("LTV computation")
    class Ltv {

        @Test
        @DisplayName("Composite LTV sums collateral across assets")
        void multiAssetLtv() {
            BorrowPosition position = position(Map.of("BTC", 2L, "USDC", 10_000L), "USDC", 55_000);
            Map<String, ValidatedPriceInfo> prices = Map.of("BTC", price("BTC", 50_000, 0), "USDC", price("USDC", 1, 0));

            assertThat(riskEngine.computeLtv(position, prices)).isEqualTo(5_000);
        }

        @Test
        @DisplayName("Collateral uses the lower bound and debt the upper bound")
        void conservativeBounds() {
            BorrowPosition position = position(Map.of("BTC", 1L), "USDC", 10_000);
            Map<String, ValidatedPriceInfo> prices = Map.of(
                    "BTC", price("BTC", 50_000, 500 * UNIT),
                    "USDC", price("USDC", 1, 1_000_000));

            LtvAssessment assessment = riskEngine.assess(position, prices, BorrowerTier.BRONZE);

            assertThat(assessment.getCollateralValue()).isEqualTo(49_500);
            assertThat(assessment.getBorrowedValue()).isEqualTo(10_100);
            assertThat(assessment.getLtvBps()).isEqualTo(2_040);
        }

        @Test
        @DisplayName("No debt means zero LTV, even without collateral")
        void zeroDebt() {
            assertThat(riskEngine.computeLtv(position(Map.of(), "USDC", 0), Map.of())).isZero();
        }

        @Test
        @DisplayName("Debt without collateral value is a division by zero")
        void debtWithoutCollateral() {
            BorrowPosition position = position(Map.of(), "USDC", 100);

            assertThatThrownBy(() -> riskEngine.computeLtv(position, Map.of("USDC", price("USDC", 1, 0))))
                    .isInstanceOf(DivisionByZeroException.class);
        }

        @Test
        @DisplayName("Missing price for a position asset is not found")
        void missingPrice() {
            BorrowPosition position = position(Map.of("BTC", 1L), "USDC", 100);

            assertThatThrownBy(() -> riskEngine.computeLtv(position, Map.of("BTC", price("BTC", 50_000, 0))))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("A price flagged as manipulated is refused")
        void manipulatedPrice() {
            ValidatedPriceInfo flagged = price("BTC", 50_000, 0).toBuilder().valid(false).manipulationRisk(3).build();

            assertThatThrownBy(() -> riskEngine.computeLtv(
                            position(Map.of("BTC", 1L), "USDC", 100),
                            Map.of("BTC", flagged, "USDC", price("USDC", 1, 0))))
                    .isInstanceOf(ManipulationDetectedException.class);
        }

        @Test
        @DisplayName("Collateral asset without a class is refused")
        void unknownCollateralAsset() {
            BorrowPosition position = position(Map.of("DOGE", 1_000L), "USDC", 10);

            assertThatThrownBy(() -> riskEngine.assess(
                            position,
                            Map.of("DOGE", price("DOGE", 1, 0), "USDC", price("USDC", 1, 0)),
                            BorrowerTier.BRONZE))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    // ========================
    // MAX LTV AND TIERS
    // ========================

    @Nested
    @DisplayName("Maximum LTV and classification")
    class MaxLtv {

        @Test
        @DisplayName("Cap is the value-weighted class cap plus the tier bonus")
        void weightedCap() {
            BorrowPosition position = position(Map.of("BTC", 1L, "USDC", 50_000L), "USDC", 50_000);
            Map<String, ValidatedPriceInfo> prices = Map.of("BTC", price("BTC", 50_000, 0), "USDC", price("USDC", 1, 0));

            assertThat(riskEngine.assess(position, prices, BorrowerTier.BRONZE).getMaxAllowedLtvBps()).isEqualTo(7_500);
            assertThat(riskEngine.assess(position, prices, BorrowerTier.GOLD).getMaxAllowedLtvBps()).isEqualTo(7_700);
        }

        @Test
        @DisplayName("Class cap plus bonus is clipped to the global hard cap")
        void globalCap() {
            assertThat(riskEngine.maxAllowedLtv(AssetClass.MAJOR, BorrowerTier.DIAMOND)).isEqualTo(7_400);

            riskEngine.updateCollateralPolicy(
                    admin, riskEngine.getCollateralPolicy().toBuilder().globalHardCapBps(8_200).build());

            assertThat(riskEngine.maxAllowedLtv(AssetClass.STABLECOIN, BorrowerTier.DIAMOND)).isEqualTo(8_200);
            assertThat(riskEngine.maxAllowedLtv(AssetClass.STABLECOIN, BorrowerTier.BRONZE)).isEqualTo(8_000);
        }

        @Test
        @DisplayName("Thresholds are inclusive lower bounds of their tier")
        void classify() {
            assertThat(riskEngine.classify(7_999)).isEqualTo(RiskTier.HEALTHY);
            assertThat(riskEngine.classify(8_000)).isEqualTo(RiskTier.WARNING);
            assertThat(riskEngine.classify(8_499)).isEqualTo(RiskTier.WARNING);
            assertThat(riskEngine.classify(8_500)).isEqualTo(RiskTier.LIQUIDATABLE);
        }

        @Test
        @DisplayName("Assessment carries the tier of the position")
        void assessmentTier() {
            BorrowPosition position = position(Map.of("USDC", 10_000L), "USDC", 8_600);
            Map<String, ValidatedPriceInfo> prices = Map.of("USDC", price("USDC", 1, 0));

            LtvAssessment assessment = riskEngine.assess(position, prices, BorrowerTier.BRONZE);

            assertThat(assessment.getRiskTier()).isEqualTo(RiskTier.LIQUIDATABLE);
            assertThat(assessment.exceedsMaxAllowed()).isTrue();
        }
    }

    // ========================
    // PENALTY RATE
    // ========================

    @Nested
    @DisplayName("Dynamic penalty rate")
    class PenaltyRate {

        @Test
        @DisplayName("Calm market leaves the base rate, scaled by the highest asset multiplier")
        void calmMarket() {
            assertThat(riskEngine.penaltyRate(List.of(), T0)).isEqualTo(500);
            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0)).isEqualTo(500);
            assertThat(riskEngine.penaltyRate(List.of("BTC", "SUI"), T0)).isEqualTo(750);
        }

        @Test
        @DisplayName("High volatility adds 50%")
        void highVolatility() {
            setMarket(75, 80, 80);

            assertThat(riskEngine.penaltyRate(List.of("SUI"), T0)).isEqualTo(1_125);
        }

        @Test
        @DisplayName("Medium volatility and medium liquidity each add 25%")
        void mediumFactors() {
            setMarket(45, 50, 80);

            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0)).isEqualTo(781);
        }

        @Test
        @DisplayName("Low price stability counts as volatility")
        void lowStability() {
            setMarket(10, 80, 20);

            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0)).isEqualTo(750);
        }

        @Test
        @DisplayName("Rate is clipped to the configured bounds")
        void clipped() {
            setMarket(75, 20, 80);
            assertThat(riskEngine.penaltyRate(List.of("SUI"), T0)).isEqualTo(1_500);

            setMarket(30, 80, 80);
            assertThat(riskEngine.penaltyRate(List.of("CHEAP"), T0)).isEqualTo(300);
        }

        @Test
        @DisplayName("Stale factors assume high volatility and low liquidity")
        void staleFactors() {
            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0 + 86_400)).isEqualTo(500);
            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0 + 86_401)).isEqualTo(1_125);
        }

        @Test
        void penaltyAmount() {
            assertThat(riskEngine.penaltyAmount(98_000, 500)).isEqualTo(4_900);
        }
    }

    // ========================
    // ADMIN
    // ========================

    @Nested
    @DisplayName("Configuration updates")
    class ConfigurationUpdates {

        @Test
        @DisplayName("Updates require a capability")
        void requireCapability() {
            assertThatThrownBy(() -> riskEngine.updateCollateralPolicy(null, riskEngine.getCollateralPolicy()))
                    .isInstanceOf(UnauthorizedException.class);
            assertThatThrownBy(() -> riskEngine.updatePenaltyRates(null, riskEngine.getPenaltyRateConfig()))
                    .isInstanceOf(UnauthorizedException.class);
        }

        @Test
        @DisplayName("Invalid policy is rejected whole and the old one stays")
        void invalidPolicy() {
            CollateralPolicy broken = riskEngine.getCollateralPolicy().toBuilder()
                    .warningThresholdBps(9_000)
                    .liquidationThresholdBps(8_500)
                    .build();

            assertThatThrownBy(() -> riskEngine.updateCollateralPolicy(admin, broken))
                    .isInstanceOf(InvalidConfigException.class);
            assertThat(riskEngine.getCollateralPolicy().getWarningThresholdBps()).isEqualTo(8_000);
        }

        @Test
        @DisplayName("Penalty rate update returns the previous config")
        void penaltyRatesUpdate() {
            PenaltyRateConfig previous = riskEngine.updatePenaltyRates(
                    admin, riskEngine.getPenaltyRateConfig().toBuilder().baseRateBps(600).build());

            assertThat(previous.getBaseRateBps()).isEqualTo(500);
            assertThat(riskEngine.penaltyRate(List.of("BTC"), T0)).isEqualTo(600);
        }

        @Test
        @DisplayName("Multiplier above 10x is rejected")
        void multiplierBound() {
            PenaltyRateConfig broken = riskEngine.getPenaltyRateConfig().toBuilder()
                    .assetMultiplierBps(Map.of("SUI", 100_001L))
                    .build();

            assertThatThrownBy(() -> riskEngine.updatePenaltyRates(admin, broken))
                    .isInstanceOf(InvalidConfigException.class);
        }
    }
}
