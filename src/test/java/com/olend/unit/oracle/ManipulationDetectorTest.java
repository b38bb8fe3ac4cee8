package com.olend.unit.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.olend.admin.AdminCapabilityAuthority;
import com.olend.exception.InvalidConfigException;
import com.olend.exception.UnauthorizedException;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PricePoint;
import com.olend.oracle.manipulation.ManipulationAssessment;
import com.olend.oracle.manipulation.ManipulationCheck;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.oracle.manipulation.ManipulationDetector;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ManipulationDetectorTest {

    private static final PriceFeedConfig FEED = PriceFeedConfig.builder()
            .asset("ETH")
            .feedId("eth-usd")
            .exponent(-8)
            .heartbeatSeconds(60)
            .maxPriceDelaySeconds(300)
            .maxDeviationBps(1_000)
            .maxConfidenceBps(200)
            .build();

    private AdminCapabilityAuthority authority;
    private ManipulationDetector detector;

    @BeforeEach
    void setUp() {
        authority = new AdminCapabilityAuthority("t");
        detector = new ManipulationDetector(ManipulationConfig.defaults(), authority);
    }

    private static List<PricePoint> series(long... prices) {
        List<PricePoint> points = new ArrayList<>();
        for (int i = 0; i < prices.length; i++) {
            points.add(new PricePoint(prices[i], 0, i * 10L));
        }
        return points;
    }

    @Test
    @DisplayName("Empty history is always clean")
    void emptyHistory() {
        ManipulationAssessment assessment = detector.assess(List.of(), new PricePoint(1_000, 0, 0), FEED);

        assertThat(assessment.getRiskLevel()).isZero();
        assertThat(assessment.getTriggeredChecks()).isEmpty();
    }

    @Test
    @DisplayName("Move of 15% against a 10% threshold is a level 2 spike")
    void spikeHigh() {
        ManipulationAssessment assessment = detector.assess(series(100), new PricePoint(115, 0, 10), FEED);

        assertThat(assessment.getRiskLevel()).isEqualTo(2);
        assertThat(assessment.getTriggeredChecks()).containsExactly(ManipulationCheck.SPIKE);
        assertThat(assessment.isManipulation()).isTrue();
    }

    @Test
    @DisplayName("Move exactly at the threshold does not fire")
    void spikeBoundary() {
        ManipulationAssessment assessment = detector.assess(series(100), new PricePoint(110, 0, 10), FEED);

        assertThat(assessment.getRiskLevel()).isZero();
    }

    @Test
    @DisplayName("Move beyond twice the threshold is critical")
    void spikeCritical() {
        ManipulationAssessment assessment = detector.assess(series(1_000), new PricePoint(700, 0, 10), FEED);

        assertThat(assessment.getRiskLevel()).isEqualTo(3);
    }

    @Test
    @DisplayName("Slow walk of 5% steps is caught by cumulative drift only")
    void cumulativeDrift() {
        ManipulationAssessment assessment =
                detector.assess(series(100, 105, 110, 115, 120), new PricePoint(126, 0, 50), FEED);

        assertThat(assessment.getRiskLevel()).isEqualTo(2);
        assertThat(assessment.getTriggeredChecks()).containsExactly(ManipulationCheck.CUMULATIVE_DRIFT);
    }

    @Test
    @DisplayName("Alternating prices net out and raise nothing")
    void alternatingNetsOut() {
        ManipulationAssessment assessment =
                detector.assess(series(100, 108, 100, 108, 100), new PricePoint(108, 0, 50), FEED);

        assertThat(assessment.getRiskLevel()).isZero();
    }

    @Test
    @DisplayName("Pump then dump below the pre-pump level is an oscillation")
    void oscillation() {
        ManipulationAssessment assessment =
                detector.assess(series(100, 104, 108, 104), new PricePoint(99, 0, 40), FEED);

        assertThat(assessment.getRiskLevel()).isEqualTo(2);
        assertThat(assessment.getTriggeredChecks()).containsExactly(ManipulationCheck.OSCILLATION);
    }

    @Test
    @DisplayName("Pump outside the look-back window is ignored")
    void oscillationOutsideWindow() {
        List<PricePoint> history = List.of(
                new PricePoint(100, 0, 0), new PricePoint(104, 0, 10), new PricePoint(108, 0, 20), new PricePoint(104, 0, 400));

        ManipulationAssessment assessment = detector.assess(history, new PricePoint(99, 0, 410), FEED);

        assertThat(assessment.getTriggeredChecks()).doesNotContain(ManipulationCheck.OSCILLATION);
    }

    @Test
    @DisplayName("Tightening confidence during a sharp move is a level 1 mismatch")
    void confidenceMismatch() {
        List<PricePoint> history = List.of(new PricePoint(100, 2, 0));

        ManipulationAssessment assessment = detector.assess(history, new PricePoint(106, 0, 10), FEED);

        assertThat(assessment.getRiskLevel()).isEqualTo(1);
        assertThat(assessment.getTriggeredChecks()).containsExactly(ManipulationCheck.CONFIDENCE_MISMATCH);
        assertThat(assessment.isManipulation()).isFalse();
    }

    // ========================
    // RATIO BOUNDARIES
    // ========================

    @Test
    @DisplayName("Spike fires a fraction of a basis point past the threshold")
    void spikeJustOverThreshold() {
        assertThat(detector.assess(series(1_000_000), new PricePoint(1_100_090, 0, 10), FEED).getTriggeredChecks())
                .containsExactly(ManipulationCheck.SPIKE);
        assertThat(detector.assess(series(1_000_000), new PricePoint(1_100_001, 0, 10), FEED).getRiskLevel())
                .isEqualTo(2);
        assertThat(detector.assess(series(1_000_000), new PricePoint(1_100_000, 0, 10), FEED).getRiskLevel())
                .isZero();
    }

    @Test
    @DisplayName("Critical tier fires a fraction of a basis point past twice the threshold")
    void criticalJustOverDoubleThreshold() {
        assertThat(detector.assess(series(1_000_000), new PricePoint(1_200_001, 0, 10), FEED).getRiskLevel())
                .isEqualTo(3);
        assertThat(detector.assess(series(1_000_000), new PricePoint(1_200_000, 0, 10), FEED).getRiskLevel())
                .isEqualTo(2);
    }

    @Test
    @DisplayName("Drift compares the exact summed move, not per-step truncations")
    void driftJustOverThreshold() {
        ManipulationDetector strict = new ManipulationDetector(
                ManipulationConfig.defaults().toBuilder().cumulativeThresholdBps(1_000).build(), authority);

        // 5% then 5.00009%: each step truncates to 500 bps
        assertThat(strict.assess(series(1_000_000, 1_050_000), new PricePoint(1_102_501, 0, 20), FEED)
                        .getTriggeredChecks())
                .containsExactly(ManipulationCheck.CUMULATIVE_DRIFT);
        assertThat(strict.assess(series(1_000_000, 1_050_000), new PricePoint(1_102_500, 0, 20), FEED)
                        .getRiskLevel())
                .isZero();
    }

    @Test
    @DisplayName("Mismatch needs a move of at least the sharp-move size and an exactly halved ratio")
    void mismatchBoundaries() {
        // previous ratio 200.99 bps, so the suspicious ceiling is 100.495 bps
        List<PricePoint> history = List.of(new PricePoint(1_000_000, 20_099, 0));

        assertThat(detector.assess(history, new PricePoint(1_050_000, 10_551, 10), FEED).getTriggeredChecks())
                .containsExactly(ManipulationCheck.CONFIDENCE_MISMATCH);
        assertThat(detector.assess(history, new PricePoint(1_050_000, 10_600, 10), FEED).getRiskLevel())
                .isZero();
        assertThat(detector.assess(history, new PricePoint(1_049_999, 0, 10), FEED).getRiskLevel())
                .isZero();
    }

    @Test
    @DisplayName("Pump must reach the minimum move exactly, without rounding the level down")
    void oscillationPumpBoundary() {
        assertThat(detector.assess(series(100_000, 105_000), new PricePoint(99_999, 0, 20), FEED).getTriggeredChecks())
                .containsExactly(ManipulationCheck.OSCILLATION);
        // 5000 / 100001 is just under 5%
        assertThat(detector.assess(series(100_001, 105_001), new PricePoint(100_000, 0, 20), FEED).getRiskLevel())
                .isZero();
        assertThat(detector.assess(series(100_001, 105_002), new PricePoint(100_000, 0, 20), FEED).getTriggeredChecks())
                .containsExactly(ManipulationCheck.OSCILLATION);
    }

    @Test
    @DisplayName("Config update requires a capability and is validated")
    void configUpdate() {
        ManipulationConfig stricter = ManipulationConfig.defaults().toBuilder().cumulativeThresholdBps(1_000).build();

        assertThatThrownBy(() -> detector.updateConfig(null, stricter)).isInstanceOf(UnauthorizedException.class);
        assertThatThrownBy(() -> detector.updateConfig(
                        authority.resolve("t"), stricter.toBuilder().cumulativeWindowPoints(1).build()))
                .isInstanceOf(InvalidConfigException.class);

        ManipulationConfig previous = detector.updateConfig(authority.resolve("t"), stricter);

        assertThat(previous.getCumulativeThresholdBps()).isEqualTo(2_000);
        assertThat(detector.getConfig().getCumulativeThresholdBps()).isEqualTo(1_000);
    }
}
