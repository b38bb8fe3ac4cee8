package com.olend.unit.oracle;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.olend.admin.AdminCapabilityAuthority;
import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.CircuitDecision;
import com.olend.circuit.OperationKey;
import com.olend.circuit.OperationType;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.exception.CircuitOpenException;
import com.olend.exception.InvalidPriceException;
import com.olend.exception.ManipulationDetectedException;
import com.olend.exception.ResourceNotFoundException;
import com.olend.exception.StalePriceException;
import com.olend.oracle.PriceFeed;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PriceFeedRegistry;
import com.olend.oracle.PriceOracleService;
import com.olend.oracle.PriceValidator;
import com.olend.oracle.RawPriceQuote;
import com.olend.oracle.ValidatedPriceInfo;
import com.olend.oracle.manipulation.ManipulationCheck;
import com.olend.time.TimeSource;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class PriceOracleServiceTest {

    private static final OperationKey BTC_FEED = OperationKey.of(OperationType.PRICE_FEED, "BTC");
    private static final long NOW = 10_000;

    @Mock
    private PriceValidator priceValidator;

    @Mock
    private PriceFeed priceFeed;

    @Mock
    private CircuitBreakerRegistry circuitBreakerRegistry;

    @Mock
    private TimeSource timeSource;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private PriceOracleService priceOracleService;

    @BeforeEach
    void setUp() {
        PriceFeedConfig btc = PriceFeedConfig.builder()
                .asset("BTC")
                .feedId("btc-usd")
                .exponent(-8)
                .heartbeatSeconds(60)
                .maxPriceDelaySeconds(300)
                .maxDeviationBps(1_000)
                .maxConfidenceBps(200)
                .build();
        PriceFeedRegistry registry = new PriceFeedRegistry(List.of(btc), new AdminCapabilityAuthority("t"));
        priceOracleService = new PriceOracleService(
                registry, priceValidator, priceFeed, circuitBreakerRegistry, timeSource, applicationEventPublisher);
    }

    private static ValidatedPriceInfo info(long price, int risk) {
        return ValidatedPriceInfo.builder()
                .asset("BTC")
                .price(price)
                .confidence(0)
                .exponent(-8)
                .timestamp(NOW)
                .validationScore(100 - 25 * risk)
                .manipulationRisk(risk)
                .valid(risk < 2)
                .triggeredChecks(risk < 2 ? Set.of() : Set.of(ManipulationCheck.SPIKE))
                .build();
    }

    private void givenClosedBreakerAndQuote(long price) {
        when(circuitBreakerRegistry.check(BTC_FEED, NOW)).thenReturn(CircuitDecision.allowed(BTC_FEED.toString()));
        when(priceFeed.latest("btc-usd")).thenReturn(Optional.of(new RawPriceQuote(price, 0, -8, NOW)));
    }

    // ========================
    // HAPPY PATH
    // ========================

    @Nested
    @DisplayName("Valid prices")
    class ValidPrices {

        @Test
        @DisplayName("Valid price records a breaker success and is cached")
        void validPrice() {
            givenClosedBreakerAndQuote(5_000_000_000_000L);
            when(priceValidator.validate("BTC", 5_000_000_000_000L, 0, NOW, NOW))
                    .thenReturn(info(5_000_000_000_000L, 0));

            ValidatedPriceInfo result = priceOracleService.getValidatedPrice("BTC", NOW);

            assertThat(result.isValid()).isTrue();
            verify(circuitBreakerRegistry).recordSuccess(BTC_FEED, NOW);
            assertThat(priceOracleService.cachedPrice("BTC")).contains(result);
            verifyNoInteractions(applicationEventPublisher);
        }

        @Test
        @DisplayName("Without an explicit time the logical clock is read")
        void readsTimeSource() {
            when(timeSource.nowSeconds()).thenReturn(NOW);
            givenClosedBreakerAndQuote(100);
            when(priceValidator.validate("BTC", 100, 0, NOW, NOW)).thenReturn(info(100, 0));

            assertThat(priceOracleService.requireTrustedPrice("BTC").getPrice()).isEqualTo(100);
        }

        @Test
        @DisplayName("Nothing is cached before the first validation")
        void emptyCache() {
            assertThat(priceOracleService.cachedPrice("BTC")).isEmpty();
        }
    }

    // ========================
    // FAILURES
    // ========================

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Open breaker rejects without reading the feed")
        void openBreaker() {
            when(circuitBreakerRegistry.check(BTC_FEED, NOW))
                    .thenReturn(CircuitDecision.rejected(BTC_FEED.toString(), "tripped"));

            assertThatThrownBy(() -> priceOracleService.getValidatedPrice("BTC", NOW))
                    .isInstanceOf(CircuitOpenException.class)
                    .hasMessageContaining("tripped");
            verifyNoInteractions(priceFeed, priceValidator);
        }

        @Test
        @DisplayName("Missing quote is stale; the failure is recorded and published")
        void missingQuote() {
            when(circuitBreakerRegistry.check(BTC_FEED, NOW)).thenReturn(CircuitDecision.allowed(BTC_FEED.toString()));
            when(priceFeed.latest("btc-usd")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> priceOracleService.getValidatedPrice("BTC", NOW))
                    .isInstanceOf(StalePriceException.class);

            verify(circuitBreakerRegistry).recordFailure(BTC_FEED, NOW, "STALE_PRICE");
            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            assertThat(captor.getValue().getEventType()).isEqualTo(RiskEventType.PRICE_VALIDATION_FAILED);
            assertThat(captor.getValue().getLevel()).isEqualTo(RiskLevel.WARNING);
        }

        @Test
        @DisplayName("Quote with a foreign exponent is invalid")
        void exponentMismatch() {
            when(circuitBreakerRegistry.check(BTC_FEED, NOW)).thenReturn(CircuitDecision.allowed(BTC_FEED.toString()));
            when(priceFeed.latest("btc-usd")).thenReturn(Optional.of(new RawPriceQuote(100, 0, -6, NOW)));

            assertThatThrownBy(() -> priceOracleService.getValidatedPrice("BTC", NOW))
                    .isInstanceOf(InvalidPriceException.class);
            verify(circuitBreakerRegistry).recordFailure(BTC_FEED, NOW, "INVALID_PRICE");
            verifyNoInteractions(priceValidator);
        }

        @Test
        @DisplayName("Validator rejection propagates after being recorded")
        void validatorRejection() {
            givenClosedBreakerAndQuote(100);
            when(priceValidator.validate(anyString(), anyLong(), anyLong(), anyLong(), anyLong()))
                    .thenThrow(new StalePriceException("BTC", 400, 300));

            assertThatThrownBy(() -> priceOracleService.getValidatedPrice("BTC", NOW))
                    .isInstanceOf(StalePriceException.class);
            verify(circuitBreakerRegistry).recordFailure(eq(BTC_FEED), eq(NOW), anyString());
            assertThat(priceOracleService.cachedPrice("BTC")).isEmpty();
        }

        @Test
        @DisplayName("Unconfigured asset is not found")
        void unknownAsset() {
            assertThatThrownBy(() -> priceOracleService.getValidatedPrice("DOGE", NOW))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(circuitBreakerRegistry);
        }
    }

    // ========================
    // MANIPULATION
    // ========================

    @Nested
    @DisplayName("Manipulated prices")
    class Manipulated {

        @Test
        @DisplayName("Risk 3 trips the asset's sensitive breakers and publishes a critical event")
        void tripsBreakers() {
            givenClosedBreakerAndQuote(130);
            when(priceValidator.validate("BTC", 130, 0, NOW, NOW)).thenReturn(info(130, 3));

            ValidatedPriceInfo result = priceOracleService.getValidatedPrice("BTC", NOW);

            assertThat(result.isValid()).isFalse();
            verify(circuitBreakerRegistry).reportManipulation("BTC", 3, NOW);
            verify(circuitBreakerRegistry, never()).recordSuccess(any(), anyLong());
            ArgumentCaptor<RiskEvent> captor = ArgumentCaptor.forClass(RiskEvent.class);
            verify(applicationEventPublisher).publishEvent(captor.capture());
            RiskEvent event = captor.getValue();
            assertThat(event.getEventType()).isEqualTo(RiskEventType.MANIPULATION_DETECTED);
            assertThat(event.getLevel()).isEqualTo(RiskLevel.CRITICAL);
            assertThat(event.getDetails()).containsEntry("after", 130L).containsEntry("riskLevel", 3);
        }

        @Test
        @DisplayName("requireTrustedPrice refuses a manipulated price")
        void requireTrustedPrice() {
            givenClosedBreakerAndQuote(130);
            when(priceValidator.validate("BTC", 130, 0, NOW, NOW)).thenReturn(info(130, 2));

            assertThatThrownBy(() -> priceOracleService.requireTrustedPrice("BTC", NOW))
                    .isInstanceOf(ManipulationDetectedException.class);
        }
    }
}
