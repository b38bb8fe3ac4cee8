package com.olend.config;

import com.olend.circuit.OperationType;
import com.olend.risk.AssetClass;
import com.olend.risk.BorrowerTier;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Start-up configuration of the risk core, bound from {@code olend.risk.*}.
 *
 * <p>These are initial values only. {@link RiskConfig} converts and validates them; afterwards
 * every change goes through a capability-gated admin call.
 */
@Configuration
@ConfigurationProperties(prefix = "olend.risk")
@Getter
@Setter
public class RiskProperties {

    private Admin admin = new Admin();
    private Oracle oracle = new Oracle();
    private Manipulation manipulation = new Manipulation();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private Collateral collateral = new Collateral();
    private Penalty penalty = new Penalty();
    private Distribution distribution = new Distribution();
    private Market market = new Market();
    private Tiers tiers = new Tiers();

    @Getter
    @Setter
    public static class Admin {

        /** Secret for the bootstrap capability. Must be set; there is no usable default. */
        private String bootstrapToken;
    }

    @Getter
    @Setter
    public static class Oracle {

        private int historyCapacity = 100;
        private List<Feed> feeds = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Feed {

        private String asset;
        private String feedId;
        private int exponent;
        private long heartbeatSeconds = 60;
        private long maxPriceDelaySeconds = 300;
        private long maxDeviationBps = 1_000;
        private long maxConfidenceBps = 200;
    }

    @Getter
    @Setter
    public static class Manipulation {

        private int cumulativeWindowPoints = 10;
        private long cumulativeThresholdBps = 2_000;
        private long mismatchMoveBps = 500;
        private long confidenceImprovementBps = 5_000;
        private long oscillationWindowSeconds = 300;
        private long oscillationMinMoveBps = 500;
    }

    @Getter
    @Setter
    public static class Thresholds {

        private int failureThreshold = 5;
        private long timeWindowSeconds = 300;
        private long recoveryTimeoutSeconds = 600;

        /** 0 disables the volume trip. */
        private long volumeThreshold;
    }

    @Getter
    @Setter
    public static class CircuitBreaker {

        private Thresholds defaults = new Thresholds();

        /** Scope ({@code BORROW} or {@code BORROW:BTC}) -> thresholds. */
        private Map<String, Thresholds> overrides = new LinkedHashMap<>();

        /** Operation types halted for an asset when manipulation is reported. PRICE_FEED is always included. */
        private Set<OperationType> manipulationSensitiveOperations = EnumSet.of(
                OperationType.PRICE_FEED, OperationType.BORROW, OperationType.WITHDRAW, OperationType.LIQUIDATE);
    }

    @Getter
    @Setter
    public static class Collateral {

        private Map<String, AssetClass> assetClasses = new HashMap<>();
        private Map<AssetClass, Long> classMaxLtvBps = new HashMap<>();
        private Map<BorrowerTier, Long> tierBonusBps = new HashMap<>();
        private long globalHardCapBps = 9_000;
        private long warningThresholdBps = 8_000;
        private long liquidationThresholdBps = 8_500;
    }

    @Getter
    @Setter
    public static class Penalty {

        private long baseRateBps = 500;
        private long minRateBps = 300;
        private long maxRateBps = 1_500;
        private Map<String, Long> assetMultiplierBps = new HashMap<>();
        private long maxFactorAgeSeconds = 86_400;
    }

    @Getter
    @Setter
    public static class Distribution {

        private long liquidatorShareBps = 3_000;
        private long platformShareBps = 5_000;
        private long insuranceShareBps = 2_000;
        private boolean borrowerProtectionEnabled;
    }

    @Getter
    @Setter
    public static class Market {

        private int volatilityLevel = 30;
        private int liquidityDepth = 80;
        private int priceStability = 80;
    }

    @Getter
    @Setter
    public static class Tiers {

        private BorrowerTier defaultTier = BorrowerTier.BRONZE;

        /** Borrower id -> tier, for deployments without an identity service. */
        private Map<String, BorrowerTier> borrowers = new HashMap<>();
    }
}
