package com.olend.service;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority;
import com.olend.admin.AdminCapabilityAuthority.IssuedCapability;
import com.olend.circuit.CircuitBreakerRegistry;
import com.olend.circuit.OperationKey;
import com.olend.circuit.ThresholdConfig;
import com.olend.domain.model.ConfigChange;
import com.olend.event.RiskEvent;
import com.olend.event.RiskEventType;
import com.olend.event.RiskLevel;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.PriceFeedRegistry;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.oracle.manipulation.ManipulationDetector;
import com.olend.penalty.PenaltyDistributionConfig;
import com.olend.penalty.PenaltyDistributor;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import com.olend.risk.RiskEngine;
import com.olend.time.TimeSource;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Capability-gated configuration changes.
 *
 * <p>Each call verifies the capability (inside the owning component), swaps the config in
 * memory, writes an audit row through {@link ConfigAuditService} and publishes a
 * {@code CONFIG_UPDATED} event. A rejected update leaves config, audit trail and event
 * stream untouched.
 */
@Service
public class AdminService {

    private final AdminCapabilityAuthority authority;
    private final PriceFeedRegistry priceFeedRegistry;
    private final ManipulationDetector manipulationDetector;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RiskEngine riskEngine;
    private final PenaltyDistributor penaltyDistributor;
    private final ConfigAuditService configAuditService;
    private final TimeSource timeSource;
    private final ApplicationEventPublisher applicationEventPublisher;

    public AdminService(
            AdminCapabilityAuthority authority,
            PriceFeedRegistry priceFeedRegistry,
            ManipulationDetector manipulationDetector,
            CircuitBreakerRegistry circuitBreakerRegistry,
            RiskEngine riskEngine,
            PenaltyDistributor penaltyDistributor,
            ConfigAuditService configAuditService,
            TimeSource timeSource,
            ApplicationEventPublisher applicationEventPublisher) {
        this.authority = authority;
        this.priceFeedRegistry = priceFeedRegistry;
        this.manipulationDetector = manipulationDetector;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.riskEngine = riskEngine;
        this.penaltyDistributor = penaltyDistributor;
        this.configAuditService = configAuditService;
        this.timeSource = timeSource;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /** Resolves the capability presented as a bearer token. */
    public AdminCapability resolveCapability(String token) {
        return authority.resolve(token);
    }

    // ========================
    // CONFIG UPDATES
    // ========================

    public PriceFeedConfig updateFeed(AdminCapability capability, PriceFeedConfig config) {
        PriceFeedConfig previous = priceFeedRegistry.upsert(capability, config);
        recordChange(capability, "FEED", config.getAsset(), previous, config);
        return config;
    }

    public ThresholdConfig updateThresholds(AdminCapability capability, String scope, ThresholdConfig config) {
        ThresholdConfig previous = circuitBreakerRegistry.updateThresholds(capability, scope, config);
        recordChange(capability, "THRESHOLDS", scope.toUpperCase(), previous, config);
        return config;
    }

    public CollateralPolicy updateCollateralPolicy(AdminCapability capability, CollateralPolicy policy) {
        CollateralPolicy previous = riskEngine.updateCollateralPolicy(capability, policy);
        recordChange(capability, "COLLATERAL_POLICY", "GLOBAL", previous, policy);
        return policy;
    }

    public PenaltyDistributionConfig updateDistribution(AdminCapability capability, PenaltyDistributionConfig config) {
        PenaltyDistributionConfig previous = penaltyDistributor.updateConfig(capability, config);
        recordChange(capability, "DISTRIBUTION", "GLOBAL", previous, config);
        return config;
    }

    /**
     * Replaces the market condition factors, stamped with the current logical time.
     */
    public MarketConditionFactors updateMarketConditions(AdminCapability capability, MarketConditionFactors factors) {
        MarketConditionFactors stamped = factors.toBuilder().updatedAt(timeSource.nowSeconds()).build();
        MarketConditionFactors previous = riskEngine.updateMarketConditions(capability, stamped);
        recordChange(capability, "MARKET_CONDITIONS", "GLOBAL", previous, stamped);
        return stamped;
    }

    public PenaltyRateConfig updatePenaltyRates(AdminCapability capability, PenaltyRateConfig config) {
        PenaltyRateConfig previous = riskEngine.updatePenaltyRates(capability, config);
        recordChange(capability, "PENALTY_RATES", "GLOBAL", previous, config);
        return config;
    }

    public ManipulationConfig updateManipulationConfig(AdminCapability capability, ManipulationConfig config) {
        ManipulationConfig previous = manipulationDetector.updateConfig(capability, config);
        recordChange(capability, "MANIPULATION", "GLOBAL", previous, config);
        return config;
    }

    // ========================
    // EMERGENCY CONTROLS
    // ========================

    public boolean setGlobalEmergency(AdminCapability capability, boolean active, String reason) {
        long now = timeSource.nowSeconds();
        boolean previous = circuitBreakerRegistry.setGlobalEmergency(capability, active, reason, now);
        configAuditService.record("EMERGENCY", "GLOBAL", previous, active, capability.getId(), now);
        return previous;
    }

    public void resetBreaker(AdminCapability capability, OperationKey key) {
        long now = timeSource.nowSeconds();
        circuitBreakerRegistry.forceReset(capability, key, now);
        configAuditService.record("BREAKER_RESET", key.toString(), null, "CLOSED", capability.getId(), now);
    }

    // ========================
    // CAPABILITIES
    // ========================

    public IssuedCapability issueCapability(AdminCapability issuer, String label) {
        IssuedCapability issued = authority.issue(issuer, label);
        configAuditService.record(
                "CAPABILITY", issued.capability().getId(), null, "issued", issuer.getId(), timeSource.nowSeconds());
        return issued;
    }

    public void revokeCapability(AdminCapability issuer, String capabilityId) {
        authority.revoke(issuer, capabilityId);
        configAuditService.record("CAPABILITY", capabilityId, "issued", "revoked", issuer.getId(), timeSource.nowSeconds());
    }

    // ========================
    // AUDIT
    // ========================

    public List<ConfigChange> auditHistory(AdminCapability capability, String configType) {
        authority.verify(capability);
        if (configType == null || configType.isBlank()) {
            return configAuditService.history();
        }
        return configAuditService.historyByType(configType.toUpperCase());
    }

    private void recordChange(AdminCapability capability, String configType, String key, Object before, Object after) {
        long now = timeSource.nowSeconds();
        configAuditService.record(configType, key, before, after, capability.getId(), now);

        Map<String, Object> details = new HashMap<>();
        details.put("before", before != null ? before.toString() : "none");
        details.put("after", after.toString());
        details.put("by", capability.getId());
        applicationEventPublisher.publishEvent(new RiskEvent(
                this,
                RiskEventType.CONFIG_UPDATED,
                RiskLevel.INFO,
                key,
                configType + " configuration updated for " + key,
                details,
                now));
    }
}
