package com.olend.api.controller;

import com.olend.admin.AdminCapability;
import com.olend.admin.AdminCapabilityAuthority.IssuedCapability;
import com.olend.api.dto.request.CapabilityIssueRequest;
import com.olend.api.dto.request.CollateralPolicyRequest;
import com.olend.api.dto.request.DistributionRequest;
import com.olend.api.dto.request.EmergencyRequest;
import com.olend.api.dto.request.FeedConfigRequest;
import com.olend.api.dto.request.ManipulationConfigRequest;
import com.olend.api.dto.request.MarketConditionsRequest;
import com.olend.api.dto.request.PenaltyRatesRequest;
import com.olend.api.dto.request.ThresholdRequest;
import com.olend.circuit.OperationKey;
import com.olend.circuit.ThresholdConfig;
import com.olend.domain.model.ConfigChange;
import com.olend.mapper.RiskDtoMapper;
import com.olend.oracle.PriceFeedConfig;
import com.olend.oracle.manipulation.ManipulationConfig;
import com.olend.penalty.PenaltyDistributionConfig;
import com.olend.risk.CollateralPolicy;
import com.olend.risk.MarketConditionFactors;
import com.olend.risk.PenaltyRateConfig;
import com.olend.service.AdminService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Capability-gated admin endpoints. Every call must carry the capability token in the
 * {@value #CAPABILITY_HEADER} header; a missing or revoked token is 401.
 *
 * <p>Updates replace the whole config object and are rejected before being applied if any
 * bound is violated.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    public static final String CAPABILITY_HEADER = "X-Admin-Capability";

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final AdminService adminService;
    private final RiskDtoMapper riskDtoMapper = Mappers.getMapper(RiskDtoMapper.class);

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    // ========================
    // CONFIG
    // ========================

    @PutMapping("/feeds/{asset}")
    public PriceFeedConfig updateFeed(
            @RequestHeader(CAPABILITY_HEADER) String token,
            @PathVariable String asset,
            @RequestBody @Valid FeedConfigRequest request) {
        return adminService.updateFeed(capability(token), riskDtoMapper.toFeedConfig(asset, request));
    }

    /**
     * @param key {@code DEFAULT}, an operation type, or {@code TYPE:ASSET}
     */
    @PutMapping("/thresholds/{key}")
    public ThresholdConfig updateThresholds(
            @RequestHeader(CAPABILITY_HEADER) String token,
            @PathVariable String key,
            @RequestBody @Valid ThresholdRequest request) {
        return adminService.updateThresholds(capability(token), key, riskDtoMapper.toThresholdConfig(request));
    }

    @PutMapping("/collateral-policy")
    public CollateralPolicy updateCollateralPolicy(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid CollateralPolicyRequest request) {
        return adminService.updateCollateralPolicy(capability(token), riskDtoMapper.toCollateralPolicy(request));
    }

    @PutMapping("/distribution")
    public PenaltyDistributionConfig updateDistribution(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid DistributionRequest request) {
        return adminService.updateDistribution(capability(token), riskDtoMapper.toDistributionConfig(request));
    }

    @PutMapping("/market-conditions")
    public MarketConditionFactors updateMarketConditions(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid MarketConditionsRequest request) {
        return adminService.updateMarketConditions(capability(token), riskDtoMapper.toMarketConditions(request));
    }

    @PutMapping("/penalty-rates")
    public PenaltyRateConfig updatePenaltyRates(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid PenaltyRatesRequest request) {
        return adminService.updatePenaltyRates(capability(token), riskDtoMapper.toPenaltyRateConfig(request));
    }

    @PutMapping("/manipulation")
    public ManipulationConfig updateManipulationConfig(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid ManipulationConfigRequest request) {
        return adminService.updateManipulationConfig(capability(token), riskDtoMapper.toManipulationConfig(request));
    }

    // ========================
    // EMERGENCY
    // ========================

    @PostMapping("/emergency")
    public Map<String, Object> setGlobalEmergency(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid EmergencyRequest request) {
        boolean previous = adminService.setGlobalEmergency(capability(token), request.isActive(), request.getReason());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("previous", previous);
        result.put("globalEmergency", request.isActive());
        return result;
    }

    @PostMapping("/circuit-breakers/{key}/reset")
    public Map<String, Object> resetBreaker(@RequestHeader(CAPABILITY_HEADER) String token, @PathVariable String key) {
        OperationKey operationKey = OperationKey.parse(key);
        adminService.resetBreaker(capability(token), operationKey);
        return Map.of("operationKey", operationKey.toString(), "phase", "CLOSED");
    }

    // ========================
    // CAPABILITIES & AUDIT
    // ========================

    @PostMapping("/capabilities")
    public IssuedCapability issueCapability(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestBody @Valid CapabilityIssueRequest request) {
        IssuedCapability issued = adminService.issueCapability(capability(token), request.getLabel());
        log.info("Issued admin capability {}", issued.capability().getId());
        return issued;
    }

    @DeleteMapping("/capabilities/{id}")
    public ResponseEntity<Void> revokeCapability(@RequestHeader(CAPABILITY_HEADER) String token, @PathVariable String id) {
        adminService.revokeCapability(capability(token), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/audit")
    public List<ConfigChange> getAudit(
            @RequestHeader(CAPABILITY_HEADER) String token, @RequestParam(required = false) String type) {
        return adminService.auditHistory(capability(token), type);
    }

    private AdminCapability capability(String token) {
        return adminService.resolveCapability(token);
    }
}
