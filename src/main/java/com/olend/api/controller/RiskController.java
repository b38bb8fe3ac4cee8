package com.olend.api.controller;

import com.olend.api.dto.request.PenaltyDistributeRequest;
import com.olend.api.dto.request.PositionRequest;
import com.olend.mapper.RiskDtoMapper;
import com.olend.penalty.PenaltyDistributor;
import com.olend.penalty.PenaltySplit;
import com.olend.risk.LiquidationDecision;
import com.olend.risk.LiquidationPlan;
import com.olend.risk.LtvAssessment;
import com.olend.risk.RiskManager;
import com.olend.time.TimeSource;
import jakarta.validation.Valid;
import org.mapstruct.factory.Mappers;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for position risk.
 *
 * <ul>
 *   <li>POST /api/risk/ltv -- LTV and tier of a position</li>
 *   <li>POST /api/risk/liquidation-check -- none / warn / liquidatable with penalty rate</li>
 *   <li>POST /api/risk/liquidation-plan -- penalty amount and split for a liquidatable position</li>
 *   <li>POST /api/risk/origination-check -- approve a borrow or reject with LTV_LIMIT_EXCEEDED</li>
 *   <li>POST /api/risk/penalty/distribute -- four-way split of a penalty amount</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final RiskManager riskManager;
    private final PenaltyDistributor penaltyDistributor;
    private final TimeSource timeSource;
    private final RiskDtoMapper riskDtoMapper = Mappers.getMapper(RiskDtoMapper.class);

    public RiskController(RiskManager riskManager, PenaltyDistributor penaltyDistributor, TimeSource timeSource) {
        this.riskManager = riskManager;
        this.penaltyDistributor = penaltyDistributor;
        this.timeSource = timeSource;
    }

    @PostMapping("/ltv")
    public LtvAssessment computeLtv(@RequestBody @Valid PositionRequest request) {
        return riskManager.computePositionLtv(riskDtoMapper.toPosition(request));
    }

    @PostMapping("/liquidation-check")
    public LiquidationDecision checkLiquidation(@RequestBody @Valid PositionRequest request) {
        return riskManager.checkLiquidation(riskDtoMapper.toPosition(request));
    }

    /**
     * Returns 204 when the position is not liquidatable.
     */
    @PostMapping("/liquidation-plan")
    public ResponseEntity<LiquidationPlan> planLiquidation(@RequestBody @Valid PositionRequest request) {
        return riskManager
                .planLiquidation(riskDtoMapper.toPosition(request))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @PostMapping("/origination-check")
    public LtvAssessment validateOrigination(@RequestBody @Valid PositionRequest request) {
        return riskManager.validateOrigination(riskDtoMapper.toPosition(request));
    }

    @PostMapping("/penalty/distribute")
    public PenaltySplit distributePenalty(@RequestBody @Valid PenaltyDistributeRequest request) {
        return penaltyDistributor.distribute(request.getTotalPenalty(), timeSource.nowSeconds());
    }
}
