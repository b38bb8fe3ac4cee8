package com.olend.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replacement penalty rate config. Omitted step parameters take their defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PenaltyRatesRequest {

    @NotNull
    private Long baseRateBps;

    @NotNull
    private Long minRateBps;

    @NotNull
    private Long maxRateBps;

    private Map<String, Long> assetMultiplierBps;

    private Integer highVolatilityLevel;
    private Integer mediumVolatilityLevel;
    private Long highVolatilityAdjustmentBps;
    private Long mediumVolatilityAdjustmentBps;
    private Integer lowLiquidityDepth;
    private Integer mediumLiquidityDepth;
    private Long lowLiquidityAdjustmentBps;
    private Long mediumLiquidityAdjustmentBps;
    private Long maxFactorAgeSeconds;
}
