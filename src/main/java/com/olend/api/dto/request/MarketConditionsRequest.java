package com.olend.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Market factor scores in [0, 100]. The update time is stamped by the server.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketConditionsRequest {

    @Min(0)
    @Max(100)
    private int volatilityLevel;

    @Min(0)
    @Max(100)
    private int liquidityDepth;

    @Min(0)
    @Max(100)
    private int priceStability;
}
