package com.olend.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replacement feed configuration for one asset. The asset comes from the path.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedConfigRequest {

    /** Defaults to the asset symbol. */
    private String feedId;

    @NotNull
    private Integer exponent;

    @NotNull
    private Long heartbeatSeconds;

    @NotNull
    private Long maxPriceDelaySeconds;

    @NotNull
    private Long maxDeviationBps;

    @NotNull
    private Long maxConfidenceBps;
}
