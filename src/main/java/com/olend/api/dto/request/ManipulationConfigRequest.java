package com.olend.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Replacement detector thresholds. Omitted fields take their documented defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManipulationConfigRequest {

    private Integer cumulativeWindowPoints;
    private Long cumulativeThresholdBps;
    private Long mismatchMoveBps;
    private Long confidenceImprovementBps;
    private Long oscillationWindowSeconds;
    private Long oscillationMinMoveBps;
}
