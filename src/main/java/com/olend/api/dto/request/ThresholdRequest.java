package com.olend.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThresholdRequest {

    @NotNull
    private Integer failureThreshold;

    @NotNull
    private Long timeWindowSeconds;

    @NotNull
    private Long recoveryTimeoutSeconds;

    /** 0 or absent disables the volume trip. */
    private long volumeThreshold;
}
