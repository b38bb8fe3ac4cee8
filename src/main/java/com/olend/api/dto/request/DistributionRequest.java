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
public class DistributionRequest {

    @NotNull
    private Long liquidatorShareBps;

    @NotNull
    private Long platformShareBps;

    @NotNull
    private Long insuranceShareBps;

    private boolean borrowerProtectionEnabled;
}
