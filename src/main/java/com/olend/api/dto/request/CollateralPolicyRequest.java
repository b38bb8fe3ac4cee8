package com.olend.api.dto.request;

import com.olend.risk.AssetClass;
import com.olend.risk.BorrowerTier;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollateralPolicyRequest {

    @NotEmpty
    private Map<String, AssetClass> assetClasses;

    @NotEmpty
    private Map<AssetClass, Long> classMaxLtvBps;

    private Map<BorrowerTier, Long> tierBonusBps;

    @NotNull
    private Long globalHardCapBps;

    @NotNull
    private Long warningThresholdBps;

    @NotNull
    private Long liquidationThresholdBps;
}
