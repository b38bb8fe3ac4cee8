package com.olend.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A borrow position as submitted by the borrowing layer for LTV, liquidation or origination checks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionRequest {

    @NotBlank(message = "positionId is required")
    private String positionId;

    private String borrower;

    /** Asset symbol -> raw collateral amount. */
    @NotNull(message = "collateral is required")
    private Map<String, @NotNull @PositiveOrZero Long> collateral;

    @NotBlank(message = "borrowedAsset is required")
    private String borrowedAsset;

    @PositiveOrZero(message = "borrowedAmount must not be negative")
    private long borrowedAmount;

    private long createdAt;
    private long updatedAt;
}
