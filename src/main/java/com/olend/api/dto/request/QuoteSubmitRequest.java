package com.olend.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw quote pushed by the off-chain relayer. Range checks happen in validation, not here,
 * so a bad quote is recorded against the asset's price breaker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteSubmitRequest {

    @NotNull(message = "price is required")
    private Long price;

    @NotNull(message = "confidence is required")
    private Long confidence;

    @NotNull(message = "exponent is required")
    private Integer exponent;

    /** Defaults to the current logical time. */
    private Long observedAt;
}
