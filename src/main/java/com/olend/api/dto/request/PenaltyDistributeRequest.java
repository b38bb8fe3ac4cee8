package com.olend.api.dto.request;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PenaltyDistributeRequest {

    @PositiveOrZero(message = "totalPenalty must not be negative")
    private long totalPenalty;
}
