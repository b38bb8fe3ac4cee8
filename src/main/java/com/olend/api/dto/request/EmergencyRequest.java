package com.olend.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyRequest {

    private boolean active;

    @NotBlank(message = "reason is required")
    private String reason;
}
