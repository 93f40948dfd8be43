package com.leadflow.backend.dto.sequence;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class EnrollLeadRequest {
    @NotNull(message = "Lead is required")
    private Long leadId;
}
