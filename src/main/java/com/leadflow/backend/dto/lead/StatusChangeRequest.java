package com.leadflow.backend.dto.lead;

import com.leadflow.backend.enums.LeadStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class StatusChangeRequest {
    @NotNull(message = "Status is required")
    private LeadStatus status;
}
