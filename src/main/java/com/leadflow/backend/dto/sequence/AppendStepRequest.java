package com.leadflow.backend.dto.sequence;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class AppendStepRequest {
    @Min(value = 0, message = "Delay days cannot be negative")
    private Integer delayDays = 0;

    @Min(value = 0, message = "Delay hours cannot be negative")
    private Integer delayHours = 0;

    private Long templateId;

    @NotBlank(message = "Subject is required")
    @Size(max = 500, message = "Subject must be less than 500 characters")
    private String subject;

    @NotBlank(message = "Body is required")
    private String body;
}
