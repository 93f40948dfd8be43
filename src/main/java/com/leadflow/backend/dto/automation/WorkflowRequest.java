package com.leadflow.backend.dto.automation;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class WorkflowRequest {
    @NotBlank(message = "Workflow name is required")
    @Size(max = 100, message = "Workflow name must be less than 100 characters")
    private String name;

    private String description;

    @NotNull(message = "Inactivity days is required")
    @Min(value = 1, message = "Inactivity days must be at least 1")
    private Integer inactivityDays;

    @NotNull(message = "Sequence is required")
    private Long sequenceId;

    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    private Boolean isActive;

    @Email(message = "Owner email must be valid")
    private String ownerEmail;

    private String ownerName;

    private Boolean notifyEnabled;
    private Boolean notifyOnSuccess;
    private Boolean notifyOnFailure;
    private Boolean notifyOnPartial;
    private Boolean batchNotifications;
}
