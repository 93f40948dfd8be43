package com.leadflow.backend.models.automation;

import com.leadflow.backend.enums.RunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * Owner preferences for run notifications. Absent values fall back to
 * "notify on everything, immediately".
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {

    @Column(name = "notify_enabled")
    @Builder.Default
    private Boolean enabled = true;

    @Column(name = "notify_on_success")
    @Builder.Default
    private Boolean onSuccess = true;

    @Column(name = "notify_on_failure")
    @Builder.Default
    private Boolean onFailure = true;

    @Column(name = "notify_on_partial")
    @Builder.Default
    private Boolean onPartial = true;

    @Column(name = "notify_batch")
    @Builder.Default
    private Boolean batchNotifications = false;

    public static NotificationPreferences defaults() {
        return NotificationPreferences.builder().build();
    }

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public boolean isBatch() {
        return batchNotifications != null && batchNotifications;
    }

    public boolean wantsStatus(RunStatus status) {
        Boolean flag = switch (status) {
            case SUCCESS -> onSuccess;
            case FAILED -> onFailure;
            case PARTIAL -> onPartial;
        };
        return flag == null || flag;
    }
}
