package com.leadflow.backend.models.automation;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * Enrolls leads that have been inactive for {@code inactivityDays} into a target sequence.
 * The cron schedule lives on the matching {@link ScheduledJob}.
 */
@Entity
@Table(name = "reengagement_workflows", indexes = {
        @Index(name = "idx_reengagement_workflows_user", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReengagementWorkflow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @NotBlank
    @Size(max = 100)
    @Column(nullable = false, length = 100)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @NotNull
    @Min(1)
    @Column(name = "inactivity_days", nullable = false)
    private Integer inactivityDays;

    @NotNull
    @Column(name = "sequence_id", nullable = false)
    private Long sequenceId;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "last_run_at")
    private OffsetDateTime lastRunAt;

    @Column(name = "owner_email", length = 320)
    private String ownerEmail;

    @Column(name = "owner_name")
    private String ownerName;

    @Embedded
    @Builder.Default
    private NotificationPreferences notificationPreferences = NotificationPreferences.defaults();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean isEnabled() {
        return Boolean.TRUE.equals(isActive);
    }

    public NotificationPreferences preferencesOrDefault() {
        return notificationPreferences != null ? notificationPreferences : NotificationPreferences.defaults();
    }
}
