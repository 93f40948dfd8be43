package com.leadflow.backend.models;

import com.leadflow.backend.enums.LeadStatus;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

@Entity
@Table(name = "leads", indexes = {
        @Index(name = "idx_leads_user_engagement", columnList = "user_id, last_engagement_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Lead {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @NotBlank
    @Size(max = 255)
    @Column(name = "company_name", nullable = false)
    private String companyName;

    @Column(length = 500)
    private String website;

    private String industry;

    @Column(name = "company_size", length = 100)
    private String companySize;

    private String location;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "contact_name")
    private String contactName;

    @Column(name = "contact_title")
    private String contactTitle;

    @Column(name = "contact_email", length = 320)
    private String contactEmail;

    @Column(name = "contact_linkedin", length = 500)
    private String contactLinkedin;

    @Column(name = "contact_phone", length = 50)
    private String contactPhone;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private LeadStatus status = LeadStatus.NEW;

    @Min(0) @Max(100)
    @Column(nullable = false)
    @Builder.Default
    private Integer score = 0;

    @Column(name = "score_updated_at")
    private OffsetDateTime scoreUpdatedAt;

    /**
     * Latest of: last open, last click, last status change. Null until the lead engages.
     */
    @Column(name = "last_engagement_at")
    private OffsetDateTime lastEngagementAt;

    @Column(name = "status_changed_at")
    private OffsetDateTime statusChangedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public boolean hasContactEmail() {
        return contactEmail != null && !contactEmail.isBlank();
    }

    /**
     * Moves lastEngagementAt forward, never backwards.
     */
    public void touchEngagement(OffsetDateTime at) {
        if (at != null && (lastEngagementAt == null || at.isAfter(lastEngagementAt))) {
            lastEngagementAt = at;
        }
    }
}
