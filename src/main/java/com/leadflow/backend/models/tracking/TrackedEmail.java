package com.leadflow.backend.models.tracking;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

/**
 * One outbound email bound to an opaque tracking token.
 */
@Entity
@Table(name = "tracked_emails",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tracked_emails_token", columnNames = "tracking_token")
        },
        indexes = {
                @Index(name = "idx_tracked_emails_lead", columnList = "lead_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedEmail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Column(name = "sequence_id")
    private Long sequenceId;

    @Column(name = "sequence_step_id")
    private Long sequenceStepId;

    @Column(name = "enrollment_id")
    private Long enrollmentId;

    @Column(name = "template_id")
    private Long templateId;

    @Column(name = "recipient_email", nullable = false, length = 320)
    private String recipientEmail;

    @Column(length = 500)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String body;

    @Column(name = "tracking_token", nullable = false, length = 64)
    private String trackingToken;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Column(name = "provider_message_id")
    private String providerMessageId;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "open_count", nullable = false)
    @Builder.Default
    private Integer openCount = 0;

    @Column(name = "first_opened_at")
    private OffsetDateTime firstOpenedAt;

    @Column(name = "last_opened_at")
    private OffsetDateTime lastOpenedAt;

    @Column(name = "click_count", nullable = false)
    @Builder.Default
    private Integer clickCount = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    public enum DeliveryStatus {
        PENDING, SENT, FAILED
    }

    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }

    public void markSent(String providerMessageId, OffsetDateTime at) {
        this.status = DeliveryStatus.SENT;
        this.providerMessageId = providerMessageId;
        this.sentAt = at;
        this.errorMessage = null;
    }

    public void markFailed(String error) {
        this.status = DeliveryStatus.FAILED;
        this.errorMessage = error;
    }

    public void recordOpen(OffsetDateTime at) {
        this.openCount = (openCount != null ? openCount : 0) + 1;
        if (firstOpenedAt == null) {
            firstOpenedAt = at;
        }
        lastOpenedAt = at;
    }

    public void recordClick() {
        this.clickCount = (clickCount != null ? clickCount : 0) + 1;
    }
}
