package com.leadflow.backend.models.tracking;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * First open of a tracked email. Later opens only bump counters on {@link TrackedEmail}.
 */
@Entity
@Table(name = "email_opens", uniqueConstraints = {
        @UniqueConstraint(name = "uk_email_opens_token", columnNames = "tracking_token")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailOpen {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tracked_email_id", nullable = false)
    private Long trackedEmailId;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Column(name = "tracking_token", nullable = false, length = 64)
    private String trackingToken;

    @Column(name = "opened_at", nullable = false)
    private OffsetDateTime openedAt;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;
}
