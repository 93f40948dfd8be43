package com.leadflow.backend.models.tracking;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;

/**
 * A click on one link of a tracked email. Unique per (token, url hash).
 */
@Entity
@Table(name = "email_clicks",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_email_clicks_token_url", columnNames = {"tracking_token", "url_hash"})
        },
        indexes = {
                @Index(name = "idx_email_clicks_lead", columnList = "lead_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailClick {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "tracked_email_id", nullable = false)
    private Long trackedEmailId;

    @Column(name = "lead_id", nullable = false)
    private Long leadId;

    @Column(name = "tracking_token", nullable = false, length = 64)
    private String trackingToken;

    @Column(name = "original_url", nullable = false, columnDefinition = "TEXT")
    private String originalUrl;

    /**
     * Hex SHA-256 of originalUrl, used for the uniqueness constraint.
     */
    @Column(name = "url_hash", nullable = false, length = 64)
    private String urlHash;

    @Column(name = "clicked_at", nullable = false)
    private OffsetDateTime clickedAt;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "user_agent", length = 500)
    private String userAgent;
}
