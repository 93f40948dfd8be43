package com.leadflow.backend.services.tracking;

import com.leadflow.backend.config.EngagementProperties;
import com.leadflow.backend.exceptions.TrackingException;
import com.leadflow.backend.models.tracking.EmailClick;
import com.leadflow.backend.models.tracking.EmailOpen;
import com.leadflow.backend.models.tracking.TrackedEmail;
import com.leadflow.backend.services.scoring.LeadScoringService;
import com.leadflow.backend.store.LeadStore;
import com.leadflow.backend.store.TrackingStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;

/**
 * Records open and click events coming from the public tracking endpoints.
 *
 * Nothing here ever throws to the caller: an unknown, malformed or expired token is logged
 * and ignored so remote clients cannot probe token validity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingIngestor {

    private static final int MAX_USER_AGENT = 500;

    private final TrackingStore trackingStore;
    private final LeadStore leadStore;
    private final LeadScoringService scoringService;
    private final TrackingTokenService tokenService;
    private final EngagementProperties properties;
    private final Clock clock;

    /**
     * Records an open. Only the first open of a token stores an event and triggers a score
     * recomputation; re-opens bump the email's counters and the lead's engagement time.
     */
    public void recordOpen(String token, String ipAddress, String userAgent) {
        try {
            TrackedEmail email = resolve(token);
            OffsetDateTime now = OffsetDateTime.now(clock);

            trackingStore.incrementOpenCount(email.getId(), now);
            leadStore.recordEngagement(email.getLeadId(), now);

            boolean firstOpen = trackingStore.recordFirstOpen(EmailOpen.builder()
                    .trackedEmailId(email.getId())
                    .leadId(email.getLeadId())
                    .trackingToken(token)
                    .openedAt(now)
                    .ipAddress(ipAddress)
                    .userAgent(truncate(userAgent))
                    .build());

            if (firstOpen) {
                log.info("Email {} opened by lead {}", email.getId(), email.getLeadId());
                scoringService.recalculateAsync(email.getLeadId());
            } else {
                log.debug("Repeat open of email {}", email.getId());
            }
        } catch (TrackingException e) {
            log.debug("Ignoring open: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Failed to record open for token: {}", e.getMessage(), e);
        }
    }

    /**
     * Records a click and returns where the caller should be redirected. Invalid tokens and
     * non-http(s) destinations go to the configured safe default without recording.
     */
    public String recordClick(String token, String rawDestination, String ipAddress, String userAgent) {
        String destinationUrl = normalizeDestination(rawDestination);
        if (destinationUrl == null) {
            log.warn("Rejected click destination '{}'", rawDestination);
            return safeDefaultUrl();
        }

        try {
            TrackedEmail email = resolve(token);
            OffsetDateTime now = OffsetDateTime.now(clock);

            boolean newClick = trackingStore.recordClick(EmailClick.builder()
                    .trackedEmailId(email.getId())
                    .leadId(email.getLeadId())
                    .trackingToken(token)
                    .originalUrl(destinationUrl)
                    .urlHash(sha256(destinationUrl))
                    .clickedAt(now)
                    .ipAddress(ipAddress)
                    .userAgent(truncate(userAgent))
                    .build());

            leadStore.recordEngagement(email.getLeadId(), now);

            if (newClick) {
                trackingStore.incrementClickCount(email.getId());
                log.info("Lead {} clicked {} in email {}", email.getLeadId(), destinationUrl, email.getId());
                scoringService.recalculateAsync(email.getLeadId());
            } else {
                log.debug("Replayed click on email {} for {}", email.getId(), destinationUrl);
            }
            return destinationUrl;

        } catch (TrackingException e) {
            log.debug("Ignoring click: {}", e.getMessage());
            return safeDefaultUrl();
        } catch (Exception e) {
            log.error("Failed to record click: {}", e.getMessage(), e);
            return destinationUrl;
        }
    }

    public String safeDefaultUrl() {
        return properties.tracking().fallbackUrl();
    }

    /**
     * A token is valid only for an email that was actually sent and is still within its lifetime.
     */
    TrackedEmail resolve(String token) {
        if (!tokenService.isWellFormed(token)) {
            throw new TrackingException("Malformed tracking token");
        }
        TrackedEmail email = trackingStore.findByToken(token)
                .orElseThrow(() -> new TrackingException("Unknown tracking token"));
        if (!email.isSent() || email.getSentAt() == null) {
            throw new TrackingException("Tracking token bound to unsent email " + email.getId());
        }
        OffsetDateTime expiresAt = email.getSentAt().plusDays(properties.tracking().tokenTtlDays());
        if (OffsetDateTime.now(clock).isAfter(expiresAt)) {
            throw new TrackingException("Expired tracking token for email " + email.getId());
        }
        return email;
    }

    /**
     * Returns the trimmed destination when it is an absolute http(s) URL with a host, otherwise null.
     * The returned string always parses as a URI.
     */
    static String normalizeDestination(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String trimmed = url.trim();
        try {
            URI uri = URI.create(trimmed);
            String scheme = uri.getScheme();
            boolean safe = uri.isAbsolute() && uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
            return safe ? trimmed : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT) {
            return userAgent;
        }
        return userAgent.substring(0, MAX_USER_AGENT);
    }
}
