package com.leadflow.backend.services.tracking;

import com.leadflow.backend.config.EngagementProperties;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-IP token buckets for the public tracking endpoints.
 */
@Component
@Slf4j
public class TrackingRateLimiter {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();
    private final int requestsPerMinute;

    public TrackingRateLimiter(EngagementProperties properties) {
        this.requestsPerMinute = Math.max(1, properties.tracking().rateLimitPerMinute());
    }

    public boolean tryConsume(String clientIp) {
        String key = clientIp != null ? clientIp : "unknown";
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        boolean allowed = bucket.tryConsume(1);
        if (!allowed) {
            log.warn("Tracking rate limit exceeded for IP {}", key);
        }
        return allowed;
    }

    private Bucket createBucket() {
        Bandwidth limit = Bandwidth.classic(requestsPerMinute,
                Refill.intervally(requestsPerMinute, Duration.ofMinutes(1)));
        return Bucket.builder()
                .addLimit(limit)
                .build();
    }
}
