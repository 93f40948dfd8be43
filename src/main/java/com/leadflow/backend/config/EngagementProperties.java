package com.leadflow.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "engagement")
public record EngagementProperties(
        @DefaultValue Scheduler scheduler,
        @DefaultValue Tracking tracking,
        @DefaultValue Notifications notifications
) {

    public record Scheduler(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("UTC") String zone,
            @DefaultValue("PT10M") Duration runTimeout,
            @DefaultValue("PT5M") Duration lockGrace,
            @DefaultValue("4") int poolSize,
            @DefaultValue("0 */15 * * * *") String sequenceSweepCron
    ) {
        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public record Tracking(
            @DefaultValue("http://localhost:8080") String baseUrl,
            @DefaultValue("https://leadflow.app") String fallbackUrl,
            @DefaultValue("365") int tokenTtlDays,
            @DefaultValue("120") int rateLimitPerMinute
    ) {
    }

    public record Notifications(
            @DefaultValue("0 0 18 * * *") String batchCron,
            @DefaultValue("LeadFlow") String signature
    ) {
    }
}
