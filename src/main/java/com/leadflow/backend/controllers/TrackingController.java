package com.leadflow.backend.controllers;

import com.leadflow.backend.services.tracking.TrackingIngestor;
import com.leadflow.backend.services.tracking.TrackingRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.Base64;

/**
 * Public open-pixel and click-redirect endpoints embedded in outbound emails.
 * Neither endpoint ever reports an error to the recipient.
 */
@RestController
@RequestMapping("/track")
@RequiredArgsConstructor
@Slf4j
public class TrackingController {

    static final byte[] PIXEL = Base64.getDecoder().decode(
            "iVBORw0KGgoAAAANSUhEUgAAAAEAAAABCAQAAAC1HAwCAAAAC0lEQVR42mNkYAAAAAYAAjCB0C8AAAAASUVORK5CYII=");

    private final TrackingIngestor trackingIngestor;
    private final TrackingRateLimiter rateLimiter;

    @GetMapping("/open/{token}")
    public ResponseEntity<byte[]> trackOpen(@PathVariable String token, HttpServletRequest request) {
        String ip = clientIp(request);
        if (rateLimiter.tryConsume(ip)) {
            try {
                trackingIngestor.recordOpen(token, ip, request.getHeader(HttpHeaders.USER_AGENT));
            } catch (Exception e) {
                log.error("Failed to record open for token {}: {}", token, e.getMessage(), e);
            }
        } else {
            log.debug("Open tracking rate limited for {}", ip);
        }

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .cacheControl(CacheControl.noStore().mustRevalidate())
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .body(PIXEL);
    }

    @GetMapping("/click/{token}")
    public ResponseEntity<Void> trackClick(@PathVariable String token,
                                           @RequestParam(value = "url", required = false) String url,
                                           HttpServletRequest request) {
        String ip = clientIp(request);
        String destination;
        if (!rateLimiter.tryConsume(ip)) {
            log.debug("Click tracking rate limited for {}", ip);
            destination = trackingIngestor.safeDefaultUrl();
        } else {
            try {
                destination = trackingIngestor.recordClick(token, url, ip, request.getHeader(HttpHeaders.USER_AGENT));
            } catch (Exception e) {
                log.error("Failed to record click for token {}: {}", token, e.getMessage(), e);
                destination = trackingIngestor.safeDefaultUrl();
            }
        }

        return ResponseEntity.status(HttpStatus.FOUND)
                .location(redirectTarget(destination))
                .cacheControl(CacheControl.noStore())
                .build();
    }

    private URI redirectTarget(String destination) {
        if (destination != null) {
            try {
                return URI.create(destination);
            } catch (IllegalArgumentException e) {
                log.warn("Unparseable redirect target '{}': {}", destination, e.getMessage());
            }
        }
        return URI.create(trackingIngestor.safeDefaultUrl());
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
