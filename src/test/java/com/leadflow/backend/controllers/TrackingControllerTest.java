package com.leadflow.backend.controllers;

import com.leadflow.backend.exceptions.TrackingException;
import com.leadflow.backend.services.tracking.TrackingIngestor;
import com.leadflow.backend.services.tracking.TrackingRateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.net.URI;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrackingControllerTest {

    private static final String TOKEN = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQ";

    @Mock
    private TrackingIngestor trackingIngestor;

    @Mock
    private TrackingRateLimiter rateLimiter;

    private TrackingController controller;
    private MockHttpServletRequest request;

    @BeforeEach
    void setUp() {
        controller = new TrackingController(trackingIngestor, rateLimiter);
        request = new MockHttpServletRequest();
        request.setRemoteAddr("10.0.0.9");
        request.addHeader(HttpHeaders.USER_AGENT, "Mail/1.0");
    }

    @Test
    void trackOpen_ReturnsUncacheablePixel() {
        when(rateLimiter.tryConsume("10.0.0.9")).thenReturn(true);

        ResponseEntity<byte[]> response = controller.trackOpen(TOKEN, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.IMAGE_PNG);
        assertThat(response.getHeaders().getCacheControl()).contains("no-store");
        assertThat(response.getHeaders().getFirst(HttpHeaders.PRAGMA)).isEqualTo("no-cache");
        assertThat(response.getBody()).isEqualTo(TrackingController.PIXEL);
        verify(trackingIngestor).recordOpen(TOKEN, "10.0.0.9", "Mail/1.0");
    }

    @Test
    void trackOpen_IngestFailureStillReturnsPixel() {
        when(rateLimiter.tryConsume(anyString())).thenReturn(true);
        doThrow(new TrackingException("store unavailable")).when(trackingIngestor).recordOpen(any(), any(), any());

        ResponseEntity<byte[]> response = controller.trackOpen(TOKEN, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(TrackingController.PIXEL);
    }

    @Test
    void trackOpen_RateLimitedRecordsNothing() {
        when(rateLimiter.tryConsume(anyString())).thenReturn(false);

        ResponseEntity<byte[]> response = controller.trackOpen(TOKEN, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        verifyNoInteractions(trackingIngestor);
    }

    @Test
    void trackClick_RedirectsToResolvedDestination() {
        when(rateLimiter.tryConsume("203.0.113.7")).thenReturn(true);
        when(trackingIngestor.recordClick(TOKEN, "https://acme.example/pricing", "203.0.113.7", "Mail/1.0"))
                .thenReturn("https://acme.example/pricing");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");

        ResponseEntity<Void> response = controller.trackClick(TOKEN, "https://acme.example/pricing", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FOUND);
        assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("https://acme.example/pricing"));
    }

    @Test
    void trackClick_RateLimitedRedirectsToFallback() {
        when(rateLimiter.tryConsume(anyString())).thenReturn(false);
        when(trackingIngestor.safeDefaultUrl()).thenReturn("https://leadflow.test");

        ResponseEntity<Void> response = controller.trackClick(TOKEN, "https://acme.example", request);

        assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("https://leadflow.test"));
        verify(trackingIngestor, never()).recordClick(any(), any(), any(), any());
    }

    @Test
    void trackClick_IngestFailureRedirectsToFallback() {
        when(rateLimiter.tryConsume(anyString())).thenReturn(true);
        when(trackingIngestor.recordClick(any(), any(), any(), any())).thenThrow(new TrackingException("boom"));
        when(trackingIngestor.safeDefaultUrl()).thenReturn("https://leadflow.test");

        ResponseEntity<Void> response = controller.trackClick(TOKEN, "https://acme.example", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FOUND);
        assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("https://leadflow.test"));
    }

    @Test
    void trackClick_UnparseableDestinationRedirectsToFallback() {
        when(rateLimiter.tryConsume(anyString())).thenReturn(true);
        when(trackingIngestor.recordClick(any(), any(), any(), any())).thenReturn("https://acme.example/a b");
        when(trackingIngestor.safeDefaultUrl()).thenReturn("https://leadflow.test");

        ResponseEntity<Void> response = controller.trackClick(TOKEN, "https://acme.example/a b", request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FOUND);
        assertThat(response.getHeaders().getLocation()).isEqualTo(URI.create("https://leadflow.test"));
    }
}
