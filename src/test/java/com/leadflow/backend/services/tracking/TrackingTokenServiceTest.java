package com.leadflow.backend.services.tracking;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class TrackingTokenServiceTest {

    private final TrackingTokenService tokenService = new TrackingTokenService();

    @Test
    void generateToken_IsUrlSafeAndUnique() {
        Set<String> tokens = new HashSet<>();
        for (int i = 0; i < 200; i++) {
            String token = tokenService.generateToken();
            assertThat(token).hasSize(43).matches("[A-Za-z0-9_-]+");
            assertThat(tokenService.isWellFormed(token)).isTrue();
            tokens.add(token);
        }
        assertThat(tokens).hasSize(200);
    }

    @Test
    void isWellFormed_RejectsGuessableOrMalformedValues() {
        assertThat(tokenService.isWellFormed(null)).isFalse();
        assertThat(tokenService.isWellFormed("")).isFalse();
        assertThat(tokenService.isWellFormed("12345")).isFalse();
        assertThat(tokenService.isWellFormed("abc/def+ghijklmnopqrstuvwxyzABCDEFGHIJKLMNO")).isFalse();
    }
}
