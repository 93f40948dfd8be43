package com.leadflow.backend.services.tracking;

import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Issues opaque tracking tokens: 32 random bytes, URL-safe Base64 without padding.
 */
@Service
public class TrackingTokenService {

    private static final int TOKEN_BYTES = 32;
    private static final Pattern TOKEN_PATTERN = Pattern.compile("^[A-Za-z0-9_-]{43}$");

    private final SecureRandom secureRandom = new SecureRandom();

    public String generateToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Cheap shape check done before touching the store.
     */
    public boolean isWellFormed(String token) {
        return token != null && TOKEN_PATTERN.matcher(token).matches();
    }
}
