package com.screening.controller;

import com.screening.config.ScreeningProperties;
import com.screening.exception.UnauthorizedTriggerException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Checks the bearer token of internal calls against the configured shared secret.
 *
 * An unset secret rejects every call. Comparison is constant-time.
 */
@Component
@RequiredArgsConstructor
public class SharedSecretVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final ScreeningProperties properties;

    public void verify(String authorizationHeader) {
        String secret = properties.getInternal().getSharedSecret();
        if (secret == null || secret.isBlank()) {
            throw new UnauthorizedTriggerException("internal shared secret is not configured");
        }
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedTriggerException("missing bearer token");
        }
        byte[] presented = authorizationHeader.substring(BEARER_PREFIX.length()).trim()
                .getBytes(StandardCharsets.UTF_8);
        if (!MessageDigest.isEqual(presented, secret.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedTriggerException("invalid bearer token");
        }
    }
}
