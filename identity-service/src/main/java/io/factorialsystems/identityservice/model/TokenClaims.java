package io.factorialsystems.identityservice.model;

import java.time.Instant;

/**
 * Claims recovered from a verified bearer token.
 */
public record TokenClaims(long subject, String role, Instant expiresAt) {
}
