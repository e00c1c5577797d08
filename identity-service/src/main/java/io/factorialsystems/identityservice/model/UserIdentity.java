package io.factorialsystems.identityservice.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;

/**
 * Public view of a registered user. Immutable; never carries credential material, so it is
 * safe to cache, log and return to callers.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class UserIdentity {
    Long id;
    String username;
    String email;
    String role;
    OffsetDateTime createdAt;
}
