package io.factorialsystems.identityservice.model;

import lombok.ToString;
import lombok.Value;

/**
 * Stored password hash of a user. Lives only between the store and the hasher.
 */
@Value
public class CredentialRecord {
    Long userId;
    @ToString.Exclude
    String passwordHash;
}
