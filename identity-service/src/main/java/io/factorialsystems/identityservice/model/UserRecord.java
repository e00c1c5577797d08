package io.factorialsystems.identityservice.model;

import lombok.*;

import java.time.OffsetDateTime;

/**
 * Row of the {@code users} table as mapped by MyBatis.
 */
@Getter
@Setter
@ToString(exclude = "passwordHash")
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserRecord {
    private Long id;
    private String username;
    private String email;
    private String passwordHash;
    private String role;
    private OffsetDateTime createdAt;

    public UserIdentity toIdentity() {
        return UserIdentity.builder()
                .id(id)
                .username(username)
                .email(email)
                .role(role)
                .createdAt(createdAt)
                .build();
    }

    public CredentialRecord toCredential() {
        return new CredentialRecord(id, passwordHash);
    }
}
