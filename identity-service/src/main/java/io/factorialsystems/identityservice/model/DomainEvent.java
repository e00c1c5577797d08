package io.factorialsystems.identityservice.model;

import java.util.Map;

public record DomainEvent(String topic, Map<String, Object> payload) {

    public static final String USER_REGISTERED = "user.registered";

    public static DomainEvent userRegistered(UserIdentity user) {
        return new DomainEvent(USER_REGISTERED, Map.of(
                "id", user.getId(),
                "email", user.getEmail()));
    }
}
