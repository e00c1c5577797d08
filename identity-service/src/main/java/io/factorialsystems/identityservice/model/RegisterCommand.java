package io.factorialsystems.identityservice.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

@Value
@Builder
public class RegisterCommand {
    String username;
    String email;
    @ToString.Exclude
    String password;
    String role;
}
