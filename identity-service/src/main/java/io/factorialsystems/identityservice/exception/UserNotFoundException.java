package io.factorialsystems.identityservice.exception;

import lombok.Getter;

@Getter
public class UserNotFoundException extends IdentityServiceException {

    private final long userId;

    public UserNotFoundException(long userId) {
        super("user not found");
        this.userId = userId;
    }
}
