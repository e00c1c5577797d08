package io.factorialsystems.identityservice.exception;

import lombok.Getter;

/**
 * Registration tried to reuse an email that already belongs to a user.
 */
@Getter
public class DuplicateEmailException extends IdentityServiceException {

    private final String email;

    public DuplicateEmailException(String email, Throwable cause) {
        super("a user with this email already exists", cause);
        this.email = email;
    }
}
