package io.factorialsystems.identityservice.exception;

/**
 * Login failed. Raised both for an unknown email and for a wrong password, with the same
 * message, so callers cannot tell whether an account exists.
 */
public class InvalidCredentialsException extends IdentityServiceException {

    public static final String MESSAGE = "invalid credentials";

    public InvalidCredentialsException() {
        super(MESSAGE);
    }
}
