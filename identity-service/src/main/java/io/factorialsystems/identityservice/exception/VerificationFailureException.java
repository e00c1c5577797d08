package io.factorialsystems.identityservice.exception;

/**
 * A stored hash could not be checked because it is malformed.
 */
public class VerificationFailureException extends IdentityServiceException {

    public VerificationFailureException(String message) {
        super(message);
    }

    public VerificationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
