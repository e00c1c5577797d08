package io.factorialsystems.identityservice.exception;

/**
 * The password hasher could not produce a hash.
 */
public class HashingFailureException extends IdentityServiceException {

    public HashingFailureException(String message) {
        super(message);
    }

    public HashingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
