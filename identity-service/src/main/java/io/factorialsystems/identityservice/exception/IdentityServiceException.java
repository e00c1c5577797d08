package io.factorialsystems.identityservice.exception;

/**
 * Root of the failures raised by the identity service core.
 */
public abstract class IdentityServiceException extends RuntimeException {

    protected IdentityServiceException(String message) {
        super(message);
    }

    protected IdentityServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
