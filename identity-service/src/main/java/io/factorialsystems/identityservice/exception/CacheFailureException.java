package io.factorialsystems.identityservice.exception;

/**
 * The shared cache backend failed. Never reaches callers of the service; the read falls
 * through to the store instead.
 */
public class CacheFailureException extends IdentityServiceException {

    public CacheFailureException(String message) {
        super(message);
    }

    public CacheFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
