package io.factorialsystems.identityservice.exception;

public class PersistenceFailureException extends IdentityServiceException {

    public PersistenceFailureException(String message) {
        super(message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
