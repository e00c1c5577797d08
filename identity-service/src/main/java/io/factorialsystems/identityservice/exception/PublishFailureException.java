package io.factorialsystems.identityservice.exception;

/**
 * An event could not be handed to the bus. Logged by the publisher, never surfaced.
 */
public class PublishFailureException extends IdentityServiceException {

    public PublishFailureException(String message) {
        super(message);
    }

    public PublishFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
