package io.factorialsystems.identityservice.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * A call to an external dependency did not finish before the request deadline.
 */
@Getter
public class OperationTimeoutException extends IdentityServiceException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super("operation '" + operation + "' exceeded deadline of " + timeout.toMillis() + "ms");
        this.operation = operation;
        this.timeout = timeout;
    }
}
