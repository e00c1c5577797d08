package io.factorialsystems.identityservice.exception;

/**
 * A bearer token was malformed, wrongly signed or expired.
 */
public class TokenInvalidException extends IdentityServiceException {

    public TokenInvalidException(String message) {
        super(message);
    }

    public TokenInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
