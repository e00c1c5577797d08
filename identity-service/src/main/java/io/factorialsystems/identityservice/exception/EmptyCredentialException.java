package io.factorialsystems.identityservice.exception;

public class EmptyCredentialException extends IdentityServiceException {

    public EmptyCredentialException() {
        super("password required");
    }
}
