package io.factorialsystems.identityservice.exception;

import lombok.Getter;

@Getter
public class PasswordTooLongException extends IdentityServiceException {

    private final int maxBytes;

    public PasswordTooLongException(int maxBytes) {
        super("password must be at most " + maxBytes + " bytes");
        this.maxBytes = maxBytes;
    }
}
