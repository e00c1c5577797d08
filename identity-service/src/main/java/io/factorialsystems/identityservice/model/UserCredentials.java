package io.factorialsystems.identityservice.model;

import lombok.Value;

@Value
public class UserCredentials {
    UserIdentity identity;
    CredentialRecord credential;
}
