package io.factorialsystems.identityservice.store;

import io.factorialsystems.identityservice.exception.DuplicateEmailException;
import io.factorialsystems.identityservice.exception.PersistenceFailureException;
import io.factorialsystems.identityservice.model.UserCredentials;
import io.factorialsystems.identityservice.model.UserIdentity;

import java.util.Optional;

/**
 * Persistence capability the auth service depends on.
 */
public interface UserStore {

    /**
     * Stores a new user together with its password hash.
     *
     * @return the stored identity, with its assigned id and creation time
     * @throws DuplicateEmailException     if the email already belongs to a user
     * @throws PersistenceFailureException on any other storage error
     */
    UserIdentity createUser(UserIdentity identity, String passwordHash);

    /**
     * @throws PersistenceFailureException on storage errors; absence is {@link Optional#empty()}
     */
    Optional<UserCredentials> findByEmail(String email);

    /**
     * @throws PersistenceFailureException on storage errors; absence is {@link Optional#empty()}
     */
    Optional<UserIdentity> findById(long id);
}
