package io.factorialsystems.identityservice.service;

import io.factorialsystems.identityservice.cache.ProfileCache;
import io.factorialsystems.identityservice.config.IdentityProperties;
import io.factorialsystems.identityservice.event.UserEventPublisher;
import io.factorialsystems.identityservice.exception.EmptyCredentialException;
import io.factorialsystems.identityservice.exception.InvalidCredentialsException;
import io.factorialsystems.identityservice.exception.PasswordTooLongException;
import io.factorialsystems.identityservice.exception.UserNotFoundException;
import io.factorialsystems.identityservice.exception.VerificationFailureException;
import io.factorialsystems.identityservice.metrics.AuthMetrics;
import io.factorialsystems.identityservice.model.RegisterCommand;
import io.factorialsystems.identityservice.model.UserCredentials;
import io.factorialsystems.identityservice.model.UserIdentity;
import io.factorialsystems.identityservice.security.CredentialHasher;
import io.factorialsystems.identityservice.security.TokenIssuer;
import io.factorialsystems.identityservice.store.UserStore;
import io.factorialsystems.identityservice.support.Deadline;
import io.factorialsystems.identityservice.support.TimeBoundedExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.Optional;

/**
 * Registration, login and profile reads.
 * <p>
 * Store and cache calls are bounded by the caller's {@link Deadline}. Cache and event bus
 * failures of any kind are absorbed here and never change the outcome seen by the caller; store
 * and hashing failures propagate.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserStore userStore;
    private final CredentialHasher credentialHasher;
    private final TokenIssuer tokenIssuer;
    private final ProfileCache profileCache;
    private final UserEventPublisher userEventPublisher;
    private final TimeBoundedExecutor boundedExecutor;
    private final AuthMetrics metrics;
    private final IdentityProperties properties;

    public UserIdentity register(RegisterCommand command, Deadline deadline) {
        if (!StringUtils.hasLength(command.getPassword())) {
            throw new EmptyCredentialException();
        }
        if (CredentialHasher.exceedsMaxLength(command.getPassword())) {
            throw new PasswordTooLongException(CredentialHasher.MAX_PASSWORD_BYTES);
        }

        String hash = credentialHasher.hash(command.getPassword());

        UserIdentity identity = UserIdentity.builder()
                .username(StringUtils.trimWhitespace(command.getUsername()))
                .email(normalizeEmail(command.getEmail()))
                .role(StringUtils.hasText(command.getRole()) ? command.getRole().trim() : properties.getDefaultRole())
                .build();

        UserIdentity created = boundedExecutor.call("createUser", deadline,
                () -> userStore.createUser(identity, hash));

        log.info("Registered user: id={}, username={}, role={}", created.getId(), created.getUsername(), created.getRole());
        metrics.increment(AuthMetrics.REGISTRATIONS);

        try {
            userEventPublisher.publishUserRegistered(created);
        } catch (RuntimeException e) {
            log.error("Could not dispatch user.registered event for user {}: {}", created.getId(), e.getMessage());
        }

        return created;
    }

    /**
     * @return a signed bearer token for the user
     * @throws InvalidCredentialsException for an unknown email and for a wrong password alike
     */
    public String login(String email, String password, Deadline deadline) {
        Optional<UserCredentials> found = boundedExecutor.call("findByEmail", deadline,
                () -> userStore.findByEmail(normalizeEmail(email)));

        if (found.isEmpty()) {
            log.debug("Login rejected: no such account");
            metrics.increment(AuthMetrics.LOGINS, "outcome", "failure");
            throw new InvalidCredentialsException();
        }

        UserCredentials credentials = found.get();
        String candidate = password == null ? "" : password;
        if (!matches(candidate, credentials)) {
            log.debug("Login rejected for user {}: password mismatch", credentials.getIdentity().getId());
            metrics.increment(AuthMetrics.LOGINS, "outcome", "failure");
            throw new InvalidCredentialsException();
        }

        UserIdentity user = credentials.getIdentity();
        String token = tokenIssuer.issue(user.getId(), user.getRole(), properties.getJwt().getTtl());
        metrics.increment(AuthMetrics.LOGINS, "outcome", "success");
        log.info("User authenticated successfully: {}", user.getId());
        return token;
    }

    private boolean matches(String candidate, UserCredentials credentials) {
        try {
            return credentialHasher.verify(candidate, credentials.getCredential().getPasswordHash());
        } catch (VerificationFailureException e) {
            // reported like a wrong password so the response does not reveal the account exists
            log.error("Stored credential for user {} could not be verified", credentials.getIdentity().getId(), e);
            return false;
        }
    }

    public UserIdentity getProfile(long userId, Deadline deadline) {
        if (userId <= 0) {
            throw new UserNotFoundException(userId);
        }

        String key = ProfileCache.keyFor(userId);
        Optional<UserIdentity> cached = readCache(key, deadline);
        if (cached.isPresent()) {
            metrics.increment(AuthMetrics.PROFILE_CACHE, "result", "hit", "mode", profileCache.mode().name());
            return cached.get();
        }
        metrics.increment(AuthMetrics.PROFILE_CACHE, "result", "miss", "mode", profileCache.mode().name());

        UserIdentity user = boundedExecutor.call("findById", deadline, () -> userStore.findById(userId))
                .orElseThrow(() -> new UserNotFoundException(userId));

        writeCache(key, user, deadline);
        return user;
    }

    private Optional<UserIdentity> readCache(String key, Deadline deadline) {
        try {
            return boundedExecutor.call("cacheGet", deadline, () -> profileCache.get(key));
        } catch (RuntimeException e) {
            metrics.increment(AuthMetrics.PROFILE_CACHE, "result", "failure", "mode", profileCache.mode().name());
            log.warn("Profile cache read failed for {}, falling through to store: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, UserIdentity user, Deadline deadline) {
        try {
            boundedExecutor.run("cachePut", deadline, () -> profileCache.put(key, user));
        } catch (RuntimeException e) {
            metrics.increment(AuthMetrics.PROFILE_CACHE, "result", "failure", "mode", profileCache.mode().name());
            log.warn("Profile cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
