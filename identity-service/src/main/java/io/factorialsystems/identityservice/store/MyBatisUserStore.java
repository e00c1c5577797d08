package io.factorialsystems.identityservice.store;

import io.factorialsystems.identityservice.exception.DuplicateEmailException;
import io.factorialsystems.identityservice.exception.PersistenceFailureException;
import io.factorialsystems.identityservice.mapper.UserMapper;
import io.factorialsystems.identityservice.metrics.AuthMetrics;
import io.factorialsystems.identityservice.model.UserCredentials;
import io.factorialsystems.identityservice.model.UserIdentity;
import io.factorialsystems.identityservice.model.UserRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Repository
@RequiredArgsConstructor
public class MyBatisUserStore implements UserStore {

    private final UserMapper userMapper;
    private final AuthMetrics metrics;
    private final Clock clock;

    @Override
    public UserIdentity createUser(UserIdentity identity, String passwordHash) {
        UserRecord record = UserRecord.builder()
                .username(identity.getUsername())
                .email(identity.getEmail())
                .passwordHash(passwordHash)
                .role(identity.getRole())
                // database timestamps keep microseconds
                .createdAt(OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS))
                .build();

        try {
            int result = timed("createUser", () -> userMapper.insert(record));
            if (result <= 0) {
                throw new PersistenceFailureException("Failed to create user");
            }
        } catch (DuplicateKeyException e) {
            throw new DuplicateEmailException(identity.getEmail(), e);
        } catch (DataAccessException e) {
            log.error("Failed to insert user {}: {}", identity.getEmail(), e.getMessage());
            throw new PersistenceFailureException("Failed to create user", e);
        }

        return record.toIdentity();
    }

    @Override
    public Optional<UserCredentials> findByEmail(String email) {
        try {
            UserRecord record = timed("findByEmail", () -> userMapper.findByEmail(email));
            if (record == null) {
                return Optional.empty();
            }
            return Optional.of(new UserCredentials(record.toIdentity(), record.toCredential()));
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to look up user by email", e);
        }
    }

    @Override
    public Optional<UserIdentity> findById(long id) {
        try {
            UserRecord record = timed("findById", () -> userMapper.findById(id));
            return Optional.ofNullable(record).map(UserRecord::toIdentity);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to look up user " + id, e);
        }
    }

    private <T> T timed(String operation, Supplier<T> query) {
        long start = System.nanoTime();
        try {
            return query.get();
        } finally {
            metrics.record(AuthMetrics.STORE_QUERY, Duration.ofNanos(System.nanoTime() - start), "operation", operation);
        }
    }
}
