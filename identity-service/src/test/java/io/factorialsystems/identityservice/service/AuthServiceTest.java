package io.factorialsystems.identityservice.service;

import io.factorialsystems.identityservice.cache.CacheMode;
import io.factorialsystems.identityservice.cache.InMemoryProfileCache;
import io.factorialsystems.identityservice.cache.ProfileCache;
import io.factorialsystems.identityservice.config.IdentityProperties;
import io.factorialsystems.identityservice.event.UserEventPublisher;
import io.factorialsystems.identityservice.exception.CacheFailureException;
import io.factorialsystems.identityservice.exception.DuplicateEmailException;
import io.factorialsystems.identityservice.exception.EmptyCredentialException;
import io.factorialsystems.identityservice.exception.InvalidCredentialsException;
import io.factorialsystems.identityservice.exception.OperationTimeoutException;
import io.factorialsystems.identityservice.exception.PasswordTooLongException;
import io.factorialsystems.identityservice.exception.PersistenceFailureException;
import io.factorialsystems.identityservice.exception.UserNotFoundException;
import io.factorialsystems.identityservice.metrics.AuthMetrics;
import io.factorialsystems.identityservice.model.CredentialRecord;
import io.factorialsystems.identityservice.model.RegisterCommand;
import io.factorialsystems.identityservice.model.TokenClaims;
import io.factorialsystems.identityservice.model.UserCredentials;
import io.factorialsystems.identityservice.model.UserIdentity;
import io.factorialsystems.identityservice.security.CredentialHasher;
import io.factorialsystems.identityservice.security.TokenIssuer;
import io.factorialsystems.identityservice.store.UserStore;
import io.factorialsystems.identityservice.support.Deadline;
import io.factorialsystems.identityservice.support.TimeBoundedExecutor;
import io.factorialsystems.identityservice.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private UserStore userStore;

    @Mock
    private UserEventPublisher userEventPublisher;

    @Mock
    private AuthMetrics metrics;

    @Mock
    private TaskScheduler scheduler;

    private final CredentialHasher hasher = new CredentialHasher(4);
    private final IdentityProperties properties = new IdentityProperties();
    private final TimeBoundedExecutor boundedExecutor = new TimeBoundedExecutor(Runnable::run);

    private MutableClock clock;
    private TokenIssuer tokenIssuer;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        tokenIssuer = new TokenIssuer(SECRET, "identity-service", clock);
        authService = serviceWith(new InMemoryProfileCache(Duration.ofMinutes(5), clock, scheduler));
    }

    @Test
    void register_storesHashAndPublishesEvent() {
        // Given
        ArgumentCaptor<UserIdentity> identity = ArgumentCaptor.forClass(UserIdentity.class);
        ArgumentCaptor<String> hash = ArgumentCaptor.forClass(String.class);
        when(userStore.createUser(identity.capture(), hash.capture()))
                .thenAnswer(invocation -> stored(1L, invocation.getArgument(0)));

        // When
        UserIdentity created = authService.register(RegisterCommand.builder()
                .username(" alice ")
                .email("Alice@Example.com")
                .password("Secret123")
                .build(), deadline());

        // Then
        assertEquals(1L, created.getId());
        assertEquals("alice", identity.getValue().getUsername());
        assertEquals("alice@example.com", identity.getValue().getEmail());
        assertEquals("user", identity.getValue().getRole());
        assertNotEquals("Secret123", hash.getValue());
        assertTrue(hasher.verify("Secret123", hash.getValue()));
        verify(userEventPublisher).publishUserRegistered(created);
        verify(metrics).increment(AuthMetrics.REGISTRATIONS);
    }

    @Test
    void register_keepsRequestedRole() {
        when(userStore.createUser(any(UserIdentity.class), anyString()))
                .thenAnswer(invocation -> stored(2L, invocation.getArgument(0)));

        UserIdentity created = authService.register(RegisterCommand.builder()
                .username("bob")
                .email("bob@example.com")
                .password("Secret123")
                .role("admin")
                .build(), deadline());

        assertEquals("admin", created.getRole());
    }

    @Test
    void register_rejectsEmptyPasswordBeforeTouchingStore() {
        RegisterCommand command = RegisterCommand.builder()
                .username("alice")
                .email("alice@example.com")
                .password("")
                .build();

        assertThrows(EmptyCredentialException.class, () -> authService.register(command, deadline()));

        verifyNoInteractions(userStore, userEventPublisher);
    }

    @Test
    void register_rejectsPasswordLongerThan72BytesBeforeTouchingStore() {
        RegisterCommand command = RegisterCommand.builder()
                .username("alice")
                .email("alice@example.com")
                .password("é".repeat(36) + "A")
                .build();

        PasswordTooLongException ex = assertThrows(PasswordTooLongException.class,
                () -> authService.register(command, deadline()));

        assertEquals(72, ex.getMaxBytes());
        verifyNoInteractions(userStore, userEventPublisher);
    }

    @Test
    void register_duplicateEmailIsNotPublished() {
        when(userStore.createUser(any(UserIdentity.class), anyString()))
                .thenThrow(new DuplicateEmailException("alice@example.com", new DuplicateKeyException("users_email_key")));

        assertThrows(DuplicateEmailException.class, () -> authService.register(alice(), deadline()));

        verifyNoInteractions(userEventPublisher);
    }

    @Test
    void register_persistenceFailurePropagates() {
        when(userStore.createUser(any(UserIdentity.class), anyString()))
                .thenThrow(new PersistenceFailureException("connection refused"));

        assertThrows(PersistenceFailureException.class, () -> authService.register(alice(), deadline()));
    }

    @Test
    void register_succeedsWhenEventCannotBeDispatched() {
        when(userStore.createUser(any(UserIdentity.class), anyString()))
                .thenAnswer(invocation -> stored(1L, invocation.getArgument(0)));
        doThrow(new TaskRejectedException("queue full"))
                .when(userEventPublisher).publishUserRegistered(any(UserIdentity.class));

        UserIdentity created = authService.register(alice(), deadline());

        assertEquals(1L, created.getId());
    }

    @Test
    void registerLoginAndProfile_secondReadIsServedFromCache() {
        // Given a registered user
        AtomicReference<UserIdentity> storedUser = new AtomicReference<>();
        AtomicReference<String> storedHash = new AtomicReference<>();
        when(userStore.createUser(any(UserIdentity.class), anyString())).thenAnswer(invocation -> {
            storedUser.set(stored(1L, invocation.getArgument(0)));
            storedHash.set(invocation.getArgument(1));
            return storedUser.get();
        });
        authService.register(alice(), deadline());

        when(userStore.findByEmail("alice@example.com")).thenAnswer(invocation -> Optional.of(
                new UserCredentials(storedUser.get(), new CredentialRecord(1L, storedHash.get()))));
        when(userStore.findById(1L)).thenAnswer(invocation -> Optional.of(storedUser.get()));

        // When
        String token = authService.login("alice@example.com", "Secret123", deadline());
        UserIdentity first = authService.getProfile(1L, deadline());
        UserIdentity second = authService.getProfile(1L, deadline());

        // Then
        TokenClaims claims = tokenIssuer.verify(token);
        assertEquals(1L, claims.subject());
        assertEquals("user", claims.role());
        assertEquals(NOW.plus(Duration.ofHours(24)), claims.expiresAt());

        assertEquals(storedUser.get(), first);
        assertEquals(first, second);
        verify(userStore, times(1)).findById(1L);
        verify(metrics).increment(AuthMetrics.PROFILE_CACHE, "result", "hit", "mode", "DEGRADED");
        verify(metrics).increment(AuthMetrics.LOGINS, "outcome", "success");
    }

    @Test
    void login_unknownEmailAndWrongPasswordAreIndistinguishable() {
        String hash = hasher.hash("Secret123");
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(new UserCredentials(
                stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build()),
                new CredentialRecord(1L, hash))));
        when(userStore.findByEmail("nobody@example.com")).thenReturn(Optional.empty());

        InvalidCredentialsException wrongPassword = assertThrows(InvalidCredentialsException.class,
                () -> authService.login("alice@example.com", "wrong", deadline()));
        InvalidCredentialsException unknownEmail = assertThrows(InvalidCredentialsException.class,
                () -> authService.login("nobody@example.com", "Secret123", deadline()));

        assertEquals("invalid credentials", wrongPassword.getMessage());
        assertEquals(wrongPassword.getMessage(), unknownEmail.getMessage());
        verify(metrics, times(2)).increment(AuthMetrics.LOGINS, "outcome", "failure");
    }

    @Test
    void login_lookupIsCaseInsensitiveOnEmail() {
        String hash = hasher.hash("Secret123");
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(new UserCredentials(
                stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build()),
                new CredentialRecord(1L, hash))));

        String token = authService.login(" ALICE@example.com", "Secret123", deadline());

        assertEquals(1L, tokenIssuer.verify(token).subject());
    }

    @Test
    void login_malformedStoredHashIsReportedAsInvalidCredentials() {
        when(userStore.findByEmail("alice@example.com")).thenReturn(Optional.of(new UserCredentials(
                stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build()),
                new CredentialRecord(1L, "not-a-bcrypt-hash"))));

        InvalidCredentialsException ex = assertThrows(InvalidCredentialsException.class,
                () -> authService.login("alice@example.com", "Secret123", deadline()));

        assertEquals("invalid credentials", ex.getMessage());
        verify(metrics).increment(AuthMetrics.LOGINS, "outcome", "failure");
    }

    @Test
    void login_expiredDeadlineFailsWithoutStoreCall() {
        assertThrows(OperationTimeoutException.class,
                () -> authService.login("alice@example.com", "Secret123", Deadline.after(Duration.ZERO)));

        verifyNoInteractions(userStore);
    }

    @Test
    void getProfile_unknownUserIsNotFound() {
        when(userStore.findById(99L)).thenReturn(Optional.empty());

        UserNotFoundException ex = assertThrows(UserNotFoundException.class,
                () -> authService.getProfile(99L, deadline()));

        assertEquals("user not found", ex.getMessage());
        assertEquals(99L, ex.getUserId());
    }

    @Test
    void getProfile_nonPositiveIdIsNotFoundWithoutLookup() {
        assertThrows(UserNotFoundException.class, () -> authService.getProfile(0L, deadline()));
        assertThrows(UserNotFoundException.class, () -> authService.getProfile(-5L, deadline()));

        verify(userStore, never()).findById(anyLong());
    }

    @Test
    void getProfile_cacheFailuresFallThroughToStore() {
        // Given a cache that fails on every call
        ProfileCache brokenCache = mock(ProfileCache.class);
        when(brokenCache.mode()).thenReturn(CacheMode.SHARED);
        when(brokenCache.get("user:1")).thenThrow(new CacheFailureException("Redis get failed for user:1"));
        doThrow(new CacheFailureException("Redis set failed for user:1"))
                .when(brokenCache).put(eq("user:1"), any(UserIdentity.class));
        UserIdentity alice = stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build());
        when(userStore.findById(1L)).thenReturn(Optional.of(alice));

        // When
        UserIdentity profile = serviceWith(brokenCache).getProfile(1L, deadline());

        // Then
        assertEquals(alice, profile);
        verify(metrics, times(2)).increment(AuthMetrics.PROFILE_CACHE, "result", "failure", "mode", "SHARED");
    }

    @Test
    void getProfile_rejectedCacheReadFallsThroughToStore() {
        // Given a cache whose read is rejected by its executor
        ProfileCache busyCache = mock(ProfileCache.class);
        when(busyCache.mode()).thenReturn(CacheMode.SHARED);
        when(busyCache.get("user:1")).thenThrow(new TaskRejectedException("Executor did not accept task"));
        doNothing().when(busyCache).put(eq("user:1"), any(UserIdentity.class));
        UserIdentity alice = stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build());
        when(userStore.findById(1L)).thenReturn(Optional.of(alice));

        // When
        UserIdentity profile = serviceWith(busyCache).getProfile(1L, deadline());

        // Then
        assertEquals(alice, profile);
        verify(busyCache).put("user:1", alice);
        verify(metrics).increment(AuthMetrics.PROFILE_CACHE, "result", "failure", "mode", "SHARED");
    }

    @Test
    void getProfile_returnsProfileWhenExpirySchedulingIsRejected() {
        when(scheduler.schedule(any(Runnable.class), any(Instant.class)))
                .thenThrow(new TaskRejectedException("ExecutorService in shutdown state did not accept task"));
        UserIdentity alice = stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build());
        when(userStore.findById(1L)).thenReturn(Optional.of(alice));

        assertEquals(alice, authService.getProfile(1L, deadline()));
        assertEquals(alice, authService.getProfile(1L, deadline()));

        verify(userStore, times(2)).findById(1L);
    }

    @Test
    void getProfile_unexpectedCacheWriteErrorDoesNotFailRead() {
        ProfileCache brokenCache = mock(ProfileCache.class);
        when(brokenCache.mode()).thenReturn(CacheMode.DEGRADED);
        when(brokenCache.get("user:1")).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("scheduler shut down"))
                .when(brokenCache).put(eq("user:1"), any(UserIdentity.class));
        UserIdentity alice = stored(1L, UserIdentity.builder().username("alice").email("alice@example.com").role("user").build());
        when(userStore.findById(1L)).thenReturn(Optional.of(alice));

        assertEquals(alice, serviceWith(brokenCache).getProfile(1L, deadline()));
    }

    private AuthService serviceWith(ProfileCache profileCache) {
        return new AuthService(userStore, hasher, tokenIssuer, profileCache, userEventPublisher,
                boundedExecutor, metrics, properties);
    }

    private static Deadline deadline() {
        return Deadline.after(Duration.ofSeconds(5));
    }

    private static RegisterCommand alice() {
        return RegisterCommand.builder()
                .username("alice")
                .email("alice@example.com")
                .password("Secret123")
                .build();
    }

    private static UserIdentity stored(long id, UserIdentity identity) {
        return identity.toBuilder()
                .id(id)
                .createdAt(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC))
                .build();
    }
}
