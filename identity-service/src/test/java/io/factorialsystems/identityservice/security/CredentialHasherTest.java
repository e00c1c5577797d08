package io.factorialsystems.identityservice.security;

import io.factorialsystems.identityservice.exception.HashingFailureException;
import io.factorialsystems.identityservice.exception.VerificationFailureException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CredentialHasherTest {

    private final CredentialHasher hasher = new CredentialHasher(4);

    @Test
    void verify_acceptsOriginalPassword() {
        String hash = hasher.hash("Secret123");

        assertTrue(hasher.verify("Secret123", hash));
    }

    @Test
    void verify_rejectsDifferentPassword() {
        String hash = hasher.hash("Secret123");

        assertFalse(hasher.verify("wrong", hash));
        assertFalse(hasher.verify("secret123", hash));
    }

    @Test
    void hash_isSaltedAndUsesConfiguredCost() {
        String first = hasher.hash("Secret123");
        String second = hasher.hash("Secret123");

        assertNotEquals(first, second);
        assertTrue(first.startsWith("$2a$04$"), "unexpected hash prefix: " + first.substring(0, 7));
        assertFalse(first.contains("Secret123"));
    }

    @Test
    void hash_failsOnMissingPassword() {
        assertThrows(HashingFailureException.class, () -> hasher.hash(null));
    }

    @Test
    void verify_failsOnMalformedHash() {
        VerificationFailureException notBcrypt = assertThrows(VerificationFailureException.class,
                () -> hasher.verify("Secret123", "plain-text-password"));
        assertThrows(VerificationFailureException.class, () -> hasher.verify("Secret123", ""));
        assertThrows(VerificationFailureException.class, () -> hasher.verify("Secret123", null));

        assertEquals("credential could not be verified", notBcrypt.getMessage());
    }

    @Test
    void verify_failureMessageDoesNotRevealWhichInputWasWrong() {
        String hash = hasher.hash("Secret123");

        VerificationFailureException missingPassword = assertThrows(VerificationFailureException.class,
                () -> hasher.verify(null, hash));
        VerificationFailureException badHash = assertThrows(VerificationFailureException.class,
                () -> hasher.verify("Secret123", "garbage"));

        assertEquals(missingPassword.getMessage(), badHash.getMessage());
    }

    @Test
    void hash_rejectsPasswordLongerThan72Bytes() {
        // 36 two-byte characters plus one more byte
        String tooLong = "é".repeat(36) + "A";

        assertThrows(HashingFailureException.class, () -> hasher.hash(tooLong));
    }

    @Test
    void hash_acceptsMultiBytePasswordOfExactly72Bytes() {
        String password = "é".repeat(36);

        assertTrue(hasher.verify(password, hasher.hash(password)));
    }

    @Test
    void verify_passwordsSharingFirst72BytesDoNotCrossVerify() {
        String stored = "é".repeat(36);
        String hash = hasher.hash(stored);

        assertFalse(hasher.verify(stored + "B", hash));
        assertFalse(hasher.verify(stored + "A", hash));
        assertTrue(hasher.verify(stored, hash));
    }
}
