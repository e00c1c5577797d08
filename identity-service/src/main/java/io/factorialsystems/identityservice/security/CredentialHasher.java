package io.factorialsystems.identityservice.security;

import io.factorialsystems.identityservice.exception.HashingFailureException;
import io.factorialsystems.identityservice.exception.VerificationFailureException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.regex.Pattern;

/**
 * One-way, salted password hashing with BCrypt. The cost factor is fixed when the hasher is
 * built; changing it requires a redeploy.
 * <p>
 * BCrypt only reads the first {@value #MAX_PASSWORD_BYTES} bytes of its input, so longer
 * passwords are refused rather than silently truncated.
 */
public class CredentialHasher {

    public static final int MAX_PASSWORD_BYTES = 72;

    private static final Pattern BCRYPT_PATTERN = Pattern.compile("\\A\\$2([ayb])?\\$(\\d\\d)\\$[./0-9A-Za-z]{53}");

    private final BCryptPasswordEncoder encoder;

    public CredentialHasher(int strength) {
        this(strength, new SecureRandom());
    }

    public CredentialHasher(int strength, SecureRandom random) {
        this.encoder = new BCryptPasswordEncoder(strength, random);
    }

    public String hash(String plaintext) {
        if (plaintext == null) {
            throw new HashingFailureException("cannot hash a missing password");
        }
        if (exceedsMaxLength(plaintext)) {
            throw new HashingFailureException("password exceeds " + MAX_PASSWORD_BYTES + " bytes");
        }
        try {
            return encoder.encode(plaintext);
        } catch (RuntimeException e) {
            throw new HashingFailureException("password hashing failed", e);
        }
    }

    /**
     * @return whether {@code plaintext} matches {@code hash}; always {@code false} for a
     *         password longer than {@value #MAX_PASSWORD_BYTES} bytes
     * @throws VerificationFailureException if the stored hash is not a BCrypt hash
     */
    public boolean verify(String plaintext, String hash) {
        if (plaintext == null || hash == null || !BCRYPT_PATTERN.matcher(hash).matches()) {
            throw new VerificationFailureException("credential could not be verified");
        }
        if (exceedsMaxLength(plaintext)) {
            return false;
        }
        try {
            return encoder.matches(plaintext, hash);
        } catch (IllegalArgumentException e) {
            throw new VerificationFailureException("credential could not be verified", e);
        }
    }

    public static boolean exceedsMaxLength(String plaintext) {
        return plaintext.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
