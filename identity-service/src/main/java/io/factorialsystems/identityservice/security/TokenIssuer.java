package io.factorialsystems.identityservice.security;

import com.nimbusds.jose.jwk.source.ImmutableSecret;
import io.factorialsystems.identityservice.exception.TokenInvalidException;
import io.factorialsystems.identityservice.model.TokenClaims;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2ErrorCodes;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Issues and verifies HS256-signed bearer tokens under a single shared secret.
 * <p>
 * Tokens are stateless: validity depends only on the signature and the {@code exp} claim, so a
 * token stays valid until it expires even if the user is removed.
 */
@Slf4j
public class TokenIssuer {

    public static final String ROLE_CLAIM = "role";

    private static final int MIN_SECRET_BYTES = 32;

    private final JwtEncoder encoder;
    private final NimbusJwtDecoder decoder;
    private final String issuer;
    private final Clock clock;

    public TokenIssuer(String secret, String issuer, Clock clock) {
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        SecretKey key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
        this.decoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
        this.decoder.setJwtValidator(this::validateExpiry);
        this.issuer = issuer;
        this.clock = clock;
    }

    public String issue(long subject, String role, Duration ttl) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(issuer)
                .subject(String.valueOf(subject))
                .issuedAt(now)
                .expiresAt(now.plus(ttl))
                .claim(ROLE_CLAIM, role)
                .build();
        JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
        return encoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    }

    public TokenClaims verify(String token) {
        Jwt jwt;
        try {
            jwt = decoder.decode(token);
        } catch (JwtException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new TokenInvalidException("invalid token", e);
        }
        try {
            return new TokenClaims(Long.parseLong(jwt.getSubject()), jwt.getClaimAsString(ROLE_CLAIM), jwt.getExpiresAt());
        } catch (NumberFormatException e) {
            throw new TokenInvalidException("invalid token subject", e);
        }
    }

    /**
     * Decoder applying the same signature and expiry rules as {@link #verify(String)}, for
     * Spring Security's resource server.
     */
    public JwtDecoder getJwtDecoder() {
        return decoder;
    }

    private OAuth2TokenValidatorResult validateExpiry(Jwt jwt) {
        Instant expiresAt = jwt.getExpiresAt();
        if (expiresAt == null || !clock.instant().isBefore(expiresAt)) {
            return OAuth2TokenValidatorResult.failure(
                    new OAuth2Error(OAuth2ErrorCodes.INVALID_TOKEN, "token expired", null));
        }
        return OAuth2TokenValidatorResult.success();
    }
}
