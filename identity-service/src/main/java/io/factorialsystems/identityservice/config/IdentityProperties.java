package io.factorialsystems.identityservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Validated
@Component
@ConfigurationProperties(prefix = "identity")
public class IdentityProperties {

    /**
     * Upper bound for a single request, applied to every store and cache call it makes.
     */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * Role assigned when a registration does not name one.
     */
    @NotBlank
    private String defaultRole = "user";

    @Valid
    private Jwt jwt = new Jwt();

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Events events = new Events();

    @Valid
    private Security security = new Security();

    @Getter
    @Setter
    public static class Jwt {
        @NotBlank
        private String secret;
        @NotBlank
        private String issuer = "identity-service";
        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean sharedEnabled = true;
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Events {
        @NotBlank
        private String exchange = "identity.events";
    }

    @Getter
    @Setter
    public static class Security {
        private List<String> allowedOrigins = List.of("*");
        @Min(4)
        @Max(31)
        private int bcryptStrength = 10;
    }
}
