package io.factorialsystems.identityservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans: the application {@link Clock}.
 */
@Configuration
public class ApplicationConfig {

    /**
     * Time source for token expiry and in-memory cache expiry.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
