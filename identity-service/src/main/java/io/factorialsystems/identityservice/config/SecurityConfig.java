package io.factorialsystems.identityservice.config;

import io.factorialsystems.identityservice.security.CredentialHasher;
import io.factorialsystems.identityservice.security.TokenIssuer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.time.Clock;
import java.util.List;

import static org.springframework.security.config.Customizer.withDefaults;

@Slf4j
@Configuration
public class SecurityConfig {

	@Bean
	SecurityFilterChain apiSecurityFilterChain(HttpSecurity http) throws Exception {
		http
			.cors(withDefaults())
			.csrf(AbstractHttpConfigurer::disable) // Stateless bearer-token API
			.sessionManagement((session) -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
			.authorizeHttpRequests((authorize) -> authorize
				.requestMatchers(HttpMethod.POST, "/api/v1/auth/register", "/api/v1/auth/login").permitAll()
				.requestMatchers("/actuator/health", "/actuator/prometheus", "/error").permitAll()
				.anyRequest().authenticated()
			)
			.oauth2ResourceServer((resourceServer) -> resourceServer
				.jwt(withDefaults())
			)
			.exceptionHandling((exceptions) -> exceptions
				.authenticationEntryPoint((request, response, authException) -> {
					response.setStatus(HttpStatus.UNAUTHORIZED.value());
					response.setContentType(MediaType.APPLICATION_JSON_VALUE);
					response.getWriter().write("{\"error\":\"unauthorized\"}");
				})
			);
		return http.build();
	}

	@Bean
	public CredentialHasher credentialHasher(IdentityProperties properties) {
		int strength = properties.getSecurity().getBcryptStrength();
		log.info("Configured BCrypt credential hasher with strength: {}", strength);
		return new CredentialHasher(strength);
	}

	@Bean
	public TokenIssuer tokenIssuer(IdentityProperties properties, Clock clock) {
		IdentityProperties.Jwt jwt = properties.getJwt();
		return new TokenIssuer(jwt.getSecret(), jwt.getIssuer(), clock);
	}

	/**
	 * Bearer tokens on protected routes are checked by the same decoder that verifies issued
	 * tokens.
	 */
	@Bean
	public JwtDecoder jwtDecoder(TokenIssuer tokenIssuer) {
		return tokenIssuer.getJwtDecoder();
	}

	@Bean
	public CorsConfigurationSource corsConfigurationSource(IdentityProperties properties) {
		log.info("Configuring CORS for identity service");

		CorsConfiguration configuration = new CorsConfiguration();
		configuration.setAllowedOriginPatterns(properties.getSecurity().getAllowedOrigins());
		configuration.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
		configuration.setAllowedHeaders(List.of("*"));
		configuration.setExposedHeaders(List.of("Authorization", "Content-Type", "Location"));

		UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
		source.registerCorsConfiguration("/**", configuration);
		return source;
	}
}
