package io.factorialsystems.identityservice.controller;

import io.factorialsystems.identityservice.config.IdentityProperties;
import io.factorialsystems.identityservice.dto.LoginRequest;
import io.factorialsystems.identityservice.dto.RegisterRequest;
import io.factorialsystems.identityservice.dto.TokenResponse;
import io.factorialsystems.identityservice.dto.UserResponse;
import io.factorialsystems.identityservice.model.RegisterCommand;
import io.factorialsystems.identityservice.model.UserIdentity;
import io.factorialsystems.identityservice.service.AuthService;
import io.factorialsystems.identityservice.support.Deadline;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final IdentityProperties properties;

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        log.info("Processing registration for username: {}", request.getUsername());

        RegisterCommand command = RegisterCommand.builder()
                .username(request.getUsername())
                .email(request.getEmail())
                .password(request.getPassword())
                .role(request.getRole())
                .build();

        UserIdentity user = authService.register(command, Deadline.after(properties.getRequestTimeout()));
        return ResponseEntity.created(URI.create("/api/v1/users/" + user.getId()))
                .body(UserResponse.from(user));
    }

    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        String token = authService.login(request.getEmail(), request.getPassword(),
                Deadline.after(properties.getRequestTimeout()));
        return ResponseEntity.status(HttpStatus.OK).body(new TokenResponse(token));
    }
}
