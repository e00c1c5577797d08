package io.factorialsystems.identityservice.controller;

import io.factorialsystems.identityservice.config.IdentityProperties;
import io.factorialsystems.identityservice.dto.UserResponse;
import io.factorialsystems.identityservice.service.AuthService;
import io.factorialsystems.identityservice.support.Deadline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final AuthService authService;
    private final IdentityProperties properties;

    /**
     * Get user profile by ID. Requires a valid bearer token.
     */
    @GetMapping("/{id}")
    public ResponseEntity<UserResponse> getUser(@PathVariable("id") long id) {
        log.debug("Getting profile for user: {}", id);
        return ResponseEntity.ok(UserResponse.from(
                authService.getProfile(id, Deadline.after(properties.getRequestTimeout()))));
    }
}
