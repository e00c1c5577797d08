package io.factorialsystems.identityservice.dto;

public record TokenResponse(String token) {
}
