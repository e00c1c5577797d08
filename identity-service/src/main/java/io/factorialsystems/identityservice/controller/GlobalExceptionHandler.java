package io.factorialsystems.identityservice.controller;

import io.factorialsystems.identityservice.dto.ErrorResponse;
import io.factorialsystems.identityservice.exception.DuplicateEmailException;
import io.factorialsystems.identityservice.exception.EmptyCredentialException;
import io.factorialsystems.identityservice.exception.IdentityServiceException;
import io.factorialsystems.identityservice.exception.InvalidCredentialsException;
import io.factorialsystems.identityservice.exception.OperationTimeoutException;
import io.factorialsystems.identityservice.exception.PasswordTooLongException;
import io.factorialsystems.identityservice.exception.UserNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps service failures to HTTP responses. Internal failures get a generic message; details
 * stay in the log.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.debug("Validation failed: {}", fields);
        return ResponseEntity.badRequest().body(new ErrorResponse("validation failed", fields));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of("invalid " + ex.getName()));
    }

    @ExceptionHandler(EmptyCredentialException.class)
    public ResponseEntity<ErrorResponse> handleEmptyCredential(EmptyCredentialException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(PasswordTooLongException.class)
    public ResponseEntity<ErrorResponse> handlePasswordTooLong(PasswordTooLongException ex) {
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(DuplicateEmailException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateEmail(DuplicateEmailException ex) {
        log.info("Registration rejected, email already in use");
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentials(InvalidCredentialsException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of(InvalidCredentialsException.MESSAGE));
    }

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(UserNotFoundException ex) {
        log.debug("User not found with ID: {}", ex.getUserId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("user not found"));
    }

    @ExceptionHandler(OperationTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(OperationTimeoutException ex) {
        log.warn("Request timed out during {}", ex.getOperation());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorResponse.of("request timed out"));
    }

    @ExceptionHandler(IdentityServiceException.class)
    public ResponseEntity<ErrorResponse> handleInternal(IdentityServiceException ex) {
        log.error("Request failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of("internal server error"));
    }
}
