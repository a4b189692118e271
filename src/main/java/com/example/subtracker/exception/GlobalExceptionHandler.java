package com.example.subtracker.exception;

import com.example.subtracker.dto.ErrorResponse;
import com.example.subtracker.util.Constants;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthenticatedRequestException.class)
    public ResponseEntity<ErrorResponse> handleUnauthenticatedRequest(
            UnauthenticatedRequestException ex, HttpServletRequest request) {
        return error(HttpStatus.FORBIDDEN, "Forbidden", ex.getMessage(), request);
    }

    @ExceptionHandler(AuthException.class)
    public ResponseEntity<ErrorResponse> handleAuthException(
            AuthException ex, HttpServletRequest request) {
        log.warn("Authorization error: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, Constants.ErrorMessages.AUTHORIZATION_FAILED, ex.getMessage(), request);
    }

    @ExceptionHandler(IdentityException.class)
    public ResponseEntity<ErrorResponse> handleIdentityException(
            IdentityException ex, HttpServletRequest request) {
        log.warn("Identity lookup failed: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, Constants.ErrorMessages.IDENTITY_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(GifterNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleGifterNotFound(
            GifterNotFoundException ex, HttpServletRequest request) {
        log.warn("Gifter not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, Constants.ErrorMessages.GIFTER_NOT_FOUND, ex.getMessage(), request);
    }

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<ErrorResponse> handleSchemaException(
            SchemaException ex, HttpServletRequest request) {
        log.error("Ledger schema error: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, Constants.ErrorMessages.SCHEMA_MISMATCH, ex.getMessage(), request);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailable(
            UpstreamUnavailableException ex, HttpServletRequest request) {
        log.error("Upstream unavailable: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, Constants.ErrorMessages.UPSTREAM_UNAVAILABLE, ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String errors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return error(HttpStatus.BAD_REQUEST, "Validation error", errors, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Illegal argument: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad request", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Bad request", "Malformed request body", request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        log.warn("Missing request parameter: {}", ex.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "Bad request",
                "Missing required parameter: " + ex.getParameterName(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(
            Exception ex, HttpServletRequest request) {
        log.error("Unexpected exception: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
                Constants.ErrorMessages.UNEXPECTED_ERROR, request);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message,
                                                HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                error,
                message,
                LocalDateTime.now(),
                request.getRequestURI(),
                MDC.get(Constants.Mdc.CORRELATION_ID)
        );
        return ResponseEntity.status(status).body(response);
    }
}
