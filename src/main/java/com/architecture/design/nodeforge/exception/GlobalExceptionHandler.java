package com.architecture.design.nodeforge.exception;

import com.architecture.design.nodeforge.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Maps request and theme configuration failures to 400 responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ThemeConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleThemeConfiguration(ThemeConfigurationException e) {
        log.warn("Rejected theme configuration: {}", e.getMessage());
        return badRequest("Invalid theme configuration", e.getMessage(), List.of());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        log.warn("Rejected conversion request: {}", details);
        return badRequest("Validation failed", "Request body is invalid", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable conversion request: {}", e.getMostSpecificCause().getMessage());
        return badRequest("Malformed request", e.getMostSpecificCause().getMessage(), List.of());
    }

    private ResponseEntity<ErrorResponse> badRequest(String error, String message, List<String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(error)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.badRequest().body(body);
    }
}
