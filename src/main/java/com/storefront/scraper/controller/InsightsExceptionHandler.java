package com.storefront.scraper.controller;

import com.storefront.scraper.service.StorefrontNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps failures of an insights run onto HTTP responses with a
 * {@code {"detail": "..."}} body.
 */
@Slf4j
@RestControllerAdvice
public class InsightsExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(final MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request.");
        log.warn("Invalid request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("detail", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(final HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(Map.of("detail", "Malformed request body."));
    }

    @ExceptionHandler(StorefrontNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(final StorefrontNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(Map.of("detail", "Website not found or no products available."));
    }

    /**
     * Everything else is a 500, except Spring MVC's own errors (unsupported
     * method, unknown path, wrong media type...), which keep their status.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(final Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            String detail = StringUtils.defaultIfBlank(framework.getBody().getDetail(),
                    framework.getBody().getTitle());
            log.warn("Request rejected with {}: {}", framework.getStatusCode().value(), ex.getMessage());
            return ResponseEntity.status(framework.getStatusCode())
                    .headers(framework.getHeaders())
                    .body(Map.of("detail", StringUtils.defaultString(detail)));
        }
        log.error("Internal error while fetching insights", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("detail", "Internal server error. Please try again later."));
    }
}
