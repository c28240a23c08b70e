package org.kingstonaccess.service.controller;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.exception.ApiException;
import org.kingstonaccess.service.exception.DatasetUnavailableException;
import org.kingstonaccess.service.exception.InvalidRequestException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * Maps failures to {@code {"detail": ...}} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidRequestException ex) {
        return detail(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, String>> handleMissingParameter(MissingServletRequestParameterException ex) {
        return detail(HttpStatus.BAD_REQUEST, "missing parameter: " + ex.getParameterName());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, String>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return detail(HttpStatus.BAD_REQUEST, "invalid value for parameter: " + ex.getName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return detail(HttpStatus.BAD_REQUEST, "malformed request body");
    }

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, String>> handleDownstream(ApiException ex) {
        log.warn("Geocoding request failed: {}", ex.getMessage());
        return detail(HttpStatus.BAD_GATEWAY, "geocoding request failed: " + ex.getMessage());
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ResponseEntity<Map<String, String>> handleOpenCircuit(CallNotPermittedException ex) {
        log.warn("Geocoding circuit open: {}", ex.getMessage());
        return detail(HttpStatus.BAD_GATEWAY, "geocoding request failed: " + ex.getMessage());
    }

    @ExceptionHandler(DatasetUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleDatasetUnavailable(DatasetUnavailableException ex) {
        return detail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message == null ? status.getReasonPhrase() : message));
    }
}
