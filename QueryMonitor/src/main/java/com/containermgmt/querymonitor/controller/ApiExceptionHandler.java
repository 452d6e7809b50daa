package com.containermgmt.querymonitor.controller;

import com.containermgmt.querymonitor.dto.ApiError;
import com.containermgmt.querymonitor.exception.ConnectivityException;
import com.containermgmt.querymonitor.exception.ExtensionMissingException;
import com.containermgmt.querymonitor.exception.KillException;
import com.containermgmt.querymonitor.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps service exceptions to {error, message} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> notFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(ExtensionMissingException.class)
    public ResponseEntity<ApiError> extensionMissing(ExtensionMissingException e) {
        return error(HttpStatus.BAD_REQUEST, "extension_missing", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> invalid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<ApiError> connectivity(ConnectivityException e) {
        log.warn("Database unreachable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "connectivity", e.getMessage());
    }

    @ExceptionHandler(KillException.class)
    public ResponseEntity<ApiError> kill(KillException e) {
        return error(HttpStatus.CONFLICT, "kill_failed", e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message));
    }
}
