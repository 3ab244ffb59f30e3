package com.legal.consult.controller;

import com.legal.consult.exception.ConcurrentTurnException;
import com.legal.consult.exception.CredentialException;
import com.legal.consult.exception.InvalidRequestException;
import com.legal.consult.exception.NotFoundException;
import com.legal.consult.exception.PersistenceException;
import com.legal.consult.exception.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to {@code {error, status, timestamp}} bodies. Provider and credential
 * failures also carry a user-facing {@code reply} so a chat client has something to show.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @Value("${ai.fallback-reply:I apologize, but I encountered an error processing your message. Please try again.}")
    private String fallbackReply;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.toList());
        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "Validation error");
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Malformed request body"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "Invalid value for parameter: " + ex.getName()));
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(InvalidRequestException ex) {
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body(HttpStatus.NOT_FOUND, ex.getMessage()));
    }

    @ExceptionHandler(CredentialException.class)
    public ResponseEntity<Map<String, Object>> handleCredential(CredentialException ex) {
        log.error("Credential error: {}", ex.getMessage());
        Map<String, Object> body = body(HttpStatus.SERVICE_UNAVAILABLE, "AI provider is not configured");
        body.put("reply", fallbackReply);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProvider(ProviderException ex) {
        log.error("Provider error: {}", ex.getMessage(), ex);
        Map<String, Object> body = body(HttpStatus.BAD_GATEWAY, "AI provider error");
        body.put("provider", ex.getProvider().key());
        body.put("reply", fallbackReply);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ConcurrentTurnException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrent(ConcurrentTurnException ex) {
        log.warn(ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body(HttpStatus.CONFLICT, ex.getMessage()));
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(PersistenceException ex) {
        log.error("Persistence error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    /** Framework errors keep their own status (404, 405, 415...); anything else is a 500. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse) {
            HttpStatusCode code = ((ErrorResponse) ex).getStatusCode();
            HttpStatus status = HttpStatus.resolve(code.value());
            String error = status != null ? status.getReasonPhrase() : "Request failed";
            return ResponseEntity.status(code).body(body(code.value(), error));
        }
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private static Map<String, Object> body(HttpStatus status, String error) {
        return body(status.value(), error);
    }

    private static Map<String, Object> body(int status, String error) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("status", status);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
