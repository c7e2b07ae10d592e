package com.sapa.speakers.controller;

import com.sapa.speakers.exception.DataIntegrityException;
import com.sapa.speakers.exception.NotionConfigurationException;
import com.sapa.speakers.exception.RemoteServiceException;
import com.sapa.speakers.exception.SpeakerNotFoundException;
import com.sapa.speakers.exception.SpeakerValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps speaker tracker failures and request binding problems to HTTP statuses with a small
 * JSON body: {@code error} is a stable code, {@code message} is for humans.
 */
@RestControllerAdvice
public class GlobalErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        List<Map<String, Object>> errors = ex.getFieldErrors().stream().map(err -> {
            Map<String, Object> e = new HashMap<>();
            e.put("field", err.getField());
            e.put("code", err.getCode());
            e.put("message", err.getDefaultMessage());
            return e;
        }).collect(Collectors.toList());
        log.warn("Request binding failed: {}", errors);
        Map<String, Object> body = new HashMap<>();
        body.put("error", "bad_request");
        body.put("details", errors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInput(ServerWebInputException ex) {
        log.warn("Input error: {}", ex.getReason());
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getReason());
    }

    @ExceptionHandler(SpeakerValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(SpeakerValidationException ex) {
        log.warn("Rejected speaker input field={}: {}", ex.getField(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage());
        response.getBody().put("field", ex.getField());
        return response;
    }

    @ExceptionHandler(SpeakerNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(SpeakerNotFoundException ex) {
        log.debug("Speaker not found: {}", ex.getSpeakerId());
        return body(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(DataIntegrityException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(DataIntegrityException ex) {
        log.warn("Unusable Notion record: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, "data_integrity", ex.getMessage());
    }

    @ExceptionHandler(RemoteServiceException.class)
    public ResponseEntity<Map<String, Object>> handleRemote(RemoteServiceException ex) {
        log.warn("Notion call failed status={} code={}: {}", ex.getStatus(), ex.getCode(), ex.getMessage());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.BAD_GATEWAY, "remote_error", ex.getMessage());
        if (ex.getCode() != null) response.getBody().put("remote_code", ex.getCode());
        return response;
    }

    @ExceptionHandler(NotionConfigurationException.class)
    public ResponseEntity<Map<String, Object>> handleConfiguration(NotionConfigurationException ex) {
        log.error("Notion is not configured: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "not_configured", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleOther(Exception ex) {
        log.warn("Unhandled error: {}", ex.toString());
        ResponseEntity<Map<String, Object>> response = body(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", ex.getMessage());
        response.getBody().put("exception", ex.getClass().getSimpleName());
        return response;
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
