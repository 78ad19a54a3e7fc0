package com.chimera.dispatch.api;

import com.chimera.core.engine.AdversaryNotFoundException;
import com.chimera.core.engine.IllegalOperationStateException;
import com.chimera.core.engine.OperationNotFoundException;
import com.chimera.core.persistence.JournalException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP status codes for every REST endpoint.
 */
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalApiExceptionHandler.class);

    @ExceptionHandler({OperationNotFoundException.class, AdversaryNotFoundException.class})
    public ResponseEntity<Map<String, String>> handleNotFound(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler(IllegalOperationStateException.class)
    public ResponseEntity<Map<String, String>> handleConflict(IllegalOperationStateException ex,
                                                              HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ex, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(JournalException.class)
    public ResponseEntity<Map<String, String>> handleJournal(JournalException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={} method={}: journal unavailable", request.getRequestURI(), request.getMethod(), ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(body(HttpStatus.SERVICE_UNAVAILABLE, "Journal unavailable: " + ex.getMessage()));
    }

    private ResponseEntity<Map<String, String>> respond(HttpStatus status, Exception ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR path={} method={} status={} errorType={} message={}",
                request.getRequestURI(), request.getMethod(), status.value(),
                ex.getClass().getSimpleName(), truncate(ex.getMessage(), 300));
        return ResponseEntity.status(status).body(body(status, truncate(ex.getMessage(), 300)));
    }

    private static Map<String, String> body(HttpStatus status, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", String.valueOf(status.value()));
        body.put("error", message == null ? status.getReasonPhrase() : message);
        return body;
    }

    private static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
