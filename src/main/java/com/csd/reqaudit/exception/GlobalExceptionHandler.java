package com.csd.reqaudit.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, RequirementParseException.class, CatalogueFormatException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, ex);
    }

    @ExceptionHandler(CatalogueUnavailableException.class)
    public ResponseEntity<Map<String, String>> handleCatalogueUnavailable(CatalogueUnavailableException ex) {
        log.warn("Request needs the catalogue: {}", ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex);
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<Map<String, String>> handleFetch(FetchException ex) {
        log.error("Upstream fetch failed: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception ex) {
        log.error("Unhandled error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, Exception ex) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", status.getReasonPhrase());
        body.put("message", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
        return ResponseEntity.status(status).body(body);
    }
}
