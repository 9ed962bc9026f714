package com.rtops.api;

import com.rtops.catalog.CatalogStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps catalog failures to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CatalogStoreException.class)
    public ResponseEntity<Map<String, Object>> handleCatalogStoreException(CatalogStoreException e) {
        log.error("Catalog unavailable: {}", e.getMessage(), e);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "CATALOG_UNAVAILABLE");
        body.put("message", "Catalog storage is unavailable; the import was not completed");
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
