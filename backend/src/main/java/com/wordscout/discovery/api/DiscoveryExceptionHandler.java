package com.wordscout.discovery.api;

import com.wordscout.config.InvalidConfigException;
import com.wordscout.discovery.service.ActiveDiscoveryRunException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class DiscoveryExceptionHandler {

    @ExceptionHandler(ActiveDiscoveryRunException.class)
    public ResponseEntity<Map<String, String>> handleActiveRun(ActiveDiscoveryRunException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "active_discovery_run", "message", ex.getMessage()));
    }

    @ExceptionHandler(InvalidConfigException.class)
    public ResponseEntity<Map<String, String>> handleInvalidConfig(InvalidConfigException ex) {
        return ResponseEntity.badRequest()
            .body(Map.of("error", "invalid_config", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
            .body(Map.of("error", "bad_request", "message", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, String>> handleIllegalState(IllegalStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(Map.of("error", "invalid_state", "message", String.valueOf(ex.getMessage())));
    }
}
