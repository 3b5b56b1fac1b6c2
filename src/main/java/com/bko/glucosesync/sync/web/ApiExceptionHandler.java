package com.bko.glucosesync.sync.web;

import com.bko.glucosesync.shared.ErrorKind;
import com.bko.glucosesync.shared.GlucoseApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GlucoseApiException.class)
    public ResponseEntity<Map<String, Object>> handleGlucoseApi(GlucoseApiException e) {
        HttpStatus status = statusFor(e.getKind());
        logger.warn("Request failed with {}: {}", e.getKind(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of(
                "kind", e.getKind().name(),
                "message", e.userMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(IOException e) {
        logger.error("Request failed.", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of(
                "kind", ErrorKind.TRANSPORT_FAILURE.name(),
                "message", ErrorKind.TRANSPORT_FAILURE.userMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("message", String.valueOf(e.getMessage())));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        if (kind.requiresReauthentication()) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (kind == ErrorKind.NO_DATA_AVAILABLE) {
            return HttpStatus.NOT_FOUND;
        }
        if (kind.category() == ErrorKind.Category.VALIDATION) {
            return HttpStatus.BAD_REQUEST;
        }
        if (kind.isRetryable()) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_GATEWAY;
    }
}
