package com.herzen.dropout.api;

import com.herzen.dropout.event.OrderingViolationException;
import com.herzen.dropout.scoring.InvalidFeatureStateException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(OrderingViolationException.class)
    public ResponseEntity<Map<String, Object>> orderingViolation(OrderingViolationException ex) {
        return error(HttpStatus.CONFLICT, "ordering_violation", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> invalidRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(InvalidFeatureStateException.class)
    public ResponseEntity<Map<String, Object>> invalidFeatureState(InvalidFeatureStateException ex) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "invalid_feature_state", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("details", details);
        return new ResponseEntity<>(body, status);
    }
}
