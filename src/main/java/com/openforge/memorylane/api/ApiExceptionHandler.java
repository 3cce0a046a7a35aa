package com.openforge.memorylane.api;

import com.openforge.memorylane.embedding.EmbeddingClient.EmbeddingDimensionMismatchException;
import com.openforge.memorylane.memory.MemoryStore.MemoryNotFoundException;
import com.openforge.memorylane.session.SessionSource.SessionNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps domain exceptions to HTTP status codes:
 *   unknown session / memory    → 404
 *   invalid argument or body    → 400
 *   embedding dimension mismatch → 500 (configuration error, never masked)
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler({SessionNotFoundException.class, MemoryNotFoundException.class})
    public ResponseEntity<Map<String, Object>> handleNotFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
    }

    @ExceptionHandler(EmbeddingDimensionMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleDimensionMismatch(EmbeddingDimensionMismatchException e) {
        log.error("[Api] {}", e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "EMBEDDING_DIMENSION_MISMATCH", e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("code", code);
        error.put("message", message);
        return ResponseEntity.status(status).body(Map.of("error", error));
    }
}
