package org.dcbpoker.common;

import lombok.extern.slf4j.Slf4j;
import org.dcbpoker.dto.ApiResponse;
import org.dcbpoker.service.poker.PokerRuleException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps service exceptions to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /** Unknown table, malformed card notation and the like. */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Object>> invalid(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .findFirst().orElse("Requête invalide");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(msg));
    }

    /** Rule violation: wrong turn, illegal sizing, full table. The table is unchanged. */
    @ExceptionHandler(PokerRuleException.class)
    public ResponseEntity<ApiResponse<Object>> rule(PokerRuleException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage(),
                Map.of("error", e.getError().name(), "category", e.getError().getCategory().name())));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        log.warn("Conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage(), null));
    }
}
