package com.monadarena.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ArenaExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ArenaExceptionHandler.class);

    @ExceptionHandler(ArenaOperationException.class)
    public ResponseEntity<ArenaErrorResponse> handle(ArenaOperationException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new ArenaErrorResponse(ex.getCode(), ex.getMessage(), Map.of()));
    }

    @ExceptionHandler(TransferFailureException.class)
    public ResponseEntity<ArenaErrorResponse> handle(TransferFailureException ex) {
        log.error("Transfer of {} to {} failed, operation rolled back: {}",
                ex.getAmount(), ex.getWalletAddress(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(new ArenaErrorResponse("transfer_failed", ex.getMessage(), Map.of()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ArenaErrorResponse> handle(MethodArgumentNotValidException ex) {
        Map<String, String> fieldErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage())
        );
        String message = fieldErrors.isEmpty()
                ? "Request validation failed"
                : String.join("; ", fieldErrors.values());
        return ResponseEntity.badRequest()
                .body(new ArenaErrorResponse("validation_failed", message, fieldErrors));
    }

    public record ArenaErrorResponse(
            String code,
            String message,
            Map<String, String> fieldErrors
    ) {
    }
}
