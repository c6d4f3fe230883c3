package com.notevault.backup.api;

import com.notevault.backup.service.BackupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps failures to {@code {"ok": false, "error": "..."}} bodies.
 *
 * VALIDATION → 400, CONFLICT → 409, STORE and IO → 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(BackupException.class)
    public ResponseEntity<Map<String, Object>> handleBackup(BackupException e) {
        HttpStatus status = switch (e.getKind()) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFLICT   -> HttpStatus.CONFLICT;
            case STORE, IO  -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(body(e.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleRSE(ResponseStatusException e) {
        String reason = e.getReason() != null ? e.getReason() : e.getStatusCode().toString();
        return ResponseEntity.status(e.getStatusCode()).body(body(reason));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(Exception e) {
        return body(e.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Map<String, Object> handleTooLarge(MaxUploadSizeExceededException e) {
        return body("Backup file is too large");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception e) {
        log.error("Unhandled error", e);
        return body(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }

    private static Map<String, Object> body(String error) {
        return Map.of("ok", false, "error", error != null ? error : "");
    }
}
