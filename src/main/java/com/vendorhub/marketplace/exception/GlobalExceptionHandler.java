package com.vendorhub.marketplace.exception;

import com.vendorhub.marketplace.config.CorrelationIdFilter;
import com.vendorhub.marketplace.modules.image.exception.ImageOperationException;
import com.vendorhub.marketplace.service.storage.StorageErrorCode;
import com.vendorhub.marketplace.service.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler that produces clean, safe error responses.
 * Stack traces are NEVER exposed in response bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Ownership, lookup and position failures from the image service.
     */
    @ExceptionHandler(ImageOperationException.class)
    public ResponseEntity<Map<String, Object>> handleImageOperation(ImageOperationException ex) {
        HttpStatus status = ex.getErrorCode().getStatus();
        log.warn("Image operation rejected: {} ({})", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status)
                .body(body(status, ex.getErrorCode().name(), ex.getMessage()));
    }

    /**
     * Storage failures. Client-side problems (size, type, reference) keep
     * their message; backend failures are reported generically.
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException ex) {
        StorageErrorCode code = ex.getErrorCode();
        HttpStatus status = code.getStatus();

        String message;
        if (status.is5xxServerError()) {
            log.error("Storage failure [{}] [correlationId={}]: {}",
                    code, MDC.get(CorrelationIdFilter.MDC_KEY), ex.getMessage(), ex);
            message = code == StorageErrorCode.TIMEOUT
                    ? "image storage timed out, please retry"
                    : "image storage is unavailable, please retry";
        } else {
            log.warn("Storage request rejected: {} ({})", code, ex.getMessage());
            message = ex.getMessage();
        }

        return ResponseEntity.status(status).body(body(status, code.name(), message));
    }

    /**
     * Handles bean-validation failures (e.g. @Valid on @RequestBody).
     * Returns 400 with a list of field-level errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<Map<String, String>> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(fe -> {
                    Map<String, String> error = new HashMap<>();
                    error.put("field", fe.getField());
                    error.put("message", fe.getDefaultMessage());
                    return error;
                })
                .toList();

        Map<String, Object> body = body(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Validation Failed");
        body.put("fieldErrors", fieldErrors);

        log.warn("Validation failed: {} field error(s)", fieldErrors.size());

        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<Map<String, Object>> handleMissingPart(MissingServletRequestPartException ex) {
        String message = "image".equals(ex.getRequestPartName())
                ? "image file is required"
                : ex.getRequestPartName() + " is required";
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message));
    }

    @ExceptionHandler({ MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        String message = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? "invalid value for " + mismatch.getName()
                : "invalid request";
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message));
    }

    /**
     * Multipart bodies beyond the container limit never reach the storage
     * layer; report them like an oversized image.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException ex) {
        log.warn("Multipart upload rejected by container limit: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST,
                StorageErrorCode.SIZE_EXCEEDED.name(), "file size exceeds maximum allowed size"));
    }

    /**
     * Catch-all handler for unhandled exceptions.
     * Returns 500 with correlation ID, never exposes stack traces.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {

        String correlationId = MDC.get(CorrelationIdFilter.MDC_KEY);
        log.error("Unhandled exception [correlationId={}]: {}", correlationId, ex.getMessage(), ex);

        Map<String, Object> body = body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "An unexpected error occurred. Please reference correlationId for support.");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static Map<String, Object> body(HttpStatus status, String code, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("code", code);
        body.put("message", message);
        body.put("correlationId", MDC.get(CorrelationIdFilter.MDC_KEY));
        return body;
    }
}
