package com.govsync.api;

import com.govsync.bus.GovernanceLogNotFoundException;
import com.govsync.contract.GovernanceImportException;
import com.govsync.contract.ImportValidationException;
import com.govsync.importer.DuplicateImportException;
import com.govsync.importer.PreconditionViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified failure body:
 * {@code {"success": false, "error": {"kind", "message", "field", "value"}, "payloadHash", "timestamp"}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(GovernanceImportException.class)
    public ResponseEntity<Map<String, Object>> handleImportFailure(GovernanceImportException ex) {
        HttpStatus status = statusFor(ex);
        if (status.is5xxServerError()) {
            log.error("Import failed ({}): {}", ex.kind(), ex.getMessage(), ex);
        } else {
            log.warn("Import rejected ({}): {}", ex.kind(), ex.getMessage());
        }
        String field = null;
        String value = null;
        if (ex instanceof ImportValidationException validation) {
            field = validation.getField();
            value = validation.getValue();
        } else if (ex instanceof PreconditionViolationException precondition) {
            field = precondition.getField();
            value = precondition.getValue();
        }
        return ResponseEntity.status(status)
            .body(errorResponse(ex.kind(), ex.getMessage(), field, value, ex.getPayloadHash()));
    }

    @ExceptionHandler(GovernanceLogNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(GovernanceLogNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(errorResponse("not-found", ex.getMessage(), "id", ex.getLogId(), null));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    public ResponseEntity<Map<String, Object>> handleParseErrors(Exception ex) {
        return ResponseEntity.badRequest()
            .body(errorResponse("validation", "request format is invalid: " + ex.getMessage(), null, null, null));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
            .body(errorResponse("validation", ex.getMessage(), null, null, null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorResponse("internal", "an unexpected error occurred", null, null, null));
    }

    static HttpStatus statusFor(GovernanceImportException ex) {
        if (ex instanceof ImportValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (ex instanceof DuplicateImportException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof PreconditionViolationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private Map<String, Object> errorResponse(String kind, String message, String field, String value,
                                              String payloadHash) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", kind);
        error.put("message", message);
        if (field != null) {
            error.put("field", field);
        }
        if (value != null) {
            error.put("value", value);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", error);
        if (payloadHash != null) {
            body.put("payloadHash", payloadHash);
        }
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
