package com.biprov.ingestion;

import com.biprov.domain.ProvisionStatus;
import com.biprov.reconcile.ProvisioningError;
import com.biprov.validation.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions escaping the HTTP endpoints to the same error body the event handler
 * produces.
 *
 * Status mapping:
 * - ValidationError, IllegalArgumentException, unreadable body -> 400 validation_error
 * - ProvisioningError -> 502 error
 * - anything else -> 500 error
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationError.class)
    public ResponseEntity<ErrorReport> handleValidation(ValidationError e) {
        return report(HttpStatus.BAD_REQUEST, ProvisionStatus.VALIDATION_ERROR, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorReport> handleIllegalArgument(IllegalArgumentException e) {
        return report(HttpStatus.BAD_REQUEST, ProvisionStatus.VALIDATION_ERROR, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorReport> handleUnreadable(HttpMessageNotReadableException e) {
        return report(HttpStatus.BAD_REQUEST, ProvisionStatus.VALIDATION_ERROR, "payload is not valid JSON");
    }

    @ExceptionHandler(ProvisioningError.class)
    public ResponseEntity<ErrorReport> handleProvisioning(ProvisioningError e) {
        log.warn("Request failed on the BI platform: {}", e.getMessage());
        return report(HttpStatus.BAD_GATEWAY, ProvisionStatus.ERROR, e.getMessage());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorReport> handleUnexpected(RuntimeException e) {
        log.error("Unexpected error handling request", e);
        return report(HttpStatus.INTERNAL_SERVER_ERROR, ProvisionStatus.ERROR, "unexpected error: " + e.getMessage());
    }

    private static ResponseEntity<ErrorReport> report(HttpStatus status, ProvisionStatus outcome, String message) {
        return ResponseEntity.status(status).body(new ErrorReport(outcome, message, null, null, null));
    }
}
