package com.didvault.api.error;

import com.didvault.ledger.LedgerUnavailableException;
import com.didvault.registry.RegistryErrorCode;
import com.didvault.registry.RegistryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps registry rejections and request errors to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String LEDGER_UNAVAILABLE = "LEDGER_UNAVAILABLE";

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistryException(RegistryException ex) {
        RegistryErrorCode code = ex.getErrorCode();
        return ResponseEntity.status(statusOf(code))
            .body(ErrorResponse.of(code.name(), code.numericCode(), ex.getMessage()));
    }

    /**
     * Handle bean validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.put(error.getField(), error.getDefaultMessage());
        }
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(VALIDATION_ERROR, null, "Request validation failed", errors));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(VALIDATION_ERROR, null, "Missing header " + ex.getHeaderName()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(VALIDATION_ERROR, null, "Missing parameter " + ex.getParameterName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(VALIDATION_ERROR, null, "Malformed request body"));
    }

    /**
     * Blank principals and over-long reasons rejected by the registry types.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.debug("Rejected request argument: {}", ex.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(VALIDATION_ERROR, null, ex.getMessage()));
    }

    @ExceptionHandler(LedgerUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleLedgerUnavailable(LedgerUnavailableException ex) {
        log.warn("Ledger unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(ErrorResponse.of(LEDGER_UNAVAILABLE, null, "Ledger height unavailable, retry later"));
    }

    static HttpStatus statusOf(RegistryErrorCode code) {
        return switch (code) {
            case NOT_FOUND, NO_PENDING_TRANSFER -> HttpStatus.NOT_FOUND;
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case ALREADY_EXISTS, TRANSFER_IN_PROGRESS, ALREADY_DEACTIVATED,
                 DEACTIVATED, TRANSFER_EXPIRED -> HttpStatus.CONFLICT;
            case MAX_CREDENTIALS, HISTORY_FULL -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SELF_TRANSFER, INVALID_DID_FORMAT, INVALID_CREDENTIAL_FORMAT -> HttpStatus.BAD_REQUEST;
        };
    }
}
