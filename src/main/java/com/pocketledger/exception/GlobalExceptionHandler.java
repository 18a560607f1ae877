package com.pocketledger.exception;

import com.pocketledger.dto.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Centralized exception mapper for all REST endpoints.
 *
 * EXCEPTION → HTTP STATUS MAPPING:
 *
 * Exception Type                              | HTTP Status | When
 * --------------------------------------------|-------------|--------------------------------------------
 * IllegalArgumentException (+ InvalidReference, InvalidTransfer) | 400 | Bad input, foreign account/category
 * MethodArgumentNotValidException             | 400         | Bean Validation failure on DTO fields
 * malformed body / params / missing file      | 400         | Unreadable JSON, bad enum, bad date
 * AuthenticationException                     | 401         | No authenticated principal
 * SecurityException (AccessDeniedException)   | 403         | Resource belongs to another user
 * NoSuchElementException (ResourceNotFound)   | 404         | No such id
 * IllegalStateException (in use / duplicate)  | 409         | Conflicting state
 * DataIntegrityViolationException             | 409         | Unique/foreign-key constraint outside the engine
 * ObjectOptimisticLockingFailureException     | 409         | Concurrent account edit
 * MaxUploadSizeExceededException              | 413         | Receipt larger than the limit
 * AtomicityFailureException                   | 500         | Ledger mutation rolled back by the store
 * ReceiptStorageException                     | 500         | Object store failure
 * Exception (fallback)                        | 500         | Unexpected system errors
 *
 * RULES:
 * - 4xx messages are passed through to the client
 * - 500 messages are generic; details go to the log only
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    // ─────────────────────────────────────────────────────────────────────────
    // 400 BAD REQUEST: Invalid input
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Guard clause failures, including InvalidReferenceException and
     * InvalidTransferException.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        String code = ex instanceof InvalidReferenceException ? "INVALID_REFERENCE"
                : ex instanceof InvalidTransferException ? "INVALID_TRANSFER"
                : "BAD_REQUEST";
        log.warn("Request rejected ({}): {}", code, ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, code, ex.getMessage());
    }

    /**
     * Returns a field → message map alongside the summary.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> details = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String field = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            details.putIfAbsent(field, error.getDefaultMessage());
        });
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponses.ErrorResponse("VALIDATION_FAILED", "Validation failed", details));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ApiResponses.ErrorResponse> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
                ? "Malformed request body"
                : ex.getMessage();
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", message);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 401 / 403: Authentication and ownership
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleUnauthenticated(AuthenticationException ex) {
        return error(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required");
    }

    /**
     * The resource exists but the caller does not own it.
     */
    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleForbidden(SecurityException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "ACCESS_DENIED", ex.getMessage());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 404 NOT FOUND: Resource does not exist
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNotFound(NoSuchElementException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleNoRoute(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "No such endpoint: /" + ex.getResourcePath());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 409 CONFLICT: State violation
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Account/category still referenced, duplicate category name.
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleIllegalState(IllegalStateException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage());
    }

    /**
     * Constraint violations that slip past the service-level checks, e.g. a
     * posting racing an account deletion or two identical category creates.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.CONFLICT, "CONFLICT",
                "The request conflicts with the current state of the resource");
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleOptimisticLock(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                "The resource was modified concurrently. Reload and retry.");
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleTooLarge(MaxUploadSizeExceededException ex) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "PAYLOAD_TOO_LARGE", "Receipt file is too large");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // 500 INTERNAL SERVER ERROR
    // ─────────────────────────────────────────────────────────────────────────

    @ExceptionHandler(AtomicityFailureException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleAtomicity(AtomicityFailureException ex) {
        log.error("Ledger mutation rolled back: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "The operation could not be completed. No changes were made.");
    }

    @ExceptionHandler(ReceiptStorageException.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleReceiptStorage(ReceiptStorageException ex) {
        log.error("Receipt storage failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "RECEIPT_STORAGE_ERROR",
                "Receipt storage is unavailable. Please try again later.");
    }

    /**
     * Safety net for any unhandled exception.
     * Message is generic; internal detail never reaches clients.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponses.ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred. Please contact support.");
    }

    private static ResponseEntity<ApiResponses.ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiResponses.ErrorResponse(code, message));
    }
}
