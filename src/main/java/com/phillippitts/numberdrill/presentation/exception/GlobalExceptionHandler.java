package com.phillippitts.numberdrill.presentation.exception;

import com.phillippitts.numberdrill.exception.NumeralOutOfRangeException;
import com.phillippitts.numberdrill.exception.UnsupportedLanguageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Unparseable answers are not errors and never reach this class.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - value cannot be spoken in the requested language (HTTP 400).
     */
    @ExceptionHandler(NumeralOutOfRangeException.class)
    ResponseEntity<ApiError> handleOutOfRange(NumeralOutOfRangeException ex) {
        LOG.warn("Numeral out of range: value={}, language={}", ex.getValue(), ex.getLanguage().code());
        return badRequest(ex.getClass().getSimpleName(), "Value out of range", ex.getMessage());
    }

    /**
     * Client error - unknown language code (HTTP 400).
     */
    @ExceptionHandler(UnsupportedLanguageException.class)
    ResponseEntity<ApiError> handleUnsupportedLanguage(UnsupportedLanguageException ex) {
        LOG.warn("Unsupported language requested: {}", ex.getLanguageCode());
        return badRequest(ex.getClass().getSimpleName(), "Unsupported language", ex.getMessage());
    }

    /**
     * Client error - request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(GlobalExceptionHandler::describe)
                .collect(Collectors.joining(", "));
        LOG.warn("Invalid request body: {}", details);
        return badRequest("ValidationFailed", "Invalid request", details);
    }

    /**
     * Client error - malformed JSON or a path variable of the wrong type (HTTP 400).
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getClass().getSimpleName());
        return badRequest("MalformedRequest", "Malformed request", "Check the request body and parameters");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String errorCode, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(errorCode, message, details, Instant.now()));
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
