package com.flagship.account_service.account.exception;

import com.flagship.account_service.observability.LogContext;
import jakarta.servlet.ServletException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

/**
 * Global exception handler for REST API.
 *
 * Client errors are reported with their cause; server faults are logged and
 * answered with a generic message that leaks no internal detail.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(DataValidationException.class)
    public ResponseEntity<ApiError> handleDataValidation(DataValidationException e) {
        log.warn("Validation failed: {} {}", e.getMessage(), e.getDetails());
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(AccountNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(AccountNotFoundException e) {
        log.warn("Account not found: id={}", e.getAccountId());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ApiError> handleUnsupportedMediaType(HttpMediaTypeNotSupportedException e) {
        log.warn("Unsupported media type: {}", e.getContentType());
        String message = "Content-Type must be application/json";
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", message, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        String message = "Invalid Account: body of request contained bad or no data";
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", message, null);
    }

    // Path ids are integers; anything else names no account
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid path variable {}={}", e.getName(), e.getValue());
        String message = "Account with id [" + e.getValue() + "] could not be found.";
        return respond(HttpStatus.NOT_FOUND, "Not Found", message, null);
    }

    /**
     * Framework conditions that already carry a status (unknown route, unsupported method).
     * Only the status reason reaches the client.
     */
    @ExceptionHandler(ServletException.class)
    public ResponseEntity<ApiError> handleServletException(ServletException e) {
        if (e instanceof ErrorResponse errorResponse) {
            return respondWithFrameworkStatus(errorResponse.getStatusCode(), e);
        }
        return handleGenericException(e);
    }

    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ApiError> handleErrorResponse(ErrorResponseException e) {
        return respondWithFrameworkStatus(e.getStatusCode(), e);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respondWithFrameworkStatus(HttpStatusCode statusCode, Exception e) {
        HttpStatus status = HttpStatus.resolve(statusCode.value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("Request rejected with {}: {}", status.value(), e.getMessage());
        return respond(status, status.getReasonPhrase(), status.getReasonPhrase(), null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .correlationId(LogContext.correlationId())
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(status).body(body);
    }
}
