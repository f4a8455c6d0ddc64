package com.flagship.account_service.account.exception;

import lombok.Getter;

import java.util.Map;

/**
 * Raised when an account payload is malformed or incomplete, or when an
 * operation is attempted on an account that was never created.
 *
 * details maps each offending field to a message and may be empty.
 */
@Getter
public class DataValidationException extends RuntimeException {

    private final Map<String, String> details;

    public DataValidationException(String message) {
        this(message, Map.of());
    }

    public DataValidationException(String message, Map<String, String> details) {
        super(message);
        this.details = Map.copyOf(details);
    }

    public DataValidationException(String message, Map<String, String> details, Throwable cause) {
        super(message, cause);
        this.details = Map.copyOf(details);
    }
}
