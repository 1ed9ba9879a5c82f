package com.flagship.trip_settlement.common.exception;

/**
 * Raised when caller input breaks a business rule (split values not matching the total,
 * empty participant list, non-positive amounts).
 * Mapped to 400 by the REST layer.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
