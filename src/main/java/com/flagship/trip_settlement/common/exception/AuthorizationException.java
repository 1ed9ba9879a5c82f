package com.flagship.trip_settlement.common.exception;

/**
 * Raised by the access-control collaborator when the caller may not perform an action.
 * The settlement core only propagates it.
 */
public class AuthorizationException extends RuntimeException {

    public AuthorizationException(String message) {
        super(message);
    }
}
