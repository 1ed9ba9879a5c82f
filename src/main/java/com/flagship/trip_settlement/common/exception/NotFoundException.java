package com.flagship.trip_settlement.common.exception;

/**
 * Referenced trip, expense or settlement does not exist (or is not visible to the caller).
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException trip(Object tripId) {
        return new NotFoundException("Trip not found: " + tripId);
    }

    public static NotFoundException settlement(Object settlementId) {
        return new NotFoundException("Settlement not found: " + settlementId);
    }
}
