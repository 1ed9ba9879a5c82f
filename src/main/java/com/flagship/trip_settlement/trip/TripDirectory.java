package com.flagship.trip_settlement.trip;

import com.flagship.trip_settlement.fx.CurrencyCode;

import java.util.Optional;
import java.util.UUID;

/**
 * Lookup of trip-level settings owned by the trip service.
 */
public interface TripDirectory {

    /**
     * @return the trip's base currency, or empty if the trip does not exist
     */
    Optional<CurrencyCode> findBaseCurrency(UUID tripId);
}
