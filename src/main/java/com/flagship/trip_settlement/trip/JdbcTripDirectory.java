package com.flagship.trip_settlement.trip;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcTripDirectory implements TripDirectory {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Empty when the trip does not exist or its stored base currency is not an ISO-4217 code.
     */
    @Override
    public Optional<CurrencyCode> findBaseCurrency(UUID tripId) {
        Optional<String> stored = jdbcTemplate.query("SELECT base_currency FROM trips WHERE id = ?",
                        (rs, rowNum) -> rs.getString("base_currency"), tripId)
                .stream()
                .findFirst();

        Optional<CurrencyCode> currency = stored.flatMap(CurrencyCode::tryParse);
        if (stored.isPresent() && currency.isEmpty()) {
            log.warn("Trip {} has unrecognised base currency '{}'", tripId, stored.get());
        }
        return currency;
    }
}
