package com.flagship.trip_settlement.fx;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Currency;
import java.util.Optional;

/**
 * An ISO-4217 currency code as known to {@link Currency}, used for expenses, trip base currencies
 * and settlements.
 *
 * Amounts are always carried in the currency's minor unit (cents, pence, yen),
 * so no scale information is needed here.
 */
@EqualsAndHashCode
public final class CurrencyCode {

    public static final CurrencyCode USD = parse("USD");
    public static final CurrencyCode EUR = parse("EUR");
    public static final CurrencyCode GBP = parse("GBP");
    public static final CurrencyCode JPY = parse("JPY");

    private final String code;

    private CurrencyCode(String code) {
        this.code = code;
    }

    /**
     * Parses a currency code, accepting lower case input.
     *
     * @throws IllegalArgumentException if the code is not an ISO-4217 currency
     */
    @JsonCreator
    public static CurrencyCode parse(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Currency is required");
        }
        String normalized = code.trim().toUpperCase();
        try {
            return new CurrencyCode(Currency.getInstance(normalized).getCurrencyCode());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported currency code: " + code, e);
        }
    }

    /**
     * Like {@link #parse} but empty for missing or unknown codes.
     */
    public static Optional<CurrencyCode> tryParse(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(code));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
