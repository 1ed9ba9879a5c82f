package com.flagship.trip_settlement.settlement;

import com.flagship.trip_settlement.fx.CurrencyCode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link CurrencyCode} as its three-letter code.
 */
@Converter
public class CurrencyCodeConverter implements AttributeConverter<CurrencyCode, String> {

    @Override
    public String convertToDatabaseColumn(CurrencyCode currency) {
        return currency == null ? null : currency.getCode();
    }

    @Override
    public CurrencyCode convertToEntityAttribute(String code) {
        return code == null ? null : CurrencyCode.parse(code);
    }
}
