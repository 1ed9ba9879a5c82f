package com.flagship.trip_settlement.balance;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.Value;

import java.util.UUID;

/**
 * Net position of one participant in the trip's base currency.
 * Positive means the group owes the user, negative means the user owes the group.
 */
@Value
public class UserBalance {
    UUID userId;
    long netBalance;
    CurrencyCode currency;

    public boolean isCreditor() {
        return netBalance > 0;
    }

    public boolean isDebtor() {
        return netBalance < 0;
    }
}
