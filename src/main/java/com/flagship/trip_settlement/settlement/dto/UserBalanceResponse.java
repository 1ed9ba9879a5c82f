package com.flagship.trip_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trip_settlement.balance.UserBalance;
import lombok.Value;

import java.util.UUID;

@Value
public class UserBalanceResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("net_balance")
    long netBalance;

    @JsonProperty("currency")
    String currency;

    public static UserBalanceResponse from(UserBalance balance) {
        return new UserBalanceResponse(balance.getUserId(), balance.getNetBalance(), balance.getCurrency().getCode());
    }
}
