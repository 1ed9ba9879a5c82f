package com.flagship.trip_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trip_settlement.settlement.Settlement;
import com.flagship.trip_settlement.settlement.SettlementStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("trip_id")
    UUID tripId;

    @JsonProperty("from_user_id")
    UUID fromUserId;

    @JsonProperty("to_user_id")
    UUID toUserId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("status")
    SettlementStatus status;

    @JsonProperty("settled_at")
    Instant settledAt;

    @JsonProperty("settled_by")
    UUID settledBy;

    @JsonProperty("note")
    String note;

    @JsonProperty("created_at")
    Instant createdAt;

    public static SettlementResponse from(Settlement settlement) {
        return SettlementResponse.builder()
            .id(settlement.getId())
            .tripId(settlement.getTripId())
            .fromUserId(settlement.getFromUserId())
            .toUserId(settlement.getToUserId())
            .amount(settlement.getAmount())
            .currency(settlement.getCurrency().getCode())
            .status(settlement.getStatus())
            .settledAt(settlement.getSettledAt())
            .settledBy(settlement.getSettledBy())
            .note(settlement.getNote())
            .createdAt(settlement.getCreatedAt())
            .build();
    }
}
