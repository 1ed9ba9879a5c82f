package com.flagship.trip_settlement.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trip_settlement.expense.SplitType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for previewing how an expense total is split.
 */
@Value
public class CalculateSharesRequest {

    @NotNull(message = "Total amount is required")
    @Positive(message = "Total amount must be greater than 0")
    @JsonProperty("total_amount")
    Long totalAmount;

    @NotNull(message = "Split type is required")
    @JsonProperty("split_type")
    SplitType splitType;

    @NotEmpty(message = "At least one participant is required")
    @Valid
    @JsonProperty("participants")
    List<Participant> participants;

    @Value
    public static class Participant {

        @NotNull(message = "Participant user ID is required")
        @JsonProperty("user_id")
        UUID userId;

        @JsonProperty("share_value")
        BigDecimal shareValue;
    }
}
