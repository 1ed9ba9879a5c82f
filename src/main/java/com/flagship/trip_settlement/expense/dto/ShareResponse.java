package com.flagship.trip_settlement.expense.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.trip_settlement.expense.Share;
import com.flagship.trip_settlement.expense.SplitType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ShareResponse {

    @JsonProperty("user_id")
    UUID userId;

    @JsonProperty("share_amount")
    long shareAmount;

    @JsonProperty("share_type")
    SplitType shareType;

    @JsonProperty("share_value")
    BigDecimal shareValue;

    public static ShareResponse from(Share share) {
        return ShareResponse.builder()
            .userId(share.getUserId())
            .shareAmount(share.getShareAmount())
            .shareType(share.getShareType())
            .shareValue(share.getShareValue())
            .build();
    }
}
