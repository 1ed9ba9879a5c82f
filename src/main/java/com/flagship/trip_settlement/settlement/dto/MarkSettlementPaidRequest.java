package com.flagship.trip_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Optional body of a mark-paid call. The note is trimmed on the way in, so the length limit
 * applies to the text that will be stored.
 */
@Value
public class MarkSettlementPaidRequest {

    @Size(max = 500, message = "Note must be at most 500 characters")
    String note;

    @JsonCreator
    public MarkSettlementPaidRequest(@JsonProperty("note") String note) {
        this.note = note == null ? null : note.trim();
    }
}
