package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payment against the open episode. Zero is accepted: it closes a
 * sub-cent leftover.
 */
@Value
public class SettlementRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0", message = "Amount cannot be negative")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("note")
    String note;
}
