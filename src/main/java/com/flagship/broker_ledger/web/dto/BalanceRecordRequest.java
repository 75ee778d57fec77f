package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class BalanceRecordRequest {

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    LocalDate date;

    @NotNull(message = "Balance is required")
    @DecimalMin(value = "0", inclusive = false, message = "Balance must be greater than 0")
    @JsonProperty("balance")
    BigDecimal balance;

    /**
     * Correction added to the recorded balance, may be negative.
     */
    @JsonProperty("adjustment")
    BigDecimal adjustment;

    @JsonProperty("note")
    String note;
}
