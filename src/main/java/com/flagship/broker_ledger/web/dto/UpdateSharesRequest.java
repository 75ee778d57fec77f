package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpdateSharesRequest {

    @NotNull(message = "My share is required")
    @DecimalMin(value = "0", message = "My share cannot be negative")
    @DecimalMax(value = "100", message = "My share cannot exceed 100")
    @JsonProperty("my_share_pct")
    BigDecimal mySharePct;

    @DecimalMin(value = "0", message = "Company share cannot be negative")
    @DecimalMax(value = "100", message = "Company share cannot exceed 100")
    @JsonProperty("company_share_pct")
    BigDecimal companySharePct;
}
