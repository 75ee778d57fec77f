package com.flagship.broker_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.broker_ledger.account.ClientExchangeAccount;
import com.flagship.broker_ledger.account.ClientType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("client_name")
    String clientName;

    @JsonProperty("exchange_name")
    String exchangeName;

    @JsonProperty("client_type")
    ClientType clientType;

    @JsonProperty("my_share_pct")
    BigDecimal mySharePct;

    @JsonProperty("company_share_pct")
    BigDecimal companySharePct;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(ClientExchangeAccount account) {
        return AccountResponse.builder()
            .id(account.getId())
            .clientName(account.getClientName())
            .exchangeName(account.getExchangeName())
            .clientType(account.getClientType())
            .mySharePct(account.getMySharePct())
            .companySharePct(account.getCompanySharePct())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
