package com.kuyan.adapter.in.web.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * DTO for a monthly snapshot submitted by the client
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RecordSnapshotRequest(
        @JsonProperty("year") Integer year,
        @JsonProperty("month") Integer month,
        @JsonProperty("balances") List<BalanceRequest> balances
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BalanceRequest(
            @JsonProperty("accountId") String accountId,
            @JsonProperty("accountName") String accountName,
            @JsonProperty("owner") String owner,
            @JsonProperty("accountType") String accountType,
            @JsonProperty("currency") String currency,
            @JsonProperty("amount") BigDecimal amount
    ) {}
}
