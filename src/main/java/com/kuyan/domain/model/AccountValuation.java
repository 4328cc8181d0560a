package com.kuyan.domain.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One line of the account breakdown: native balance and its value in the target currency
 */
@Value
@Builder
public class AccountValuation {
    String accountId;
    String accountName;
    String owner;
    String accountType;
    String nativeCurrency;
    BigDecimal nativeAmount;
    String targetCurrency;
    BigDecimal convertedAmount;
    ConversionPath path;
}
