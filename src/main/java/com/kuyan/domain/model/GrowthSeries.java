package com.kuyan.domain.model;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import java.util.Set;

/**
 * Per-currency holdings expressed as a percentage of the baseline period (baseline = 100)
 */
@Value
public class GrowthSeries {
    LocalDate baselineDate;
    TimeSeries<Map<String, BigDecimal>> percentages;
    // Currencies whose baseline total was zero and was replaced by 1
    Set<String> zeroBaselineCurrencies;
}
