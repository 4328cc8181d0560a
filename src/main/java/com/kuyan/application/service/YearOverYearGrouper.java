package com.kuyan.application.service;

import com.kuyan.domain.model.SeriesPoint;
import com.kuyan.domain.model.TimeSeries;
import com.kuyan.domain.model.YearOverYear;

import java.math.BigDecimal;
import java.time.Month;
import java.time.Year;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Buckets a chronological series by year and month so years can be overlaid.
 * Months without a point stay absent; a later point in the same month replaces an earlier one.
 */
public class YearOverYearGrouper {

    public YearOverYear groupByYear(String currency, TimeSeries<BigDecimal> series) {
        SortedMap<Year, SortedMap<Month, BigDecimal>> years = new TreeMap<>();
        for (SeriesPoint<BigDecimal> point : series.points()) {
            years.computeIfAbsent(Year.of(point.date().getYear()), year -> new TreeMap<>())
                    .put(point.date().getMonth(), point.value());
        }
        return new YearOverYear(currency, years);
    }
}
