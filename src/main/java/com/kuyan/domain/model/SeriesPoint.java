package com.kuyan.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One period of a {@link TimeSeries}
 */
public record SeriesPoint<T>(LocalDate date, T value) {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("MMM yyyy", Locale.ENGLISH);

    /**
     * Month label, e.g. "JAN 2025"
     */
    public String periodLabel() {
        return labelOf(date);
    }

    public static String labelOf(LocalDate date) {
        return LABEL_FORMAT.format(date).toUpperCase(Locale.ENGLISH);
    }
}
