package com.kuyan.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable series of values ordered by ascending date.
 * Missing periods are simply absent, nothing is interpolated.
 */
public final class TimeSeries<T> {

    private final NavigableMap<LocalDate, T> values;

    private TimeSeries(NavigableMap<LocalDate, T> values) {
        this.values = Collections.unmodifiableNavigableMap(values);
    }

    public static <T> TimeSeries<T> of(Map<LocalDate, T> values) {
        return new TimeSeries<>(new TreeMap<>(values));
    }

    public static <T> TimeSeries<T> empty() {
        return new TimeSeries<>(new TreeMap<>());
    }

    public List<SeriesPoint<T>> points() {
        List<SeriesPoint<T>> points = new ArrayList<>(values.size());
        values.forEach((date, value) -> points.add(new SeriesPoint<>(date, value)));
        return points;
    }

    public Optional<T> valueAt(LocalDate date) {
        return Optional.ofNullable(values.get(date));
    }

    public Optional<LocalDate> firstDate() {
        return values.isEmpty() ? Optional.empty() : Optional.of(values.firstKey());
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries)) return false;
        return values.equals(((TimeSeries<?>) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "TimeSeries" + values;
    }
}
