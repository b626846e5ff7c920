package com.reims.anomaly.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered observations for one (entity, field) pair.
 * Period keys are unique; order is the caller's chronological order.
 */
@Getter
public final class TimeSeries {

    private final String entityId;
    private final String field;
    private final List<TimeSeriesPoint> points;

    private TimeSeries(String entityId, String field, List<TimeSeriesPoint> points) {
        this.entityId = entityId;
        this.field = field;
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
    }

    public static TimeSeries of(String entityId, String field, List<TimeSeriesPoint> points) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(points, "points");
        Set<String> seen = new HashSet<>();
        for (TimeSeriesPoint point : points) {
            if (point.getPeriodKey() == null) {
                throw new IllegalArgumentException("Point without period key in series " + field);
            }
            if (!seen.add(point.getPeriodKey())) {
                throw new IllegalArgumentException(
                        "Duplicate period key '" + point.getPeriodKey() + "' in series " + field);
            }
        }
        return new TimeSeries(entityId, field, points);
    }

    /**
     * Convenience for undated series; period keys are the point indexes.
     */
    public static TimeSeries ofValues(String entityId, String field, double... values) {
        List<TimeSeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(TimeSeriesPoint.builder().periodKey(String.valueOf(i)).value(values[i]).build());
        }
        return of(entityId, field, points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /** Dates in point order; {@code null} entries where a point is undated. */
    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(points.size());
        for (TimeSeriesPoint point : points) {
            dates.add(point.getDate());
        }
        return dates;
    }

    public boolean isFullyDated() {
        for (TimeSeriesPoint point : points) {
            if (point.getDate() == null) return false;
        }
        return !points.isEmpty();
    }

    public TimeSeriesPoint get(int index) {
        return points.get(index);
    }

    /** The trailing {@code count} points, or the whole series when it is shorter. */
    public TimeSeries tail(int count) {
        if (count <= 0 || count >= points.size()) {
            return this;
        }
        return new TimeSeries(entityId, field, points.subList(points.size() - count, points.size()));
    }
}
