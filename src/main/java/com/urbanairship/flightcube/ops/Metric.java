/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.ops;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The additive fields of a {@link MetricsOp}, in published column order. Count metrics hold
 * whole flights, minute metrics hold summed delay minutes.
 */
public enum Metric {
    FLIGHTS("flights"),
    CANCELLED_FLIGHTS("cancelled_flights"),
    ON_TIME_FLIGHTS("on_time_flights"),
    DEP_DELAYED_ANY("dep_delayed_any"),
    DEP_DELAYED_15("dep_delayed_15"),
    DEP_DELAYED_30("dep_delayed_30"),
    DEP_DELAYED_60("dep_delayed_60"),
    DEP_DELAYED_120("dep_delayed_120"),
    ARR_DELAYED_ANY("arr_delayed_any"),
    ARR_DELAYED_15("arr_delayed_15"),
    ARR_DELAYED_30("arr_delayed_30"),
    ARR_DELAYED_60("arr_delayed_60"),
    ARR_DELAYED_120("arr_delayed_120"),
    SUM_DEPARTURE_DELAY_MIN("sum_departure_delay_min", true),
    SUM_ARRIVAL_DELAY_MIN("sum_arrival_delay_min", true),
    SUM_TOTAL_DELAY_MIN("sum_total_delay_min", true);

    private static final List<Metric> COUNTS;
    private static final List<Metric> MINUTES;

    static {
        ImmutableList.Builder<Metric> counts = ImmutableList.builder();
        ImmutableList.Builder<Metric> minutes = ImmutableList.builder();
        int countSlot = 0;
        int minuteSlot = 0;
        for (Metric metric : values()) {
            if (metric.minutes) {
                metric.slot = minuteSlot++;
                minutes.add(metric);
            } else {
                metric.slot = countSlot++;
                counts.add(metric);
            }
        }
        COUNTS = counts.build();
        MINUTES = minutes.build();
    }

    private final String columnName;
    private final boolean minutes;
    private int slot;

    Metric(String columnName) {
        this(columnName, false);
    }

    Metric(String columnName, boolean minutes) {
        this.columnName = columnName;
        this.minutes = minutes;
    }

    public String getColumnName() {
        return columnName;
    }

    public boolean isMinutes() {
        return minutes;
    }

    /**
     * Position of this metric within the counts or the minutes of a {@link MetricsOp}.
     */
    int slot() {
        return slot;
    }

    public static List<Metric> counts() {
        return COUNTS;
    }

    public static List<Metric> minutes() {
        return MINUTES;
    }

    public String toString() {
        return columnName;
    }
}
