/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.finalize;

import com.urbanairship.flightcube.ops.Metric;
import com.urbanairship.flightcube.ops.MetricsOp;

/**
 * Ratio columns computed from the summed metrics of a finished cube cell, in published column
 * order. Every rate is 0.0 for a cell with no flights.
 */
public enum DerivedRate {
    ARR_DELAY_RATE_ANY("arr_delay_rate_any", Metric.ARR_DELAYED_ANY),
    DEP_DELAY_RATE_ANY("dep_delay_rate_any", Metric.DEP_DELAYED_ANY),
    CANCEL_RATE("cancel_rate", Metric.CANCELLED_FLIGHTS),
    AVG_ARRIVAL_DELAY_MIN("avg_arrival_delay_min", Metric.SUM_ARRIVAL_DELAY_MIN),
    AVG_DEPARTURE_DELAY_MIN("avg_departure_delay_min", Metric.SUM_DEPARTURE_DELAY_MIN),
    AVG_TOTAL_DELAY_MIN("avg_total_delay_min", Metric.SUM_TOTAL_DELAY_MIN);

    private final String columnName;
    private final Metric numerator;

    DerivedRate(String columnName, Metric numerator) {
        this.columnName = columnName;
        this.numerator = numerator;
    }

    public String getColumnName() {
        return columnName;
    }

    public double compute(MetricsOp op) {
        long flights = op.getFlights();
        if (flights == 0) {
            return 0d;
        }
        return op.getValue(numerator).doubleValue() / flights;
    }

    public String toString() {
        return columnName;
    }
}
