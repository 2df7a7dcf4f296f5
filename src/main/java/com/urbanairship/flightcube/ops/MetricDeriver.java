/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.ops;

import com.urbanairship.flightcube.records.FlightRecord;

/**
 * Maps one flight to the {@link MetricsOp} it contributes to every cube cell it lands in.
 */
public final class MetricDeriver {
    public static final int DELAY_THRESHOLD_15 = 15;
    public static final int DELAY_THRESHOLD_30 = 30;
    public static final int DELAY_THRESHOLD_60 = 60;
    public static final int DELAY_THRESHOLD_120 = 120;

    private MetricDeriver() {
        // no instances
    }

    public static MetricsOp derive(FlightRecord record) {
        double dep = record.getDepartureDelayMin();
        double arr = record.getArrivalDelayMin();

        return MetricsOp.newBuilder()
                .setCount(Metric.FLIGHTS, 1L)
                .setCount(Metric.CANCELLED_FLIGHTS, record.isCancelled())
                // On time means arriving exactly on schedule, early arrivals don't count
                .setCount(Metric.ON_TIME_FLIGHTS, !record.isCancelled() && arr == 0)
                .setCount(Metric.DEP_DELAYED_ANY, dep > 0)
                .setCount(Metric.DEP_DELAYED_15, dep >= DELAY_THRESHOLD_15)
                .setCount(Metric.DEP_DELAYED_30, dep >= DELAY_THRESHOLD_30)
                .setCount(Metric.DEP_DELAYED_60, dep >= DELAY_THRESHOLD_60)
                .setCount(Metric.DEP_DELAYED_120, dep >= DELAY_THRESHOLD_120)
                .setCount(Metric.ARR_DELAYED_ANY, arr > 0)
                .setCount(Metric.ARR_DELAYED_15, arr >= DELAY_THRESHOLD_15)
                .setCount(Metric.ARR_DELAYED_30, arr >= DELAY_THRESHOLD_30)
                .setCount(Metric.ARR_DELAYED_60, arr >= DELAY_THRESHOLD_60)
                .setCount(Metric.ARR_DELAYED_120, arr >= DELAY_THRESHOLD_120)
                .setMinutes(Metric.SUM_DEPARTURE_DELAY_MIN, dep)
                .setMinutes(Metric.SUM_ARRIVAL_DELAY_MIN, arr)
                .setMinutes(Metric.SUM_TOTAL_DELAY_MIN, record.getTotalDelayMin())
                .build();
    }
}
