/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.finalize;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.urbanairship.flightcube.Address;
import com.urbanairship.flightcube.Dimension;
import com.urbanairship.flightcube.ops.Metric;
import com.urbanairship.flightcube.ops.MetricsOp;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One finished row of a cube table: the cell's address, its summed metrics and the rates derived
 * from them.
 */
public class CubeRow {
    private final Address address;
    private final MetricsOp metrics;
    private final Map<DerivedRate, Double> rates;

    public CubeRow(Address address, MetricsOp metrics) {
        this.address = Preconditions.checkNotNull(address);
        this.metrics = Preconditions.checkNotNull(metrics);
        this.rates = new EnumMap<DerivedRate, Double>(DerivedRate.class);
        for (DerivedRate rate : DerivedRate.values()) {
            rates.put(rate, rate.compute(metrics));
        }
    }

    public Address getAddress() {
        return address;
    }

    /**
     * The coordinates of this row, in the order of its rollup's dimensions. May hold nulls.
     */
    public List<Object> getCoordinates() {
        return address.getCoordinates();
    }

    public <F> F get(Dimension<F> dimension) {
        return address.get(dimension);
    }

    public MetricsOp getMetrics() {
        return metrics;
    }

    public long getFlights() {
        return metrics.getFlights();
    }

    public Number get(Metric metric) {
        return metrics.getValue(metric);
    }

    public double get(DerivedRate rate) {
        return rates.get(rate);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("coordinates", address.getCoordinates())
                .add("metrics", metrics)
                .add("rates", rates)
                .toString();
    }
}
