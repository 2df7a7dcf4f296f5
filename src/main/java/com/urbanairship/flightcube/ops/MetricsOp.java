/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.ops;

import com.google.common.base.Preconditions;
import com.urbanairship.flightcube.Op;

import java.util.Arrays;

/**
 * Cube cell type for the flight metric vector: exact long counters plus summed delay minutes.
 * Immutable, {@link #add(Op)} returns a new instance.
 */
public class MetricsOp implements Op {
    public static final MetricsOp ZERO = new MetricsOp(new long[Metric.counts().size()],
            new double[Metric.minutes().size()]);

    private final long[] counts;
    private final double[] minutes;

    private MetricsOp(long[] counts, double[] minutes) {
        this.counts = counts;
        this.minutes = minutes;
    }

    @Override
    public MetricsOp add(Op otherOp) {
        if (!(otherOp instanceof MetricsOp)) {
            throw new IllegalArgumentException("Can't add " + otherOp + " to a MetricsOp");
        }
        MetricsOp other = (MetricsOp) otherOp;

        long[] newCounts = new long[counts.length];
        for (int i = 0; i < counts.length; i++) {
            newCounts[i] = counts[i] + other.counts[i];
        }
        double[] newMinutes = new double[minutes.length];
        for (int i = 0; i < minutes.length; i++) {
            newMinutes[i] = minutes[i] + other.minutes[i];
        }
        return new MetricsOp(newCounts, newMinutes);
    }

    public long getCount(Metric metric) {
        Preconditions.checkArgument(!metric.isMinutes(), "%s is not a count metric", metric);
        return counts[metric.slot()];
    }

    public double getMinutes(Metric metric) {
        Preconditions.checkArgument(metric.isMinutes(), "%s is not a minutes metric", metric);
        return minutes[metric.slot()];
    }

    /**
     * The value of any metric, as a Long for counts and a Double for minute sums.
     */
    public Number getValue(Metric metric) {
        if (metric.isMinutes()) {
            return minutes[metric.slot()];
        }
        return counts[metric.slot()];
    }

    public long getFlights() {
        return counts[Metric.FLIGHTS.slot()];
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.hashCode(counts);
        result = prime * result + Arrays.hashCode(minutes);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        MetricsOp other = (MetricsOp) obj;
        return Arrays.equals(counts, other.counts) && Arrays.equals(minutes, other.minutes);
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (Metric metric : Metric.values()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(metric.getColumnName()).append('=').append(getValue(metric));
        }
        return sb.append(')').toString();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private final long[] counts = new long[Metric.counts().size()];
        private final double[] minutes = new double[Metric.minutes().size()];

        private Builder() {
        }

        public Builder setCount(Metric metric, long value) {
            Preconditions.checkArgument(!metric.isMinutes(), "%s is not a count metric", metric);
            counts[metric.slot()] = value;
            return this;
        }

        public Builder setCount(Metric metric, boolean flag) {
            return setCount(metric, flag ? 1L : 0L);
        }

        public Builder setMinutes(Metric metric, double value) {
            Preconditions.checkArgument(metric.isMinutes(), "%s is not a minutes metric", metric);
            minutes[metric.slot()] = value;
            return this;
        }

        public MetricsOp build() {
            return new MetricsOp(counts.clone(), minutes.clone());
        }
    }
}
