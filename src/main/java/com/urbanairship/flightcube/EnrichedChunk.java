/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.urbanairship.flightcube.ops.MetricDeriver;
import com.urbanairship.flightcube.ops.MetricsOp;
import com.urbanairship.flightcube.records.FlightRecord;

import java.util.List;

/**
 * One chunk of flights after enrichment: the coordinates and the metric vector of every flight,
 * in input order. Immutable, so every cube's aggregation can read it at the same time.
 */
public class EnrichedChunk {
    private final List<WriteBuilder> coordinates;
    private final List<MetricsOp> ops;

    public EnrichedChunk(List<WriteBuilder> coordinates, List<MetricsOp> ops) {
        Preconditions.checkArgument(coordinates.size() == ops.size(),
                "Got %s coordinates for %s ops", coordinates.size(), ops.size());
        this.coordinates = ImmutableList.copyOf(coordinates);
        this.ops = ImmutableList.copyOf(ops);
    }

    public static EnrichedChunk of(List<FlightRecord> records) {
        ImmutableList.Builder<WriteBuilder> coordinates = ImmutableList.builder();
        ImmutableList.Builder<MetricsOp> ops = ImmutableList.builder();
        for (FlightRecord record : records) {
            coordinates.add(FlightCubes.writeBuilderFor(record));
            ops.add(MetricDeriver.derive(record));
        }
        return new EnrichedChunk(coordinates.build(), ops.build());
    }

    public int size() {
        return ops.size();
    }

    public WriteBuilder getCoordinates(int i) {
        return coordinates.get(i);
    }

    public MetricsOp getOp(int i) {
        return ops.get(i);
    }
}
