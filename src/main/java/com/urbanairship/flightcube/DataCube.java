/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * A set of rollups over a shared list of dimensions. For example, flight counts keyed by
 * (month, airline) and by (month, airline, airport) are two rollups of one cube.
 *
 * A DataCube does no IO and holds no cell values, it merely maps input coordinates to the
 * address of each rollup. Values are kept in {@link Batch}es.
 *
 * @param <T> the type of values stored in the cube, for example {@link com.urbanairship.flightcube.ops.MetricsOp}.
 */
public class DataCube<T extends Op> {
    private final List<Rollup> rollups;

    /**
     * @param dims see {@link Dimension}
     * @param rollups see {@link Rollup}
     */
    public DataCube(List<Dimension<?>> dims, List<Rollup> rollups) {
        this.rollups = ImmutableList.copyOf(rollups);

        for (Rollup rollup : rollups) {
            for (Dimension<?> dimension : rollup.getComponents()) {
                if (!dims.contains(dimension)) {
                    throw new IllegalArgumentException("Rollup dimension " +
                            dimension + " is not a dimension in this cube");
                }
            }
            if (rollups.stream().filter(r -> r.getName().equals(rollup.getName())).count() > 1) {
                throw new IllegalArgumentException("Duplicate rollup name " + rollup.getName());
            }
        }
    }

    /**
     * Get the address in the given rollup that an input with the given coordinates contributes to.
     * Every input lands in every rollup; a null coordinate is a group of its own.
     *
     * @throws IllegalArgumentException if one of the rollup's dimensions was never set in the
     * WriteBuilder.
     */
    public Address addressFor(Rollup rollup, WriteBuilder writeBuilder) {
        List<Object> coordinates = new ArrayList<Object>(rollup.getComponents().size());
        for (Dimension<?> dimension : rollup.getComponents()) {
            Preconditions.checkArgument(writeBuilder.isSet(dimension),
                    "No coordinate for dimension %s of rollup %s in %s", dimension, rollup.getName(), writeBuilder);
            coordinates.add(writeBuilder.get(dimension));
        }
        return new Address(rollup, coordinates);
    }

    public List<Rollup> getRollups() {
        return rollups;
    }
}
