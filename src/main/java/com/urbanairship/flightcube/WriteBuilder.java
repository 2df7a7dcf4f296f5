/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Collects the coordinates of one input record, one per dimension. A dimension set to null is a
 * valid null coordinate; a dimension that was never set is an error when {@link DataCube} looks up
 * an address in a rollup that needs it.
 */
public class WriteBuilder {
    private final Map<Dimension<?>, Object> coords;

    public WriteBuilder() {
        coords = Maps.newHashMap();
    }

    public <F> WriteBuilder at(Dimension<F> dimension, F coord) {
        Preconditions.checkArgument(coord == null || dimension.getCoordinateType().isInstance(coord),
                "Coordinate %s is not a %s for dimension %s", coord, dimension.getCoordinateType(), dimension);
        coords.put(dimension, coord);
        return this;
    }

    boolean isSet(Dimension<?> dimension) {
        return coords.containsKey(dimension);
    }

    Object get(Dimension<?> dimension) {
        return coords.get(dimension);
    }

    public String toString() {
        return coords.toString();
    }
}
