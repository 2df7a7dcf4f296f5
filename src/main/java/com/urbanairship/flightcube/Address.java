/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The key of one cell in a rollup: one coordinate per dimension of the rollup, in the rollup's
 * order. Coordinates may be null, and null is compared like any other value, so rows with a
 * missing dimension value group together instead of being dropped.
 *
 * Normally addresses are made by {@link DataCube#addressFor(Rollup, WriteBuilder)}.
 */
public class Address {
    private final Rollup sourceRollup;
    private final List<Object> coordinates;

    public Address(Rollup sourceRollup, List<?> coordinates) {
        this.sourceRollup = Preconditions.checkNotNull(sourceRollup);
        Preconditions.checkArgument(coordinates.size() == sourceRollup.getComponents().size(),
                "Rollup %s needs %s coordinates but got %s", sourceRollup.getName(),
                sourceRollup.getComponents().size(), coordinates);
        // ImmutableList doesn't allow null elements
        this.coordinates = Collections.unmodifiableList(new ArrayList<Object>(coordinates));
    }

    public List<Object> getCoordinates() {
        return coordinates;
    }

    /**
     * @throws IllegalArgumentException if the dimension isn't part of this address's rollup.
     */
    public <F> F get(Dimension<F> dimension) {
        int index = sourceRollup.indexOf(dimension);
        if (index < 0) {
            throw new IllegalArgumentException("Dimension " + dimension + " is not in " + sourceRollup);
        }
        return dimension.getCoordinateType().cast(coordinates.get(index));
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("rollup", sourceRollup.getName())
                .add("coordinates", coordinates)
                .toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Address)) return false;
        Address address = (Address) o;
        return Objects.equal(sourceRollup, address.sourceRollup) &&
                Objects.equal(coordinates, address.coordinates);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(sourceRollup, coordinates);
    }
}
