/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.Preconditions;

/**
 * Describes one dimension of a cube, for example "month" or "origin_airport". The name is the
 * column name used in published tables.
 *
 * Dimensions are compared by identity, so each one should be created once and shared by all the
 * rollups that use it.
 *
 * @param <F> the type of the coordinates for this dimension, for example Integer for a month
 *            number or String for an airline code. A null coordinate is a valid value.
 */
public class Dimension<F> {
    private final String name;
    private final Class<F> coordinateType;

    public Dimension(String name, Class<F> coordinateType) {
        this.name = Preconditions.checkNotNull(name);
        this.coordinateType = Preconditions.checkNotNull(coordinateType);
    }

    public String getName() {
        return name;
    }

    public Class<F> getCoordinateType() {
        return coordinateType;
    }

    public String toString() {
        return name;
    }
}
