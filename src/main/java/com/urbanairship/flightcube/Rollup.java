/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;


/**
 * Use this class to describe a rollup that you want the cube to keep.
 *
 * For example, if you're counting flights with the dimensions (month, state, airline, airport)
 * and you want to keep totals for every (month, airline) combination, you'd specify that using
 * a Rollup over those two dimensions. The order of the dimensions is the column order of the
 * rollup's published table.
 */
public class Rollup {
    private final String name;
    private final List<Dimension<?>> components;

    public Rollup(String name, Dimension<?>... dims) {
        this(name, ImmutableList.copyOf(dims));
    }

    public Rollup(String name, List<Dimension<?>> dims) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Rollup needs a name");
        Preconditions.checkArgument(!dims.isEmpty(), "Rollup %s has no dimensions", name);
        Preconditions.checkArgument(dims.stream().distinct().count() == dims.size(),
                "Rollup %s repeats a dimension: %s", name, dims);
        this.name = name;
        this.components = ImmutableList.copyOf(dims);
    }

    public String getName() {
        return name;
    }

    public List<Dimension<?>> getComponents() {
        return components;
    }

    public boolean contains(Dimension<?> dimension) {
        return components.contains(dimension);
    }

    /**
     * @return the position of the dimension in this rollup's addresses, or -1 if absent.
     */
    public int indexOf(Dimension<?> dimension) {
        return components.indexOf(dimension);
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("(Rollup ");
        sb.append(name);
        sb.append(" over ");
        sb.append(components);
        sb.append(")");
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rollup)) return false;
        Rollup rollup = (Rollup) o;
        return Objects.equals(name, rollup.name) &&
                Objects.equals(components, rollup.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, components);
    }
}
