/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.urbanairship.flightcube.ops.MetricsOp;


/**
 * A cell value that can be combined with another of the same kind. A cube of flight metrics
 * contains Ops that are metric vectors (see e.g. {@link MetricsOp}).
 */
public interface Op {
    /**
     * @return an Op that combines the effect of this and otherOp. Neither input is modified.
     */
    Op add(Op otherOp);

    /**
     * Subclasses must override equals() and hashCode().
     */
    @Override
    boolean equals(Object other);

    @Override
    int hashCode();
}
