/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.finalize;

import com.codahale.metrics.Histogram;
import com.google.common.collect.Lists;
import com.google.common.collect.Ordering;
import com.urbanairship.flightcube.Address;
import com.urbanairship.flightcube.Batch;
import com.urbanairship.flightcube.Dimension;
import com.urbanairship.flightcube.Rollup;
import com.urbanairship.flightcube.metrics.Metrics;
import com.urbanairship.flightcube.ops.MetricsOp;

import java.util.List;
import java.util.Map;

/**
 * Turns the running totals of a rollup into table rows with derived rates. Rows of a rollup that
 * has the ordering dimension are sorted by it, ascending with nulls last; the sort is stable, so
 * rows with equal values keep the order their address was first seen in. Rows of other rollups
 * keep that first-seen order.
 */
public class CubeFinalizer {
    private final Dimension<Integer> orderBy;

    public CubeFinalizer(Dimension<Integer> orderBy) {
        this.orderBy = orderBy;
    }

    public List<CubeRow> finalizeRollup(Rollup rollup, Batch<MetricsOp> totals) {
        List<CubeRow> rows = Lists.newArrayListWithCapacity(totals.size());
        for (Map.Entry<Address, MetricsOp> entry : totals.getMap().entrySet()) {
            rows.add(new CubeRow(entry.getKey(), entry.getValue()));
        }

        Histogram distinctKeys = Metrics.histogram(CubeFinalizer.class, "distinctKeys", rollup.getName());
        distinctKeys.update(rows.size());

        if (rollup.contains(orderBy)) {
            Ordering<CubeRow> byOrderDimension = Ordering.<Integer>natural().nullsLast()
                    .onResultOf(row -> row.get(orderBy));
            // List.sort is a stable merge sort
            rows.sort(byOrderDimension);
        }
        return rows;
    }
}
