/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.finalize;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import com.urbanairship.flightcube.Dimension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps the rows of the N values of one dimension that have the most flights summed over all
 * other dimensions, and drops the rest. Nothing is added for the dropped values. When values tie
 * at the cutoff the one seen first wins. A null value competes like any other.
 */
public class TopNTrimmer {
    private static final Logger log = LoggerFactory.getLogger(TopNTrimmer.class);

    private final Dimension<?> dimension;
    private final int limit;

    public TopNTrimmer(Dimension<?> dimension, int limit) {
        Preconditions.checkArgument(limit >= 0, "limit must not be negative, got %s", limit);
        this.dimension = Preconditions.checkNotNull(dimension);
        this.limit = limit;
    }

    /**
     * @return the kept rows, in input order.
     */
    public List<CubeRow> trim(List<CubeRow> rows) {
        Map<Object, Long> totals = Maps.newLinkedHashMap();
        for (CubeRow row : rows) {
            Object value = row.get(dimension);
            Long total = totals.get(value);
            totals.put(value, total == null ? row.getFlights() : total + row.getFlights());
        }

        List<Map.Entry<Object, Long>> ranked = Lists.newArrayList(totals.entrySet());
        ranked.sort(Map.Entry.<Object, Long>comparingByValue().reversed());

        Set<Object> kept = Sets.newHashSet();
        for (Map.Entry<Object, Long> entry : ranked.subList(0, Math.min(limit, ranked.size()))) {
            kept.add(entry.getKey());
        }

        List<CubeRow> trimmed = Lists.newArrayList();
        for (CubeRow row : rows) {
            if (kept.contains(row.get(dimension))) {
                trimmed.add(row);
            }
        }
        log.debug("Kept {} of {} {} values, {} of {} rows", kept.size(), totals.size(), dimension.getName(),
                trimmed.size(), rows.size());
        return trimmed;
    }
}
