/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.io;

import com.urbanairship.flightcube.Rollup;
import com.urbanairship.flightcube.finalize.CubeRow;

import java.io.IOException;
import java.util.List;

/**
 * Where finished cube tables go. A run calls {@link #write} once per rollup, then {@link #commit}
 * when every table was written, or {@link #abort} if anything failed. Tables written before a
 * commit must not be visible to readers.
 */
public interface CubeTableSink {
    void write(Rollup rollup, List<CubeRow> rows) throws IOException;

    /**
     * Publish every table written since the last commit.
     */
    void commit() throws IOException;

    /**
     * Drop every table written since the last commit. Published tables are left alone.
     */
    void abort();
}
