/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.io;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.urbanairship.flightcube.CubeBuildException;
import com.urbanairship.flightcube.Dimension;
import com.urbanairship.flightcube.FlightCubes;
import com.urbanairship.flightcube.Rollup;
import com.urbanairship.flightcube.finalize.CubeRow;
import com.urbanairship.flightcube.finalize.DerivedRate;
import com.urbanairship.flightcube.ops.Metric;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Layout of the published cube tables: file names, columns and how values are written.
 */
public final class CubeTables {
    public static final String FILE_PREFIX = "cube_";
    public static final String FILE_SUFFIX = ".csv";

    private static final double WHOLE_NUMBER_LIMIT = 1e15;

    private CubeTables() {
        // no instances
    }

    public static String fileName(Rollup rollup) {
        return FILE_PREFIX + rollup.getName() + FILE_SUFFIX;
    }

    public static List<String> publishedFileNames() {
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (Rollup rollup : FlightCubes.ROLLUPS) {
            names.add(fileName(rollup));
        }
        return names.build();
    }

    /**
     * Dimension names, then metrics, then derived rates.
     */
    public static List<String> columns(Rollup rollup) {
        List<String> columns = Lists.newArrayList();
        for (Dimension<?> dimension : rollup.getComponents()) {
            columns.add(dimension.getName());
        }
        for (Metric metric : Metric.values()) {
            columns.add(metric.getColumnName());
        }
        for (DerivedRate rate : DerivedRate.values()) {
            columns.add(rate.getColumnName());
        }
        return columns;
    }

    /**
     * The row's values in {@link #columns(Rollup)} order. Null coordinates become empty text.
     */
    public static String[] values(CubeRow row) {
        List<String> values = Lists.newArrayList();
        for (Object coordinate : row.getCoordinates()) {
            values.add(coordinate == null ? "" : coordinate.toString());
        }
        for (Metric metric : Metric.values()) {
            values.add(metric.isMinutes()
                    ? formatDouble(row.get(metric).doubleValue())
                    : row.get(metric).toString());
        }
        for (DerivedRate rate : DerivedRate.values()) {
            values.add(formatDouble(row.get(rate)));
        }
        return values.toArray(new String[0]);
    }

    /**
     * Plain decimal notation, never an exponent. Whole numbers keep a trailing ".0".
     */
    static String formatDouble(double value) {
        if (value == Math.rint(value) && Math.abs(value) < WHOLE_NUMBER_LIMIT) {
            return (long) value + ".0";
        }
        return BigDecimal.valueOf(value).toPlainString();
    }

    /**
     * @return the published tables that are not in the directory, empty if all are there.
     */
    public static List<String> missingTables(Path dir) {
        List<String> missing = Lists.newArrayList();
        for (String fileName : publishedFileNames()) {
            if (!Files.isRegularFile(dir.resolve(fileName))) {
                missing.add(fileName);
            }
        }
        return missing;
    }

    /**
     * @throws CubeBuildException naming every missing table, if any is missing.
     */
    public static void checkPresent(Path dir) throws CubeBuildException {
        List<String> missing = missingTables(dir);
        if (!missing.isEmpty()) {
            throw new CubeBuildException("Missing cube tables in " + dir + ": " + Joiner.on(", ").join(missing)
                    + ". Run the cube build first.");
        }
    }
}
