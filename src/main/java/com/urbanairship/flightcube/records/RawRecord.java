/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.records;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;

/**
 * One row of the input file, exactly as read: column name to text value. All the rows of a
 * file share one {@link Header}.
 */
public class RawRecord {
    private final Header header;
    private final String[] values;

    public RawRecord(Header header, String[] values) {
        this.header = Preconditions.checkNotNull(header);
        this.values = Preconditions.checkNotNull(values);
    }

    /**
     * Convenient for building records by hand, the map's key order becomes the header.
     * Null values are stored as empty text.
     */
    public static RawRecord fromMap(Map<String, ?> columns) {
        Header header = new Header(ImmutableList.copyOf(columns.keySet()));
        String[] values = new String[columns.size()];
        int i = 0;
        for (Object value : columns.values()) {
            values[i++] = value == null ? "" : value.toString();
        }
        return new RawRecord(header, values);
    }

    public Header getHeader() {
        return header;
    }

    /**
     * @return the text of the column, empty if the row was too short to reach it, or null if the
     * file has no such column.
     */
    public String get(String column) {
        Integer index = header.indexOf(column);
        if (index == null) {
            return null;
        }
        return index < values.length ? values[index] : "";
    }

    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        List<String> columns = header.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(i)).append(':').append(i < values.length ? values[i] : "");
        }
        return sb.append(')').toString();
    }

    /**
     * The column names of an input file, in file order. When a name repeats, the first column
     * with that name wins.
     */
    public static class Header {
        private final List<String> columns;
        private final Map<String, Integer> indexes;

        public Header(List<String> columns) {
            this.columns = ImmutableList.copyOf(columns);
            Map<String, Integer> builder = Maps.newLinkedHashMap();
            for (int i = 0; i < columns.size(); i++) {
                builder.putIfAbsent(columns.get(i), i);
            }
            this.indexes = ImmutableMap.copyOf(builder);
        }

        public List<String> getColumns() {
            return columns;
        }

        public boolean contains(String column) {
            return indexes.containsKey(column);
        }

        Integer indexOf(String column) {
            return indexes.get(column);
        }

        public String toString() {
            return columns.toString();
        }
    }
}
