/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.collect.ImmutableList;
import com.urbanairship.flightcube.ops.MetricsOp;
import com.urbanairship.flightcube.records.FlightRecord;

import java.util.List;

/**
 * The dimensions and the five rollups of the flight dashboard cube.
 */
public final class FlightCubes {
    public static final Dimension<Integer> MONTH = new Dimension<Integer>("month", Integer.class);
    public static final Dimension<String> MONTH_NAME = new Dimension<String>("month_name", String.class);
    public static final Dimension<String> ORIGIN_STATE_ABBR = new Dimension<String>("origin_state_abbr", String.class);
    public static final Dimension<String> OPERATING_AIRLINE = new Dimension<String>("operating_airline", String.class);
    public static final Dimension<Integer> SCHEDULED_DEPARTURE_HOUR =
            new Dimension<Integer>("scheduled_departure_hour", Integer.class);
    public static final Dimension<String> DELAY_CAUSE = new Dimension<String>("delay_cause", String.class);
    public static final Dimension<String> ORIGIN_STATE = new Dimension<String>("origin_state", String.class);
    public static final Dimension<String> DESTINATION_STATE = new Dimension<String>("destination_state", String.class);
    public static final Dimension<String> ORIGIN_AIRPORT = new Dimension<String>("origin_airport", String.class);

    public static final List<Dimension<?>> DIMENSIONS = ImmutableList.<Dimension<?>>of(MONTH, MONTH_NAME,
            ORIGIN_STATE_ABBR, OPERATING_AIRLINE, SCHEDULED_DEPARTURE_HOUR, DELAY_CAUSE, ORIGIN_STATE,
            DESTINATION_STATE, ORIGIN_AIRPORT);

    public static final Rollup CORE = new Rollup("core",
            MONTH, MONTH_NAME, ORIGIN_STATE_ABBR, OPERATING_AIRLINE);
    public static final Rollup HOUR = new Rollup("hour",
            MONTH, MONTH_NAME, ORIGIN_STATE_ABBR, OPERATING_AIRLINE, SCHEDULED_DEPARTURE_HOUR);
    public static final Rollup CAUSE = new Rollup("cause",
            MONTH, MONTH_NAME, ORIGIN_STATE_ABBR, OPERATING_AIRLINE, DELAY_CAUSE);
    // Routes key on full state names, not abbreviations
    public static final Rollup ROUTES = new Rollup("routes",
            MONTH, MONTH_NAME, OPERATING_AIRLINE, ORIGIN_STATE, DESTINATION_STATE, DELAY_CAUSE);
    public static final Rollup AIRPORT_TOP = new Rollup("airport_top",
            MONTH, MONTH_NAME, ORIGIN_STATE_ABBR, OPERATING_AIRLINE, ORIGIN_AIRPORT);

    public static final List<Rollup> ROLLUPS = ImmutableList.of(CORE, HOUR, CAUSE, ROUTES, AIRPORT_TOP);

    private FlightCubes() {
        // no instances
    }

    public static DataCube<MetricsOp> newCube() {
        return new DataCube<MetricsOp>(DIMENSIONS, ROLLUPS);
    }

    /**
     * Every dimension of the cube set from one flight. Null values are set too, they form their
     * own group.
     */
    public static WriteBuilder writeBuilderFor(FlightRecord record) {
        return new WriteBuilder()
                .at(MONTH, record.getMonth())
                .at(MONTH_NAME, record.getMonthName())
                .at(ORIGIN_STATE_ABBR, record.getOriginStateAbbr())
                .at(OPERATING_AIRLINE, record.getOperatingAirline())
                .at(SCHEDULED_DEPARTURE_HOUR, record.getScheduledDepartureHour())
                .at(DELAY_CAUSE, record.getDelayCause())
                .at(ORIGIN_STATE, record.getOriginState())
                .at(DESTINATION_STATE, record.getDestinationState())
                .at(ORIGIN_AIRPORT, record.getOriginAirport());
    }
}
