/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.records;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Meter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.urbanairship.flightcube.metrics.Metrics;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.NumberUtils;
import org.joda.time.LocalDateTime;
import org.joda.time.format.DateTimeFormat;
import org.joda.time.format.DateTimeFormatter;
import org.joda.time.format.DateTimeFormatterBuilder;
import org.joda.time.format.DateTimeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw input rows into {@link FlightRecord}s. Columns the input doesn't have get a default
 * (null for text, 0 for minutes and the cancellation flag) and values that don't parse are
 * replaced the same way, so one bad row never stops a run.
 *
 * Thread safe.
 */
public class RecordEnricher {
    private static final Logger log = LoggerFactory.getLogger(RecordEnricher.class);

    public static final String FLIGHT_DATE = "flight_date";
    public static final String MONTH = "month";
    public static final String MONTH_NAME = "month_name";
    public static final String OPERATING_AIRLINE = "operating_airline";
    public static final String ORIGIN_STATE = "origin_state";
    public static final String ORIGIN_STATE_ABBR = "origin_state_abbr";
    public static final String DESTINATION_STATE = "destination_state";
    public static final String ORIGIN_AIRPORT = "origin_airport";
    public static final String DESTINATION_AIRPORT = "destination_airport";
    public static final String SCHEDULED_DEPARTURE_HOUR = "scheduled_departure_hour";
    public static final String SCHEDULED_DEPARTURE_HHMM = "scheduled_departure_hhmm";
    public static final String PRIMARY_DELAY_CAUSE = "primary_delay_cause";
    public static final String IS_CANCELLED = "is_cancelled";
    public static final String DEPARTURE_DELAY_MIN = "departure_delay_min";
    public static final String ARRIVAL_DELAY_MIN = "arrival_delay_min";
    public static final String TOTAL_DELAY_MIN = "total_delay_min";

    private static final Set<String> STATE_PLACEHOLDERS = ImmutableSet.of("nan", "None", "none");
    private static final Set<String> CAUSE_PLACEHOLDERS =
            ImmutableSet.of("nan", "none", "None", "No Delay", "NO DELAY");

    private static final DateTimeFormatter FLIGHT_DATE_FORMAT = new DateTimeFormatterBuilder()
            .append(null, new DateTimeParser[]{
                    DateTimeFormat.forPattern("yyyy-MM-dd'T'HH:mm:ss").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd HH:mm:ss").getParser(),
                    DateTimeFormat.forPattern("yyyy-MM-dd").getParser(),
                    DateTimeFormat.forPattern("M/d/yyyy h:mm:ss a").getParser(),
                    DateTimeFormat.forPattern("M/d/yyyy").getParser()})
            .toFormatter()
            .withLocale(Locale.ENGLISH);

    private final Meter recordsEnriched = Metrics.meter(RecordEnricher.class, "recordsEnriched");
    private final Counter coercionFailures = Metrics.counter(RecordEnricher.class, "coercionFailures");

    /**
     * Enrich every row of a chunk, in order. Which source each derived field comes from is
     * decided once per distinct header rather than once per row.
     */
    public List<FlightRecord> enrich(List<RawRecord> chunk) {
        List<FlightRecord> enriched = Lists.newArrayListWithCapacity(chunk.size());
        RawRecord.Header lastHeader = null;
        Sources sources = null;
        for (RawRecord raw : chunk) {
            if (raw.getHeader() != lastHeader) {
                lastHeader = raw.getHeader();
                sources = new Sources(lastHeader);
            }
            enriched.add(enrich(raw, sources));
        }
        recordsEnriched.mark(chunk.size());
        return enriched;
    }

    private FlightRecord enrich(RawRecord raw, Sources sources) {
        FlightRecord.Builder builder = FlightRecord.newBuilder();

        if (sources.monthColumns) {
            builder.setMonth(toMonth(raw.get(MONTH)))
                    .setMonthName(text(raw.get(MONTH_NAME)));
        } else {
            LocalDateTime flightDate = toDate(raw.get(FLIGHT_DATE));
            if (flightDate != null) {
                builder.setMonth(flightDate.getMonthOfYear())
                        .setMonthName(flightDate.monthOfYear().getAsText(Locale.ENGLISH));
            }
        }

        String originState = stateName(raw.get(ORIGIN_STATE));
        builder.setOriginState(originState)
                .setDestinationState(stateName(raw.get(DESTINATION_STATE)));
        if (sources.stateAbbrColumn) {
            builder.setOriginStateAbbr(text(raw.get(ORIGIN_STATE_ABBR)));
        } else {
            builder.setOriginStateAbbr(StateAbbreviations.abbreviate(originState));
        }

        if (sources.hourColumn) {
            builder.setScheduledDepartureHour(toInteger(raw.get(SCHEDULED_DEPARTURE_HOUR)));
        } else if (sources.hhmmColumn) {
            builder.setScheduledDepartureHour(hhmmToHour(raw.get(SCHEDULED_DEPARTURE_HHMM)));
        }

        FlightRecord record = builder
                .setOperatingAirline(text(raw.get(OPERATING_AIRLINE)))
                .setOriginAirport(text(raw.get(ORIGIN_AIRPORT)))
                .setDestinationAirport(text(raw.get(DESTINATION_AIRPORT)))
                .setPrimaryDelayCause(causeText(raw.get(PRIMARY_DELAY_CAUSE)))
                .setCancelled(toCancelledFlag(raw.get(IS_CANCELLED)))
                .setDepartureDelayMin(toMinutes(raw.get(DEPARTURE_DELAY_MIN)))
                .setArrivalDelayMin(toMinutes(raw.get(ARRIVAL_DELAY_MIN)))
                .setTotalDelayMin(toMinutes(raw.get(TOTAL_DELAY_MIN)))
                .build();

        return record.withDelayCause(DelayCauseRule.label(record));
    }

    private static String text(String value) {
        return StringUtils.trimToNull(value);
    }

    private static String stateName(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null || STATE_PLACEHOLDERS.contains(trimmed)) {
            return null;
        }
        return trimmed;
    }

    private static String causeText(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null || CAUSE_PLACEHOLDERS.contains(trimmed)) {
            return null;
        }
        return trimmed;
    }

    /**
     * Blank and NaN values are missing, anything else that isn't a finite number is a coercion
     * failure. Either way the result is null.
     */
    private Double toNumber(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null || trimmed.equalsIgnoreCase("nan")) {
            return null;
        }
        double parsed = NumberUtils.toDouble(trimmed, Double.NaN);
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            coercionFailed(trimmed, "number");
            return null;
        }
        return parsed;
    }

    double toMinutes(String value) {
        Double number = toNumber(value);
        return number == null ? 0d : number;
    }

    Integer toInteger(String value) {
        Double number = toNumber(value);
        if (number == null) {
            return null;
        }
        if (number != Math.rint(number)) {
            coercionFailed(value, "whole number");
            return null;
        }
        return number.intValue();
    }

    private Integer toMonth(String value) {
        Integer month = toInteger(value);
        if (month != null && (month < 1 || month > 12)) {
            coercionFailed(value, "month");
            return null;
        }
        return month;
    }

    boolean toCancelledFlag(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return false;
        }
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        }
        if (trimmed.equalsIgnoreCase("false")) {
            return false;
        }
        Double number = toNumber(trimmed);
        return number != null && number.intValue() == 1;
    }

    /**
     * A scheduled time like 530 or 0530 is hour 5.
     */
    Integer hhmmToHour(String value) {
        Integer hhmm = toInteger(value);
        if (hhmm == null) {
            return null;
        }
        if (hhmm < 0 || hhmm > 2400) {
            coercionFailed(value, "HHMM time");
            return null;
        }
        return hhmm / 100;
    }

    LocalDateTime toDate(String value) {
        String trimmed = StringUtils.trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return FLIGHT_DATE_FORMAT.parseLocalDateTime(trimmed);
        } catch (IllegalArgumentException e) {
            coercionFailed(trimmed, "date");
            return null;
        }
    }

    private void coercionFailed(String value, String expected) {
        coercionFailures.inc();
        if (log.isDebugEnabled()) {
            log.debug("Couldn't read '" + value + "' as a " + expected + ", using the default");
        }
    }

    /**
     * Which columns a header offers for the fields that can come from more than one place.
     */
    private static final class Sources {
        final boolean monthColumns;
        final boolean stateAbbrColumn;
        final boolean hourColumn;
        final boolean hhmmColumn;

        Sources(RawRecord.Header header) {
            monthColumns = header.contains(MONTH) && header.contains(MONTH_NAME);
            stateAbbrColumn = header.contains(ORIGIN_STATE_ABBR);
            hourColumn = header.contains(SCHEDULED_DEPARTURE_HOUR);
            hhmmColumn = header.contains(SCHEDULED_DEPARTURE_HHMM);
        }
    }
}
