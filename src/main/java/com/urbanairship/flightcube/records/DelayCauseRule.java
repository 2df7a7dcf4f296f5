/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.records;

import org.apache.commons.lang.StringUtils;

import java.util.Optional;

/**
 * The rules that put every flight in exactly one delay-cause bucket. Rules are tried in
 * declaration order and the first one that matches decides the label, so a cancelled flight is
 * always "Cancelled" whatever its delay minutes say.
 */
public enum DelayCauseRule {
    CANCELLED {
        @Override
        public Optional<String> apply(FlightRecord record) {
            return record.isCancelled() ? Optional.of(CANCELLED_LABEL) : Optional.<String>empty();
        }
    },
    ON_TIME {
        @Override
        public Optional<String> apply(FlightRecord record) {
            boolean onTime = record.getDepartureDelayMin() <= 0 && record.getArrivalDelayMin() <= 0;
            return onTime ? Optional.of(ON_TIME_LABEL) : Optional.<String>empty();
        }
    },
    UNKNOWN {
        @Override
        public Optional<String> apply(FlightRecord record) {
            return StringUtils.isBlank(record.getPrimaryDelayCause())
                    ? Optional.of(UNKNOWN_LABEL) : Optional.<String>empty();
        }
    },
    EXPLICIT_CAUSE {
        @Override
        public Optional<String> apply(FlightRecord record) {
            return Optional.ofNullable(StringUtils.trimToNull(record.getPrimaryDelayCause()));
        }
    };

    public static final String CANCELLED_LABEL = "Cancelled";
    public static final String ON_TIME_LABEL = "On Time";
    public static final String UNKNOWN_LABEL = "Unknown";

    /**
     * @return the label if this rule matches the record, otherwise absent.
     */
    public abstract Optional<String> apply(FlightRecord record);

    /**
     * @return the label of the first matching rule.
     */
    public static String label(FlightRecord record) {
        for (DelayCauseRule rule : values()) {
            Optional<String> label = rule.apply(record);
            if (label.isPresent()) {
                return label.get();
            }
        }
        // EXPLICIT_CAUSE matches whenever UNKNOWN doesn't
        throw new IllegalStateException("No delay cause rule matched " + record);
    }
}
