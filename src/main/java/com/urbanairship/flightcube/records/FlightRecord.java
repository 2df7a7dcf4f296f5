/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.records;

import com.google.common.base.MoreObjects;

/**
 * One flight after enrichment. Every field has a value or an explicit null, so grouping never
 * depends on which columns the input file happened to have. Build instances with
 * {@link #newBuilder()} or {@link RecordEnricher}.
 */
public class FlightRecord {
    private final Integer month;
    private final String monthName;
    private final String operatingAirline;
    private final String originState;
    private final String originStateAbbr;
    private final String destinationState;
    private final String originAirport;
    private final String destinationAirport;
    private final Integer scheduledDepartureHour;
    private final String primaryDelayCause;
    private final String delayCause;
    private final boolean cancelled;
    private final double departureDelayMin;
    private final double arrivalDelayMin;
    private final double totalDelayMin;

    private FlightRecord(Builder builder) {
        month = builder.month;
        monthName = builder.monthName;
        operatingAirline = builder.operatingAirline;
        originState = builder.originState;
        originStateAbbr = builder.originStateAbbr;
        destinationState = builder.destinationState;
        originAirport = builder.originAirport;
        destinationAirport = builder.destinationAirport;
        scheduledDepartureHour = builder.scheduledDepartureHour;
        primaryDelayCause = builder.primaryDelayCause;
        delayCause = builder.delayCause;
        cancelled = builder.cancelled;
        departureDelayMin = builder.departureDelayMin;
        arrivalDelayMin = builder.arrivalDelayMin;
        totalDelayMin = builder.totalDelayMin;
    }

    public Integer getMonth() {
        return month;
    }

    public String getMonthName() {
        return monthName;
    }

    public String getOperatingAirline() {
        return operatingAirline;
    }

    /**
     * Full state name, for example "California".
     */
    public String getOriginState() {
        return originState;
    }

    /**
     * Two letter code, for example "CA".
     */
    public String getOriginStateAbbr() {
        return originStateAbbr;
    }

    public String getDestinationState() {
        return destinationState;
    }

    public String getOriginAirport() {
        return originAirport;
    }

    public String getDestinationAirport() {
        return destinationAirport;
    }

    public Integer getScheduledDepartureHour() {
        return scheduledDepartureHour;
    }

    /**
     * The cause text from the input, trimmed, or null if it was blank or a placeholder.
     */
    public String getPrimaryDelayCause() {
        return primaryDelayCause;
    }

    /**
     * The delay-cause bucket, see {@link DelayCauseRule}. Null until assigned.
     */
    public String getDelayCause() {
        return delayCause;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public double getDepartureDelayMin() {
        return departureDelayMin;
    }

    public double getArrivalDelayMin() {
        return arrivalDelayMin;
    }

    public double getTotalDelayMin() {
        return totalDelayMin;
    }

    public FlightRecord withDelayCause(String delayCause) {
        return toBuilder().setDelayCause(delayCause).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .setMonth(month)
                .setMonthName(monthName)
                .setOperatingAirline(operatingAirline)
                .setOriginState(originState)
                .setOriginStateAbbr(originStateAbbr)
                .setDestinationState(destinationState)
                .setOriginAirport(originAirport)
                .setDestinationAirport(destinationAirport)
                .setScheduledDepartureHour(scheduledDepartureHour)
                .setPrimaryDelayCause(primaryDelayCause)
                .setDelayCause(delayCause)
                .setCancelled(cancelled)
                .setDepartureDelayMin(departureDelayMin)
                .setArrivalDelayMin(arrivalDelayMin)
                .setTotalDelayMin(totalDelayMin);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("month", month)
                .add("monthName", monthName)
                .add("operatingAirline", operatingAirline)
                .add("originState", originState)
                .add("originStateAbbr", originStateAbbr)
                .add("destinationState", destinationState)
                .add("originAirport", originAirport)
                .add("destinationAirport", destinationAirport)
                .add("scheduledDepartureHour", scheduledDepartureHour)
                .add("delayCause", delayCause)
                .add("cancelled", cancelled)
                .add("departureDelayMin", departureDelayMin)
                .add("arrivalDelayMin", arrivalDelayMin)
                .add("totalDelayMin", totalDelayMin)
                .toString();
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private Integer month;
        private String monthName;
        private String operatingAirline;
        private String originState;
        private String originStateAbbr;
        private String destinationState;
        private String originAirport;
        private String destinationAirport;
        private Integer scheduledDepartureHour;
        private String primaryDelayCause;
        private String delayCause;
        private boolean cancelled;
        private double departureDelayMin;
        private double arrivalDelayMin;
        private double totalDelayMin;

        private Builder() {
        }

        public Builder setMonth(Integer month) {
            this.month = month;
            return this;
        }

        public Builder setMonthName(String monthName) {
            this.monthName = monthName;
            return this;
        }

        public Builder setOperatingAirline(String operatingAirline) {
            this.operatingAirline = operatingAirline;
            return this;
        }

        public Builder setOriginState(String originState) {
            this.originState = originState;
            return this;
        }

        public Builder setOriginStateAbbr(String originStateAbbr) {
            this.originStateAbbr = originStateAbbr;
            return this;
        }

        public Builder setDestinationState(String destinationState) {
            this.destinationState = destinationState;
            return this;
        }

        public Builder setOriginAirport(String originAirport) {
            this.originAirport = originAirport;
            return this;
        }

        public Builder setDestinationAirport(String destinationAirport) {
            this.destinationAirport = destinationAirport;
            return this;
        }

        public Builder setScheduledDepartureHour(Integer scheduledDepartureHour) {
            this.scheduledDepartureHour = scheduledDepartureHour;
            return this;
        }

        public Builder setPrimaryDelayCause(String primaryDelayCause) {
            this.primaryDelayCause = primaryDelayCause;
            return this;
        }

        public Builder setDelayCause(String delayCause) {
            this.delayCause = delayCause;
            return this;
        }

        public Builder setCancelled(boolean cancelled) {
            this.cancelled = cancelled;
            return this;
        }

        public Builder setDepartureDelayMin(double departureDelayMin) {
            this.departureDelayMin = departureDelayMin;
            return this;
        }

        public Builder setArrivalDelayMin(double arrivalDelayMin) {
            this.arrivalDelayMin = arrivalDelayMin;
            return this;
        }

        public Builder setTotalDelayMin(double totalDelayMin) {
            this.totalDelayMin = totalDelayMin;
            return this;
        }

        public FlightRecord build() {
            return new FlightRecord(this);
        }
    }
}
