package com.urbanairship.flightcube.records;

import org.junit.Test;

import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class DelayCauseRuleTest {

    private static FlightRecord.Builder flight(double dep, double arr, boolean cancelled, String cause) {
        return FlightRecord.newBuilder()
                .setDepartureDelayMin(dep)
                .setArrivalDelayMin(arr)
                .setCancelled(cancelled)
                .setPrimaryDelayCause(cause);
    }

    @Test
    public void testEachRuleAlone() {
        assertEquals(Optional.of("Cancelled"), DelayCauseRule.CANCELLED.apply(flight(30, 30, true, "Weather").build()));
        assertFalse(DelayCauseRule.CANCELLED.apply(flight(0, 0, false, null).build()).isPresent());

        assertEquals(Optional.of("On Time"), DelayCauseRule.ON_TIME.apply(flight(0, -5, false, "Weather").build()));
        assertFalse(DelayCauseRule.ON_TIME.apply(flight(0, 1, false, null).build()).isPresent());

        assertEquals(Optional.of("Unknown"), DelayCauseRule.UNKNOWN.apply(flight(5, 5, false, "  ").build()));
        assertFalse(DelayCauseRule.UNKNOWN.apply(flight(5, 5, false, "NAS").build()).isPresent());

        assertEquals(Optional.of("NAS"), DelayCauseRule.EXPLICIT_CAUSE.apply(flight(5, 5, false, " NAS ").build()));
    }

    @Test
    public void testCancelledWins() {
        assertEquals(DelayCauseRule.CANCELLED_LABEL, DelayCauseRule.label(flight(0, 0, true, null).build()));
        assertEquals(DelayCauseRule.CANCELLED_LABEL, DelayCauseRule.label(flight(90, 90, true, "Carrier").build()));
    }

    @Test
    public void testRuleOrder() {
        assertEquals(DelayCauseRule.ON_TIME_LABEL, DelayCauseRule.label(flight(0, 0, false, "Carrier").build()));
        assertEquals(DelayCauseRule.UNKNOWN_LABEL, DelayCauseRule.label(flight(0, 3, false, null).build()));
        assertEquals("Carrier", DelayCauseRule.label(flight(12, -3, false, "Carrier").build()));
    }

    @Test
    public void testExactlyOneLabel() {
        double[] delays = {-5, 0, 5};
        String[] causes = {null, "", "Weather"};
        for (double dep : delays) {
            for (double arr : delays) {
                for (String cause : causes) {
                    for (boolean cancelled : new boolean[]{true, false}) {
                        FlightRecord record = flight(dep, arr, cancelled, cause).build();
                        String label = DelayCauseRule.label(record);
                        if (cancelled) {
                            assertEquals(DelayCauseRule.CANCELLED_LABEL, label);
                        } else if (dep <= 0 && arr <= 0) {
                            assertEquals(DelayCauseRule.ON_TIME_LABEL, label);
                        } else if (cause == null || cause.isEmpty()) {
                            assertEquals(DelayCauseRule.UNKNOWN_LABEL, label);
                        } else {
                            assertEquals(cause, label);
                        }
                    }
                }
            }
        }
    }
}
