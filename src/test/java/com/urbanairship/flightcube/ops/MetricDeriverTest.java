package com.urbanairship.flightcube.ops;

import com.urbanairship.flightcube.records.FlightRecord;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MetricDeriverTest {

    private static FlightRecord flight(double dep, double arr, boolean cancelled) {
        return FlightRecord.newBuilder()
                .setDepartureDelayMin(dep)
                .setArrivalDelayMin(arr)
                .setTotalDelayMin(dep + arr)
                .setCancelled(cancelled)
                .build();
    }

    @Test
    public void testThresholdsAreInclusive() {
        MetricsOp op = MetricDeriver.derive(flight(15, 120, false));
        assertEquals(1L, op.getCount(Metric.DEP_DELAYED_ANY));
        assertEquals(1L, op.getCount(Metric.DEP_DELAYED_15));
        assertEquals(0L, op.getCount(Metric.DEP_DELAYED_30));
        assertEquals(1L, op.getCount(Metric.ARR_DELAYED_60));
        assertEquals(1L, op.getCount(Metric.ARR_DELAYED_120));
    }

    @Test
    public void testAnyIsStrictlyPositive() {
        MetricsOp op = MetricDeriver.derive(flight(0, 0.5, false));
        assertEquals(0L, op.getCount(Metric.DEP_DELAYED_ANY));
        assertEquals(1L, op.getCount(Metric.ARR_DELAYED_ANY));
        assertEquals(0L, op.getCount(Metric.ARR_DELAYED_15));
        assertEquals(0L, op.getCount(Metric.ON_TIME_FLIGHTS));
    }

    @Test
    public void testOnTimeUsesArrivalOnly() {
        MetricsOp op = MetricDeriver.derive(flight(40, 0, false));
        assertEquals(1L, op.getCount(Metric.ON_TIME_FLIGHTS));
        assertEquals(1L, op.getCount(Metric.DEP_DELAYED_30));
    }

    @Test
    public void testEarlyArrivalIsNotOnTime() {
        MetricsOp op = MetricDeriver.derive(flight(0, -3, false));
        assertEquals(0L, op.getCount(Metric.ON_TIME_FLIGHTS));
        assertEquals(0L, op.getCount(Metric.ARR_DELAYED_ANY));
        assertEquals(-3d, op.getMinutes(Metric.SUM_ARRIVAL_DELAY_MIN), 0d);
    }

    @Test
    public void testCancelledIsNeverOnTime() {
        MetricsOp op = MetricDeriver.derive(flight(0, 0, true));
        assertEquals(1L, op.getFlights());
        assertEquals(1L, op.getCount(Metric.CANCELLED_FLIGHTS));
        assertEquals(0L, op.getCount(Metric.ON_TIME_FLIGHTS));
    }

    @Test
    public void testMinuteSums() {
        MetricsOp op = MetricDeriver.derive(flight(-4, 12, false));
        assertEquals(-4d, op.getMinutes(Metric.SUM_DEPARTURE_DELAY_MIN), 0d);
        assertEquals(12d, op.getMinutes(Metric.SUM_ARRIVAL_DELAY_MIN), 0d);
        assertEquals(8d, op.getMinutes(Metric.SUM_TOTAL_DELAY_MIN), 0d);
    }

    @Test
    public void testCountsNestAndStayWithinFlights() {
        double[] delays = {-30, -1, 0, 1, 14, 15, 29, 30, 59, 60, 119, 120, 500};
        for (double dep : delays) {
            for (double arr : delays) {
                for (boolean cancelled : new boolean[]{true, false}) {
                    MetricsOp op = MetricDeriver.derive(flight(dep, arr, cancelled));
                    assertTrue(op.getCount(Metric.ON_TIME_FLIGHTS) + op.getCount(Metric.CANCELLED_FLIGHTS)
                            <= op.getFlights());
                    assertNested(op, Metric.DEP_DELAYED_ANY, Metric.DEP_DELAYED_15, Metric.DEP_DELAYED_30,
                            Metric.DEP_DELAYED_60, Metric.DEP_DELAYED_120);
                    assertNested(op, Metric.ARR_DELAYED_ANY, Metric.ARR_DELAYED_15, Metric.ARR_DELAYED_30,
                            Metric.ARR_DELAYED_60, Metric.ARR_DELAYED_120);
                }
            }
        }
    }

    private static void assertNested(MetricsOp op, Metric... widestFirst) {
        for (int i = 1; i < widestFirst.length; i++) {
            assertTrue(widestFirst[i] + " exceeds " + widestFirst[i - 1],
                    op.getCount(widestFirst[i - 1]) >= op.getCount(widestFirst[i]));
        }
    }
}
