package com.urbanairship.flightcube;

import com.codahale.metrics.Timer;
import com.google.common.collect.ImmutableList;
import com.urbanairship.flightcube.metrics.Metrics;
import com.urbanairship.flightcube.ops.Metric;
import com.urbanairship.flightcube.ops.MetricsOp;
import com.urbanairship.flightcube.records.RecordEnricher;
import org.junit.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CubeAggregatorTest {
    private final DataCube<MetricsOp> cube = FlightCubes.newCube();

    private EnrichedChunk chunk() {
        return EnrichedChunk.of(new RecordEnricher().enrich(ImmutableList.of(
                TestUtil.flight("AA", "California", "LAX", 1, 20, 10, false),
                TestUtil.flight("AA", "California", "SFO", 1, 0, 0, false),
                TestUtil.flight("DL", "nan", "ATL", 2, 0, 0, true))));
    }

    @Test
    public void testAggregateOneRollup() {
        Batch<MetricsOp> core = CubeAggregator.aggregate(cube, FlightCubes.CORE, chunk());
        assertEquals(2, core.size());

        MetricsOp aa = core.getMap().get(new Address(FlightCubes.CORE, Arrays.asList(1, "January", "CA", "AA")));
        assertEquals(2L, aa.getFlights());
        assertEquals(20d, aa.getMinutes(Metric.SUM_DEPARTURE_DELAY_MIN), 0d);

        MetricsOp dl = core.getMap().get(new Address(FlightCubes.CORE, Arrays.asList(2, "February", null, "DL")));
        assertEquals(1L, dl.getCount(Metric.CANCELLED_FLIGHTS));
    }

    @Test
    public void testAggregateAll() throws InterruptedException {
        CubeAggregator aggregator = new CubeAggregator(cube, 2);
        try {
            Map<Rollup, Batch<MetricsOp>> partials = aggregator.aggregateAll(chunk());
            assertEquals(FlightCubes.ROLLUPS, ImmutableList.copyOf(partials.keySet()));
            assertEquals(2, partials.get(FlightCubes.CORE).size());
            assertEquals(3, partials.get(FlightCubes.AIRPORT_TOP).size());
            assertEquals(3, partials.get(FlightCubes.CAUSE).size());
            for (Rollup rollup : FlightCubes.ROLLUPS) {
                assertEquals(CubeAggregator.aggregate(cube, rollup, chunk()).getMap(), partials.get(rollup).getMap());
            }
        } finally {
            aggregator.close();
        }
    }

    @Test
    public void testFailedChunkIsStillTimed() throws InterruptedException {
        Timer timer = Metrics.timer(CubeAggregator.class, "aggregateChunk");
        long before = timer.getCount();
        EnrichedChunk incomplete = new EnrichedChunk(
                ImmutableList.of(new WriteBuilder().at(FlightCubes.OPERATING_AIRLINE, "AA")),
                ImmutableList.of(MetricsOp.newBuilder().setCount(Metric.FLIGHTS, 1).build()));

        CubeAggregator aggregator = new CubeAggregator(cube, 2);
        try {
            aggregator.aggregateAll(incomplete);
            fail("expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("No coordinate"));
        } finally {
            aggregator.close();
        }
        assertEquals(before + 1, timer.getCount());
    }
}
