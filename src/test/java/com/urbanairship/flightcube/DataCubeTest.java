package com.urbanairship.flightcube;

import com.google.common.collect.ImmutableList;
import com.urbanairship.flightcube.ops.MetricsOp;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class DataCubeTest {
    private static final Dimension<String> AIRLINE = new Dimension<String>("airline", String.class);
    private static final Dimension<Integer> HOUR = new Dimension<Integer>("hour", Integer.class);
    private static final Dimension<String> OTHER = new Dimension<String>("other", String.class);

    private static final Rollup BY_AIRLINE = new Rollup("by_airline", AIRLINE);
    private static final Rollup BY_AIRLINE_HOUR = new Rollup("by_airline_hour", AIRLINE, HOUR);

    private final DataCube<MetricsOp> cube = new DataCube<MetricsOp>(ImmutableList.<Dimension<?>>of(AIRLINE, HOUR),
            ImmutableList.of(BY_AIRLINE, BY_AIRLINE_HOUR));

    @Test
    public void testNullCoordinateIsAGroup() {
        Address address = cube.addressFor(BY_AIRLINE_HOUR, new WriteBuilder().at(AIRLINE, "AA").at(HOUR, null));
        assertEquals("AA", address.get(AIRLINE));
        assertNull(address.get(HOUR));
        assertEquals(new Address(BY_AIRLINE_HOUR, Arrays.asList("AA", null)), address);
    }

    @Test
    public void testEveryRollupGetsAnAddress() {
        WriteBuilder coords = new WriteBuilder().at(AIRLINE, "DL").at(HOUR, 7);
        assertEquals(new Address(BY_AIRLINE, Arrays.asList("DL")), cube.addressFor(BY_AIRLINE, coords));
        assertEquals(new Address(BY_AIRLINE_HOUR, Arrays.<Object>asList("DL", 7)),
                cube.addressFor(BY_AIRLINE_HOUR, coords));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsetDimensionIsAnError() {
        cube.addressFor(BY_AIRLINE_HOUR, new WriteBuilder().at(AIRLINE, "DL"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRollupDimensionNotInCube() {
        new DataCube<MetricsOp>(ImmutableList.<Dimension<?>>of(AIRLINE), ImmutableList.of(new Rollup("x", OTHER)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateRollupName() {
        new DataCube<MetricsOp>(ImmutableList.<Dimension<?>>of(AIRLINE, HOUR),
                ImmutableList.of(new Rollup("x", AIRLINE), new Rollup("x", HOUR)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testAddressOfMissingDimension() {
        new Address(BY_AIRLINE, Arrays.asList("AA")).get(HOUR);
    }

    @Test
    public void testFlightCubesRollups() {
        DataCube<MetricsOp> flights = FlightCubes.newCube();
        assertEquals(5, flights.getRollups().size());
        assertEquals(ImmutableList.of(FlightCubes.MONTH, FlightCubes.MONTH_NAME, FlightCubes.OPERATING_AIRLINE,
                FlightCubes.ORIGIN_STATE, FlightCubes.DESTINATION_STATE, FlightCubes.DELAY_CAUSE),
                flights.getRollups().get(3).getComponents());
    }
}
