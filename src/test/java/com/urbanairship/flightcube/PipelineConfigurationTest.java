package com.urbanairship.flightcube;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class PipelineConfigurationTest {

    @Test
    public void testDefaults() {
        PipelineConfiguration config = PipelineConfiguration.newBuilder().setInput(Paths.get("in.csv")).build();
        assertEquals(Paths.get("in.csv"), config.input);
        assertEquals(Paths.get("data/processed/dashboard"), config.outputDir);
        assertEquals(500000, config.chunkSize);
        assertEquals(150, config.topAirports);
    }

    @Test
    public void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("flightcube.input", " flights.csv ");
        properties.setProperty("flightcube.output.dir", "/tmp/cubes");
        properties.setProperty("flightcube.chunk.size", "1000");
        properties.setProperty("flightcube.top.airports", "0");

        PipelineConfiguration config = PipelineConfiguration.fromProperties(properties);
        assertEquals(Paths.get("flights.csv"), config.input);
        assertEquals(Paths.get("/tmp/cubes"), config.outputDir);
        assertEquals(1000, config.chunkSize);
        assertEquals(0, config.topAirports);
    }

    @Test(expected = NullPointerException.class)
    public void testMissingInput() {
        PipelineConfiguration.fromProperties(new Properties());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChunkSizeMustBePositive() {
        PipelineConfiguration.newBuilder().setInput(Paths.get("in.csv")).setChunkSize(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTopAirports() {
        PipelineConfiguration.newBuilder().setInput(Paths.get("in.csv")).setTopAirports(-1).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testChunkSizeNotANumber() {
        Properties properties = new Properties();
        properties.setProperty("flightcube.input", "flights.csv");
        properties.setProperty("flightcube.chunk.size", "lots");
        PipelineConfiguration.fromProperties(properties);
    }
}
