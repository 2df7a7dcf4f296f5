package com.urbanairship.flightcube;

import com.urbanairship.flightcube.io.CubeTables;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class FlightCubeJobTest {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Properties overrides(Path outputDir) {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfiguration.OUTPUT_DIR_KEY, outputDir.toString());
        properties.setProperty("unrelated.setting", "ignored");
        return properties;
    }

    @Test
    public void testSuccess() throws Exception {
        Path input = TestUtil.writeCsv(tmp.newFile("flights.csv").toPath(), Arrays.asList(
                TestUtil.csvLine("AA", "California", "LAX", 1, 20, 10, false)));
        Path outputDir = tmp.getRoot().toPath().resolve("dashboard");

        assertEquals(FlightCubeJob.EXIT_OK, FlightCubeJob.run(new String[]{input.toString()}, overrides(outputDir)));
        assertTrue(CubeTables.missingTables(outputDir).isEmpty());
    }

    @Test
    public void testBuildFailure() throws Exception {
        Path outputDir = tmp.getRoot().toPath().resolve("dashboard");
        String missing = tmp.getRoot().toPath().resolve("nope.csv").toString();

        assertEquals(FlightCubeJob.EXIT_FAILED, FlightCubeJob.run(new String[]{missing}, overrides(outputDir)));
        assertEquals(CubeTables.publishedFileNames(), CubeTables.missingTables(outputDir));
    }

    @Test
    public void testUsage() throws Exception {
        Properties properties = overrides(tmp.getRoot().toPath());
        assertEquals(FlightCubeJob.EXIT_USAGE, FlightCubeJob.run(new String[0], properties));

        properties.setProperty(PipelineConfiguration.CHUNK_SIZE_KEY, "-5");
        assertEquals(FlightCubeJob.EXIT_USAGE, FlightCubeJob.run(new String[]{"in.csv"}, properties));
    }

    @Test
    public void testConfigureLayers() throws Exception {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfiguration.INPUT_KEY, "from-properties.csv");
        properties.setProperty(PipelineConfiguration.TOP_AIRPORTS_KEY, "12");

        PipelineConfiguration config = FlightCubeJob.configure(new String[]{"from-args.csv"}, properties);
        assertEquals(Paths.get("from-args.csv"), config.input);
        assertEquals(12, config.topAirports);
        // from flightcube.properties on the classpath
        assertEquals(500000, config.chunkSize);

        assertEquals(Paths.get("from-properties.csv"), FlightCubeJob.configure(new String[0], properties).input);
    }
}
