/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.io.Closeables;
import com.urbanairship.flightcube.io.CsvCubeTableSink;
import com.urbanairship.flightcube.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Command line entry point: builds the cube tables and exits with 0 on success, 1 if the build
 * failed and 2 if the settings are invalid.
 *
 * Settings come from {@code flightcube.properties} on the classpath, overridden by system
 * properties of the same name. A first argument, if given, is the input file.
 */
public class FlightCubeJob {
    private static final Logger log = LoggerFactory.getLogger(FlightCubeJob.class);

    public static final String PROPERTIES_RESOURCE = "flightcube.properties";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "Usage: flightcube [input.csv]\n"
            + "  -D" + PipelineConfiguration.INPUT_KEY + "=<input.csv>\n"
            + "  -D" + PipelineConfiguration.OUTPUT_DIR_KEY + "=<dir> (default "
            + PipelineConfiguration.DEFAULT_OUTPUT_DIR + ")\n"
            + "  -D" + PipelineConfiguration.CHUNK_SIZE_KEY + "=<rows> (default "
            + PipelineConfiguration.DEFAULT_CHUNK_SIZE + ")\n"
            + "  -D" + PipelineConfiguration.TOP_AIRPORTS_KEY + "=<n> (default "
            + PipelineConfiguration.DEFAULT_TOP_AIRPORTS + ")";

    public static void main(String[] args) {
        int status = run(args, System.getProperties());
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, Properties overrides) {
        PipelineConfiguration config;
        try {
            config = configure(args, overrides);
        } catch (IOException | IllegalArgumentException | NullPointerException e) {
            log.error("Invalid settings: " + e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            new FlightCubePipeline(config, new CsvCubeTableSink(config.outputDir)).run();
            return EXIT_OK;
        } catch (CubeBuildException e) {
            log.error("Cube build failed", e);
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while building cubes", e);
            return EXIT_FAILED;
        } finally {
            Metrics.reportTo(log);
        }
    }

    static PipelineConfiguration configure(String[] args, Properties overrides) throws IOException {
        Properties properties = new Properties();
        InputStream in = FlightCubeJob.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE);
        if (in != null) {
            try {
                properties.load(in);
            } finally {
                Closeables.closeQuietly(in);
            }
        }
        for (String name : overrides.stringPropertyNames()) {
            if (name.startsWith("flightcube.")) {
                properties.setProperty(name, overrides.getProperty(name));
            }
        }
        if (args.length > 0) {
            properties.setProperty(PipelineConfiguration.INPUT_KEY, args[0]);
        }
        return PipelineConfiguration.fromProperties(properties);
    }
}
