/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import org.apache.commons.lang.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings for one cube build.
 */
public final class PipelineConfiguration {
    public static final String INPUT_KEY = "flightcube.input";
    public static final String OUTPUT_DIR_KEY = "flightcube.output.dir";
    public static final String CHUNK_SIZE_KEY = "flightcube.chunk.size";
    public static final String TOP_AIRPORTS_KEY = "flightcube.top.airports";

    public static final Path DEFAULT_OUTPUT_DIR = Paths.get("data", "processed", "dashboard");
    public static final int DEFAULT_CHUNK_SIZE = 500000;
    public static final int DEFAULT_TOP_AIRPORTS = 150;

    public final Path input;
    public final Path outputDir;
    public final int chunkSize;
    public final int topAirports;

    private PipelineConfiguration(Path input, Path outputDir, int chunkSize, int topAirports) {
        this.input = input;
        this.outputDir = outputDir;
        this.chunkSize = chunkSize;
        this.topAirports = topAirports;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Settings from {@code flightcube.*} properties, defaults for the ones that aren't there.
     *
     * @throws IllegalArgumentException if a number doesn't parse or a setting is out of range
     * @throws NullPointerException if there is no input path
     */
    public static PipelineConfiguration fromProperties(Properties properties) {
        Builder builder = newBuilder();
        String input = StringUtils.trimToNull(properties.getProperty(INPUT_KEY));
        if (input != null) {
            builder.setInput(Paths.get(input));
        }
        String outputDir = StringUtils.trimToNull(properties.getProperty(OUTPUT_DIR_KEY));
        if (outputDir != null) {
            builder.setOutputDir(Paths.get(outputDir));
        }
        String chunkSize = StringUtils.trimToNull(properties.getProperty(CHUNK_SIZE_KEY));
        if (chunkSize != null) {
            builder.setChunkSize(parseInt(CHUNK_SIZE_KEY, chunkSize));
        }
        String topAirports = StringUtils.trimToNull(properties.getProperty(TOP_AIRPORTS_KEY));
        if (topAirports != null) {
            builder.setTopAirports(parseInt(TOP_AIRPORTS_KEY, topAirports));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number, got " + value, e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("input", input)
                .add("outputDir", outputDir)
                .add("chunkSize", chunkSize)
                .add("topAirports", topAirports)
                .toString();
    }

    public static final class Builder {
        private Path input = null;
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int topAirports = DEFAULT_TOP_AIRPORTS;

        private Builder() { }

        public Builder setInput(Path input) {
            this.input = input;
            return this;
        }

        public Builder setOutputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder setTopAirports(int topAirports) {
            this.topAirports = topAirports;
            return this;
        }

        public PipelineConfiguration build() {
            Preconditions.checkNotNull(input, "No input file given, set %s", INPUT_KEY);
            Preconditions.checkNotNull(outputDir, "No output directory given, set %s", OUTPUT_DIR_KEY);
            Preconditions.checkArgument(chunkSize > 0, "%s must be positive, got %s", CHUNK_SIZE_KEY, chunkSize);
            Preconditions.checkArgument(topAirports >= 0, "%s must not be negative, got %s",
                    TOP_AIRPORTS_KEY, topAirports);

            return new PipelineConfiguration(input, outputDir, chunkSize, topAirports);
        }
    }
}
