/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.codahale.metrics.Meter;
import com.google.common.base.Preconditions;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.urbanairship.flightcube.finalize.CubeFinalizer;
import com.urbanairship.flightcube.finalize.CubeRow;
import com.urbanairship.flightcube.finalize.TopNTrimmer;
import com.urbanairship.flightcube.io.ChunkedCsvReader;
import com.urbanairship.flightcube.io.CubeTableSink;
import com.urbanairship.flightcube.io.CubeTables;
import com.urbanairship.flightcube.metrics.Metrics;
import com.urbanairship.flightcube.ops.MetricsOp;
import com.urbanairship.flightcube.records.FlightRecord;
import com.urbanairship.flightcube.records.RawRecord;
import com.urbanairship.flightcube.records.RecordEnricher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Builds the five flight cube tables in one pass over the input file.
 *
 * Chunks are handled in file order. Each chunk is enriched once, then every rollup aggregates it
 * concurrently and the partial sums are added to that rollup's running totals on the calling
 * thread. The next chunk is read on a separate thread meanwhile. When the file is done the totals
 * are finalized, the airport table is trimmed to its busiest airports, and every table goes to
 * the {@link CubeTableSink}.
 *
 * Not thread safe, use one instance per run.
 */
public class FlightCubePipeline {
    private static final Logger log = LoggerFactory.getLogger(FlightCubePipeline.class);

    private static final long READER_SHUTDOWN_SECONDS = 60;

    private final Meter chunksProcessed = Metrics.meter(FlightCubePipeline.class, "chunksProcessed");

    private final PipelineConfiguration config;
    private final CubeTableSink sink;
    private final DataCube<MetricsOp> cube;
    private final RecordEnricher enricher;
    private final CubeFinalizer finalizer;
    private final TopNTrimmer airportTrimmer;

    public FlightCubePipeline(PipelineConfiguration config, CubeTableSink sink) {
        this.config = Preconditions.checkNotNull(config);
        this.sink = Preconditions.checkNotNull(sink);
        this.cube = FlightCubes.newCube();
        this.enricher = new RecordEnricher();
        this.finalizer = new CubeFinalizer(FlightCubes.MONTH);
        this.airportTrimmer = new TopNTrimmer(FlightCubes.ORIGIN_AIRPORT, config.topAirports);
    }

    /**
     * @return the rows written for each rollup.
     * @throws CubeBuildException if the input can't be read or has no records, or a table can't
     * be written.
     */
    public Map<Rollup, List<CubeRow>> run() throws CubeBuildException, InterruptedException {
        log.info("Building flight cubes with " + config);

        Map<Rollup, Batch<MetricsOp>> totals = accumulate();
        Map<Rollup, List<CubeRow>> tables = finalizeAll(totals);

        publish(tables);
        log.info("Wrote {} cube tables", tables.size());
        return tables;
    }

    /**
     * Either every table is published or none is.
     */
    private void publish(Map<Rollup, List<CubeRow>> tables) throws CubeBuildException {
        boolean committed = false;
        try {
            for (Map.Entry<Rollup, List<CubeRow>> table : tables.entrySet()) {
                try {
                    sink.write(table.getKey(), table.getValue());
                } catch (IOException e) {
                    throw new CubeBuildException("Couldn't write " + CubeTables.fileName(table.getKey()), e);
                }
            }
            try {
                sink.commit();
            } catch (IOException e) {
                throw new CubeBuildException("Couldn't publish cube tables", e);
            }
            committed = true;
        } finally {
            if (!committed) {
                sink.abort();
            }
        }
    }

    private Map<Rollup, Batch<MetricsOp>> accumulate() throws CubeBuildException, InterruptedException {
        ChunkedCsvReader reader;
        try {
            reader = ChunkedCsvReader.open(config.input, config.chunkSize);
        } catch (NoSuchFileException e) {
            throw new CubeBuildException("Input file not found: " + config.input, e);
        } catch (EOFException e) {
            throw new CubeBuildException("Input file has no header row: " + config.input, e);
        } catch (IOException e) {
            throw new CubeBuildException("Couldn't open input file " + config.input, e);
        }

        CubeAggregator aggregator = new CubeAggregator(cube, cube.getRollups().size());
        ExecutorService readAhead = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("flightcube reader %d")
                .build());
        try {
            Map<Rollup, Batch<MetricsOp>> totals = newTotals();
            long records = 0;

            Future<List<RawRecord>> next = readAhead.submit(new ReadChunk(reader));
            List<RawRecord> chunk;
            while ((chunk = awaitChunk(next)) != null) {
                next = readAhead.submit(new ReadChunk(reader));
                aggregateChunk(chunk, aggregator, totals);
                records += chunk.size();
                log.info("Aggregated chunk {}, {} records so far", chunksProcessed.getCount(), records);
            }

            if (records == 0) {
                throw new CubeBuildException("Input file has no records: " + config.input);
            }
            return totals;
        } finally {
            aggregator.close();
            readAhead.shutdown();
            if (!readAhead.awaitTermination(READER_SHUTDOWN_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Reader thread still running after {} seconds", READER_SHUTDOWN_SECONDS);
            }
            try {
                reader.close();
            } catch (IOException e) {
                log.warn("Couldn't close " + config.input, e);
            }
        }
    }

    Map<Rollup, Batch<MetricsOp>> newTotals() {
        Map<Rollup, Batch<MetricsOp>> totals = Maps.newLinkedHashMap();
        for (Rollup rollup : cube.getRollups()) {
            totals.put(rollup, new Batch<MetricsOp>());
        }
        return totals;
    }

    /**
     * Enrich one chunk, aggregate it for every rollup and add the partial sums to the totals.
     */
    void aggregateChunk(List<RawRecord> chunk, CubeAggregator aggregator, Map<Rollup, Batch<MetricsOp>> totals)
            throws InterruptedException {
        List<FlightRecord> flights = enricher.enrich(chunk);
        Map<Rollup, Batch<MetricsOp>> partials = aggregator.aggregateAll(EnrichedChunk.of(flights));
        for (Map.Entry<Rollup, Batch<MetricsOp>> partial : partials.entrySet()) {
            totals.get(partial.getKey()).putAll(partial.getValue());
        }
        chunksProcessed.mark();
    }

    /**
     * Finished rows of every rollup. The airport rollup keeps only its busiest airports.
     */
    Map<Rollup, List<CubeRow>> finalizeAll(Map<Rollup, Batch<MetricsOp>> totals) {
        Map<Rollup, List<CubeRow>> tables = Maps.newLinkedHashMap();
        for (Map.Entry<Rollup, Batch<MetricsOp>> entry : totals.entrySet()) {
            Rollup rollup = entry.getKey();
            List<CubeRow> rows = finalizer.finalizeRollup(rollup, entry.getValue());
            if (rollup.equals(FlightCubes.AIRPORT_TOP)) {
                rows = airportTrimmer.trim(rows);
            }
            tables.put(rollup, rows);
        }
        return tables;
    }

    private List<RawRecord> awaitChunk(Future<List<RawRecord>> future) throws CubeBuildException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException) {
                throw new CubeBuildException("Failed reading " + config.input, e.getCause().getCause());
            }
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        }
    }

    /**
     * Reads the next chunk, or null at the end of the file.
     */
    private static class ReadChunk implements Callable<List<RawRecord>> {
        private final ChunkedCsvReader reader;

        private ReadChunk(ChunkedCsvReader reader) {
            this.reader = reader;
        }

        @Override
        public List<RawRecord> call() {
            return reader.hasNext() ? reader.next() : null;
        }
    }
}
