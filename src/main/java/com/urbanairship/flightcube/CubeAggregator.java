/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

import com.codahale.metrics.Histogram;
import com.codahale.metrics.Timer;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.urbanairship.flightcube.metrics.Metrics;
import com.urbanairship.flightcube.ops.MetricsOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;

/**
 * Groups a chunk of flights by the address of each rollup and sums the metric vectors of each
 * group. The result for a chunk is a partial {@link Batch} per rollup, to be merged into the
 * running totals by the caller.
 *
 * The rollups of one chunk are aggregated concurrently, one task per rollup. Thread safe.
 */
public class CubeAggregator implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(CubeAggregator.class);

    private final Timer chunkTimer = Metrics.timer(CubeAggregator.class, "aggregateChunk");
    private final Histogram chunkSizes = Metrics.histogram(CubeAggregator.class, "chunkSize");

    private final DataCube<MetricsOp> cube;
    private final ExecutorService executorService;

    /**
     * @param cube the rollups to aggregate
     * @param threads concurrency level, normally one per rollup
     */
    public CubeAggregator(DataCube<MetricsOp> cube, int threads) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setDaemon(true)
                .setNameFormat("flightcube aggregator %d")
                .setUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
                    @Override
                    public void uncaughtException(Thread t, Throwable e) {
                        log.error("Uncaught error from aggregator thread", e);
                    }
                })
                .build();

        this.cube = cube;
        this.executorService = Executors.newFixedThreadPool(threads, threadFactory);
    }

    /**
     * Partial aggregation of a single rollup over one chunk. Flights with a null coordinate form
     * their own group.
     */
    public static Batch<MetricsOp> aggregate(DataCube<MetricsOp> cube, Rollup rollup, EnrichedChunk chunk) {
        Batch<MetricsOp> batch = new Batch<MetricsOp>();
        for (int i = 0; i < chunk.size(); i++) {
            batch.add(cube.addressFor(rollup, chunk.getCoordinates(i)), chunk.getOp(i));
        }
        return batch;
    }

    /**
     * Aggregate every rollup of the cube over one chunk.
     *
     * @return the partial batch of each rollup, in the cube's rollup order.
     */
    public Map<Rollup, Batch<MetricsOp>> aggregateAll(EnrichedChunk chunk) throws InterruptedException {
        Timer.Context timer = chunkTimer.time();
        chunkSizes.update(chunk.size());

        List<Callable<Batch<MetricsOp>>> callableList = new ArrayList<Callable<Batch<MetricsOp>>>();
        for (Rollup rollup : cube.getRollups()) {
            callableList.add(new AggregateCallable(rollup, chunk));
        }

        Map<Rollup, Batch<MetricsOp>> partials = Maps.newLinkedHashMap();
        try {
            List<Future<Batch<MetricsOp>>> futures = executorService.invokeAll(callableList);
            for (int i = 0; i < futures.size(); i++) {
                partials.put(cube.getRollups().get(i), futures.get(i).get());
            }
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RuntimeException(e.getCause());
        } finally {
            timer.stop();
        }
        return partials;
    }

    @Override
    public void close() {
        executorService.shutdown();
    }

    private class AggregateCallable implements Callable<Batch<MetricsOp>> {
        private final Rollup rollup;
        private final EnrichedChunk chunk;

        private AggregateCallable(Rollup rollup, EnrichedChunk chunk) {
            this.rollup = rollup;
            this.chunk = chunk;
        }

        @Override
        public Batch<MetricsOp> call() {
            return aggregate(cube, rollup, chunk);
        }
    }
}
