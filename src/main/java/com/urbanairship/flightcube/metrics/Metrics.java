/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.metrics;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;
import com.codahale.metrics.Timer;
import org.slf4j.Logger;

import java.util.concurrent.TimeUnit;

/**
 * A Singleton for a MetricsRegistry. It's here for consistency within this project and as a
 * convenience, callers may create their own {@link MetricRegistry} instances if they prefer.
 *
 * This class also exposes simple pass through statics for static imports against a single
 * class if desired.
 */
public final class Metrics {

    private Metrics() {
        //no instances
    }

    private static final MetricRegistry registry = new MetricRegistry();

    public static String name(Class clazz, String name) {
        return MetricRegistry.name(clazz, name);
    }

    public static String name(Class clazz, String name, String scope) {
        return MetricRegistry.name(clazz, name, scope);
    }

    public static Meter meter(Class clazz, String name) {
        return registry.meter(name(clazz, name));
    }

    public static Counter counter(Class clazz, String name) {
        return registry.counter(name(clazz, name));
    }

    public static Histogram histogram(Class clazz, String name) {
        return registry.histogram(name(clazz, name));
    }

    public static Histogram histogram(Class clazz, String name, String scope) {
        return registry.histogram(name(clazz, name, scope));
    }

    public static Timer timer(Class clazz, String name) {
        return registry.timer(name(clazz, name));
    }

    /**
     * Write the current value of every registered metric to the given logger, once. A batch job
     * calls this when it finishes instead of running a scheduled reporter.
     */
    public static void reportTo(Logger logger) {
        Slf4jReporter.forRegistry(registry)
                .outputTo(logger)
                .convertDurationsTo(TimeUnit.MILLISECONDS)
                .convertRatesTo(TimeUnit.SECONDS)
                .build()
                .report();
    }
}
