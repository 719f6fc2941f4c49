package com.vitals.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer instrumentation for health aggregation requests.
 * <p>
 * Every resolved aggregation increments {@value #REQUESTS} and records its latency in
 * {@value #DURATION}, both tagged with the service name and the outcome.
 */
public final class AggregationMetrics {

    /** Counter of resolved aggregation requests. */
    public static final String REQUESTS = "vitals.aggregation.requests";

    /** Timer of aggregation latency, from fan-out to resolution. */
    public static final String DURATION = "vitals.aggregation.duration";

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    /** Tag key for the aggregation outcome. */
    public static final String TAG_OUTCOME = "outcome";

    /**
     * How an aggregation request was resolved.
     */
    public enum Outcome {
        SUCCESS,
        NO_WORKERS,
        WORKER_ERROR,
        TIMEOUT;

        public String tagValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates instrumentation bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a tag
     */
    public AggregationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Returns instrumentation that records into a private in-memory registry.
     */
    public static AggregationMetrics detached() {
        return new AggregationMetrics(new SimpleMeterRegistry(), "vitals");
    }

    /**
     * Records one resolved aggregation.
     */
    public void record(Outcome outcome, Duration elapsed) {
        Tags tags = baseTags(outcome);
        Counter.builder(REQUESTS)
                .description("Resolved health aggregation requests")
                .tags(tags)
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time from fan-out to resolution of a health aggregation")
                .tags(tags)
                .register(registry)
                .record(elapsed);
    }

    /**
     * Returns how many aggregations resolved with the given outcome.
     */
    public double count(Outcome outcome) {
        Counter counter = registry.find(REQUESTS).tags(baseTags(outcome)).counter();
        return counter == null ? 0 : counter.count();
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }

    private Tags baseTags(Outcome outcome) {
        return Tags.of(TAG_SERVICE, serviceName, TAG_OUTCOME, outcome.tagValue());
    }
}
