package com.phillippitts.factopinion.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for classification batches.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Batch latency</li>
 *   <li>Success/failure counts, failures tagged by reason</li>
 *   <li>Sentences per batch</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class ClassificationMetrics {

    private static final String METRIC_PREFIX = "factopinion.classification";

    private final MeterRegistry registry;

    public ClassificationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of one classification batch.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to classify one text")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records a successful batch and its sentence count.
     */
    public void recordSuccess(int sentenceCount) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successfully classified texts")
                .register(registry)
                .increment();
        DistributionSummary.builder(METRIC_PREFIX + ".sentences")
                .description("Sentences per classified text")
                .register(registry)
                .record(sentenceCount);
    }

    /**
     * @param reason failure category (annotation_error, classifier_error, scoring_error, unexpected_error)
     */
    public void incrementFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed classification batches")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
