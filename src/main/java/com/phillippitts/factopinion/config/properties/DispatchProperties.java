package com.phillippitts.factopinion.config.properties;

import com.phillippitts.factopinion.service.dispatch.FailurePolicy;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for concurrent sentence dispatch.
 */
@Validated
@ConfigurationProperties(prefix = "factopinion.dispatch")
public class DispatchProperties {

    /** Upper bound on the wall-clock time of one batch. */
    @Positive
    private final long timeoutMs;

    /** ABORT drops the whole batch on the first failing sentence, SKIP omits failing sentences. */
    @NotNull
    private final FailurePolicy failurePolicy;

    @ConstructorBinding
    public DispatchProperties(Long timeoutMs, FailurePolicy failurePolicy) {
        long t = timeoutMs == null ? 30_000L : timeoutMs;
        if (t <= 0) {
            throw new IllegalArgumentException("factopinion.dispatch.timeout-ms must be positive");
        }
        this.timeoutMs = t;
        this.failurePolicy = failurePolicy == null ? FailurePolicy.ABORT : failurePolicy;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }
}
