package com.phillippitts.factopinion.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.util.List;

/**
 * Classifier ensemble configuration. The ensemble size is the number of endpoints.
 *
 * <p>Example application.properties:
 * <pre>
 * factopinion.ensemble.endpoints=http://models:8501/predict,http://models:8502/predict
 * factopinion.ensemble.fact-label=LABEL_1
 * factopinion.ensemble.timeout-ms=5000
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "factopinion.ensemble")
public class EnsembleProperties {

    /** One inference endpoint per ensemble member. */
    @NotEmpty
    private final List<URI> endpoints;

    /** Label the inference servers use for the fact class. */
    @NotBlank
    private final String factLabel;

    /** Connect and read timeout for each inference call. */
    @Positive
    private final int timeoutMs;

    @ConstructorBinding
    public EnsembleProperties(List<URI> endpoints, String factLabel, Integer timeoutMs) {
        if (endpoints == null || endpoints.isEmpty()) {
            throw new IllegalArgumentException("factopinion.ensemble.endpoints must list at least one endpoint");
        }
        this.endpoints = List.copyOf(endpoints);
        this.factLabel = factLabel == null || factLabel.isBlank() ? "LABEL_1" : factLabel;
        this.timeoutMs = timeoutMs == null ? 5000 : timeoutMs;
    }

    public List<URI> getEndpoints() {
        return endpoints;
    }

    public String getFactLabel() {
        return factLabel;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }
}
