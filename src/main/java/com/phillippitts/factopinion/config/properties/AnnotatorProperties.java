package com.phillippitts.factopinion.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the UDPipe-compatible dependency annotator.
 */
@Validated
@ConfigurationProperties(prefix = "factopinion.annotator")
public class AnnotatorProperties {

    @NotBlank
    private final String baseUrl;

    @NotBlank
    private final String model;

    @Positive
    private final int timeoutMs;

    @ConstructorBinding
    public AnnotatorProperties(String baseUrl, String model, Integer timeoutMs) {
        this.baseUrl = baseUrl == null ? "http://localhost:8001" : baseUrl;
        this.model = model == null ? "chinese-gsd" : model;
        this.timeoutMs = timeoutMs == null ? 5000 : timeoutMs;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getModel() {
        return model;
    }

    public int getTimeoutMs() {
        return timeoutMs;
    }
}
