package com.phillippitts.factopinion.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.DecimalMax;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Fusion settings under {@code factopinion.fusion}.
 *
 * <p>{@code weight} scales the logic score added to the ensemble probability;
 * {@code fact-threshold} only affects the {@code factLeaning} flag of the HTTP response.
 * Defaults are 0.1 and 0.5. Out-of-range values fail at construction, including when the
 * object is built outside the binder.
 */
@Validated
@ConfigurationProperties(prefix = "factopinion.fusion")
public class FusionProperties {

    /** Weight of the logic score in the fused probability. */
    @DecimalMin("0.0")
    private final double weight;

    /** Adjusted probability at or above which a sentence is reported as fact-leaning (0..1). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double factThreshold;

    @ConstructorBinding
    public FusionProperties(Double weight, Double factThreshold) {
        double w = weight == null ? 0.1 : weight;
        if (w < 0.0 || Double.isNaN(w) || Double.isInfinite(w)) {
            throw new IllegalArgumentException("factopinion.fusion.weight must be a finite value >= 0");
        }
        this.weight = w;

        double t = factThreshold == null ? 0.5 : factThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("factopinion.fusion.fact-threshold must be in [0,1]");
        }
        this.factThreshold = t;
    }

    public double getWeight() {
        return weight;
    }

    public double getFactThreshold() {
        return factThreshold;
    }
}
