package com.phillippitts.factopinion.service.fusion;

/**
 * Fuses the ensemble fact probability with the rule-based logic score.
 *
 * <pre>
 * adjusted = clamp(ensembleFactProbability + weight * logicScore, 0, 1)
 * </pre>
 *
 * <p>The weight sets how far rule evidence can move the model estimate and is supplied by
 * configuration ({@code factopinion.fusion.weight}). Out-of-range intermediate sums are clamped,
 * never rejected. For a fixed probability the result is non-decreasing in the logic score.
 */
public class FusionEngine {

    /** Weight used when none is configured. */
    public static final double DEFAULT_WEIGHT = 0.1;

    private final double weight;

    /**
     * @param weight non-negative, finite weight of the logic score
     * @throws IllegalArgumentException if weight is negative, NaN or infinite
     */
    public FusionEngine(double weight) {
        if (Double.isNaN(weight) || Double.isInfinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("Fusion weight must be a finite value >= 0, got: " + weight);
        }
        this.weight = weight;
    }

    /**
     * @param ensembleFactProbability averaged fact probability in [0, 1]
     * @param logicScore              signed rule score
     * @return adjusted probability in [0, 1]
     * @throws IllegalArgumentException if either argument is NaN
     */
    public double fuse(double ensembleFactProbability, double logicScore) {
        if (Double.isNaN(ensembleFactProbability) || Double.isNaN(logicScore)) {
            throw new IllegalArgumentException("Fusion inputs must not be NaN");
        }
        // 0 * infinity is NaN
        double raw = weight == 0.0 ? ensembleFactProbability : ensembleFactProbability + weight * logicScore;
        return clamp(raw);
    }

    public double getWeight() {
        return weight;
    }

    private static double clamp(double value) {
        if (value < 0.0) {
            return 0.0;
        }
        if (value > 1.0) {
            return 1.0;
        }
        return value;
    }
}
