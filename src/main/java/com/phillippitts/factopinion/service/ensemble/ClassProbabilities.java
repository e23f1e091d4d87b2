package com.phillippitts.factopinion.service.ensemble;

import java.util.List;

/**
 * Two-class probability distribution produced by one classifier for one sentence.
 *
 * @param notFact probability mass of the not-fact (opinion) class
 * @param fact    probability mass of the fact class
 */
public record ClassProbabilities(double notFact, double fact) {

    /** Allowed deviation of {@code notFact + fact} from 1.0. */
    public static final double SUM_TOLERANCE = 1e-3;

    public ClassProbabilities {
        requireProbability(notFact, "notFact");
        requireProbability(fact, "fact");
    }

    /**
     * @return true when both entries sum to 1 within {@link #SUM_TOLERANCE}
     */
    public boolean isNormalized() {
        return Math.abs(notFact + fact - 1.0) <= SUM_TOLERANCE;
    }

    /**
     * Element-wise mean of the given vectors.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public static ClassProbabilities average(List<ClassProbabilities> vectors) {
        if (vectors == null || vectors.isEmpty()) {
            throw new IllegalArgumentException("Cannot average an empty list of probability vectors");
        }
        double notFact = 0.0;
        double fact = 0.0;
        for (ClassProbabilities v : vectors) {
            notFact += v.notFact();
            fact += v.fact();
        }
        int n = vectors.size();
        return new ClassProbabilities(notFact / n, fact / n);
    }

    private static void requireProbability(double p, String name) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0, got: " + p);
        }
    }
}
