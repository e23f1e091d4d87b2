package com.phillippitts.factopinion.service.ensemble;

import java.util.Objects;

/**
 * Element-wise average of every ensemble member's distribution for one sentence.
 *
 * @param average     averaged distribution
 * @param memberCount number of members that contributed
 */
public record EnsembleResult(ClassProbabilities average, int memberCount) {

    public EnsembleResult {
        Objects.requireNonNull(average, "average");
        if (memberCount < 1) {
            throw new IllegalArgumentException("memberCount must be >= 1, got: " + memberCount);
        }
    }

    public double factProbability() {
        return average.fact();
    }
}
