package com.phillippitts.factopinion.domain;

import java.util.Objects;

/**
 * Final per-sentence output of the fact/opinion pipeline.
 *
 * @param index               position of the sentence in the input
 * @param sentence            sentence text
 * @param adjustedProbability fused fact probability, always within [0, 1]
 * @param ensembleProbability averaged ensemble fact probability before fusion
 * @param logicScore          rule-based logic score that was fused in
 */
public record ScoredSentence(
        int index,
        String sentence,
        double adjustedProbability,
        double ensembleProbability,
        double logicScore
) {

    public ScoredSentence {
        Objects.requireNonNull(sentence, "sentence must not be null");
        if (adjustedProbability < 0.0 || adjustedProbability > 1.0) {
            throw new IllegalArgumentException(
                    "Adjusted probability must be between 0.0 and 1.0, got: " + adjustedProbability);
        }
        if (ensembleProbability < 0.0 || ensembleProbability > 1.0) {
            throw new IllegalArgumentException(
                    "Ensemble probability must be between 0.0 and 1.0, got: " + ensembleProbability);
        }
    }

    /**
     * @param threshold cut-off in [0, 1]
     * @return true when the adjusted probability reaches the threshold
     */
    public boolean isFactLeaning(double threshold) {
        return adjustedProbability >= threshold;
    }
}
