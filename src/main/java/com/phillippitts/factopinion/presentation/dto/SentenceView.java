package com.phillippitts.factopinion.presentation.dto;

import com.phillippitts.factopinion.domain.ScoredSentence;

/**
 * One classified sentence as returned to API clients.
 */
public record SentenceView(
        int index,
        String sentence,
        double probability,
        double ensembleProbability,
        double logicScore,
        boolean factLeaning
) {

    public static SentenceView from(ScoredSentence scored, double factThreshold) {
        return new SentenceView(
                scored.index(),
                scored.sentence(),
                scored.adjustedProbability(),
                scored.ensembleProbability(),
                scored.logicScore(),
                scored.isFactLeaning(factThreshold));
    }
}
