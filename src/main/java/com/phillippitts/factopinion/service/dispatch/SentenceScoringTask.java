package com.phillippitts.factopinion.service.dispatch;

import com.phillippitts.factopinion.domain.ScoredSentence;
import com.phillippitts.factopinion.domain.Sentence;

/**
 * Scores one sentence end to end. Executed concurrently by the dispatcher, so implementations
 * must not share mutable state between calls.
 */
@FunctionalInterface
public interface SentenceScoringTask {

    /**
     * @param sentence sentence to score
     * @return scored sentence carrying the same index
     */
    ScoredSentence score(Sentence sentence);
}
