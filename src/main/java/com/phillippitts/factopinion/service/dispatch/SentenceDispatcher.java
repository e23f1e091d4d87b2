package com.phillippitts.factopinion.service.dispatch;

import com.phillippitts.factopinion.domain.ScoredSentence;
import com.phillippitts.factopinion.domain.Sentence;
import com.phillippitts.factopinion.exception.ScoringException;

import java.util.List;

/**
 * Runs a {@link SentenceScoringTask} for every sentence in parallel and returns the results in
 * submission order.
 *
 * <p>Results are reassembled by the position each task was given at submission time, never by
 * looking sentences up by text, so duplicated sentences keep their own slots.
 */
public interface SentenceDispatcher {

    /**
     * @param sentences ordered sentences
     * @param task      per-sentence scoring capability
     * @return scored sentences in the order of {@code sentences}
     * @throws ScoringException when the batch is aborted (task failure, timeout, interruption)
     */
    List<ScoredSentence> dispatch(List<Sentence> sentences, SentenceScoringTask task);
}
