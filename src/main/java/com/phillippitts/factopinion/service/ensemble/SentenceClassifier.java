package com.phillippitts.factopinion.service.ensemble;

import com.phillippitts.factopinion.exception.ClassifierException;

/**
 * Contract for one trained fact/opinion sentence classifier.
 *
 * <p>Training, loading and versioning of the underlying model happen elsewhere; this interface
 * only scores sentences against an already loaded model.
 *
 * <p><b>Thread Safety:</b> implementations are called concurrently from several scoring tasks.
 * They must be safe for concurrent use and deterministic for a fixed sentence and model state
 * (no mutable state that changes the output between calls).
 */
public interface SentenceClassifier {

    /**
     * @param sentence sentence text
     * @return two-class distribution (not-fact, fact)
     * @throws ClassifierException if the model cannot produce a valid distribution
     */
    ClassProbabilities classify(String sentence);

    /**
     * @return name used in logs, metrics and error messages
     */
    String getName();
}
