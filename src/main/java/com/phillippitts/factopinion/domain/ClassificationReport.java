package com.phillippitts.factopinion.domain;

import java.util.List;

/**
 * Outcome of classifying one piece of text.
 *
 * <p>A successful report lists the scored sentences in input order. When the dispatcher skips
 * failing sentences, their input indexes are listed in {@code skippedIndexes}. A failed report
 * carries the failure reason and an empty list; partial results are never exposed.
 *
 * @param sentences      scored sentences in input order (empty when failed)
 * @param skippedIndexes input indexes of sentences left out of {@code sentences}, ascending
 * @param failure        failure reason, or null when the batch succeeded
 */
public record ClassificationReport(List<ScoredSentence> sentences, List<Integer> skippedIndexes, String failure) {

    public ClassificationReport {
        sentences = sentences == null ? List.of() : List.copyOf(sentences);
        skippedIndexes = skippedIndexes == null ? List.of() : List.copyOf(skippedIndexes);
        if (failure != null && !sentences.isEmpty()) {
            throw new IllegalArgumentException("A failed report must not carry sentences");
        }
    }

    public static ClassificationReport of(List<ScoredSentence> sentences) {
        return new ClassificationReport(sentences, List.of(), null);
    }

    public static ClassificationReport of(List<ScoredSentence> sentences, List<Integer> skippedIndexes) {
        return new ClassificationReport(sentences, skippedIndexes, null);
    }

    public static ClassificationReport failed(String reason) {
        return new ClassificationReport(List.of(), List.of(), reason == null ? "unknown failure" : reason);
    }

    public boolean succeeded() {
        return failure == null;
    }

    public boolean isPartial() {
        return !skippedIndexes.isEmpty();
    }
}
