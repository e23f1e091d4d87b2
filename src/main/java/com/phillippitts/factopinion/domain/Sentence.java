package com.phillippitts.factopinion.domain;

import java.util.Objects;

/**
 * Immutable sentence extracted from input text.
 *
 * <p>The index is the position assigned by the segmenter and is the only key used to
 * reassemble concurrently scored results; two sentences with identical text remain distinct.
 *
 * @param index zero-based position in the segmenter output
 * @param text  sentence text including its terminal punctuation (never blank)
 */
public record Sentence(int index, String text) {

    public Sentence {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(text, "Sentence text must not be null");
        if (text.isBlank()) {
            throw new IllegalArgumentException("Sentence text must not be blank");
        }
    }
}
