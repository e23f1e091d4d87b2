package com.phillippitts.factopinion.service.segment;

import com.phillippitts.factopinion.domain.Sentence;
import com.phillippitts.factopinion.exception.InvalidInputException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits raw Chinese text into an ordered list of sentences.
 *
 * <p>Boundaries are zero-width positions right after {@code 。}, {@code ！} or {@code ？}, so the
 * terminal punctuation stays attached to the sentence it ends. Candidates are stripped and empty
 * candidates dropped. A trailing fragment without a terminator becomes its own sentence.
 *
 * <p>Indexes are assigned in output order; identical sentences keep separate indexes.
 */
@Component
public class SentenceSegmenter {

    private static final Pattern BOUNDARY = Pattern.compile("(?<=[。！？])");

    /**
     * @param text raw input text
     * @return non-empty ordered list of sentences
     * @throws InvalidInputException if text is null, empty or blank
     */
    public List<Sentence> segment(String text) {
        if (text == null) {
            throw new InvalidInputException("text is null");
        }
        if (text.isBlank()) {
            throw new InvalidInputException("text is empty");
        }

        List<Sentence> sentences = new ArrayList<>();
        for (String candidate : BOUNDARY.split(text)) {
            String stripped = candidate.strip();
            if (!stripped.isEmpty()) {
                sentences.add(new Sentence(sentences.size(), stripped));
            }
        }
        return List.copyOf(sentences);
    }
}
