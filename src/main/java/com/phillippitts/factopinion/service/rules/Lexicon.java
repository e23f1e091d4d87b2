package com.phillippitts.factopinion.service.rules;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable cue lists used by the rule scorer.
 *
 * <p>Blank entries are dropped and duplicates collapsed while keeping configuration order, so
 * each cue contributes at most once per sentence.
 *
 * @param opinionCues   subjective-stance phrases (hedges, modal expressions, evaluations)
 * @param factCues      citation and evidence phrases
 * @param degreeAdverbs degree / intensity adverbs matched against ADV tokens
 */
public record Lexicon(Set<String> opinionCues, Set<String> factCues, Set<String> degreeAdverbs) {

    public Lexicon {
        opinionCues = normalize(opinionCues, "opinionCues");
        factCues = normalize(factCues, "factCues");
        degreeAdverbs = normalize(degreeAdverbs, "degreeAdverbs");
    }

    public static Lexicon of(Collection<String> opinionCues,
                             Collection<String> factCues,
                             Collection<String> degreeAdverbs) {
        return new Lexicon(copy(opinionCues), copy(factCues), copy(degreeAdverbs));
    }

    private static Set<String> copy(Collection<String> values) {
        return values == null ? Set.of() : new LinkedHashSet<>(values);
    }

    private static Set<String> normalize(Set<String> values, String name) {
        Objects.requireNonNull(values, name);
        LinkedHashSet<String> cleaned = new LinkedHashSet<>();
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                cleaned.add(v.strip());
            }
        }
        return Collections.unmodifiableSet(cleaned);
    }
}
