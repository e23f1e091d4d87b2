package com.phillippitts.factopinion.service.annotate;

import java.util.Map;
import java.util.Objects;

/**
 * One word of a dependency-parsed sentence, reduced to the fields the rule scorer reads.
 *
 * @param text     surface form
 * @param upos     universal part-of-speech tag (e.g. VERB, ADJ, NOUN, ADV)
 * @param deprel   dependency relation to the head word (e.g. nsubj, obj, advmod)
 * @param features morphological features, name to raw value (e.g. Mood to "Pot")
 */
public record AnnotatedWord(String text, String upos, String deprel, Map<String, String> features) {

    public AnnotatedWord {
        Objects.requireNonNull(text, "text");
        upos = upos == null ? "" : upos;
        deprel = deprel == null ? "" : deprel;
        features = features == null ? Map.of() : Map.copyOf(features);
    }

    public static AnnotatedWord of(String text, String upos, String deprel) {
        return new AnnotatedWord(text, upos, deprel, Map.of());
    }

    /**
     * Checks a feature value, honouring multi-valued features such as {@code Mood=Pot,Sub}.
     */
    public boolean hasFeature(String name, String value) {
        String raw = features.get(name);
        if (raw == null) {
            return false;
        }
        for (String v : raw.split(",")) {
            if (v.equals(value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return relation without its subtype, e.g. {@code nsubj} for {@code nsubj:pass}
     */
    public String baseRelation() {
        int colon = deprel.indexOf(':');
        return colon < 0 ? deprel : deprel.substring(0, colon);
    }
}
