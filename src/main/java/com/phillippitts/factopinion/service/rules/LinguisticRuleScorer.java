package com.phillippitts.factopinion.service.rules;

import com.phillippitts.factopinion.exception.AnnotationException;
import com.phillippitts.factopinion.service.annotate.AnnotatedWord;
import com.phillippitts.factopinion.service.annotate.DependencyAnnotator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the logic score of a sentence from lexical cues and dependency-parse features.
 *
 * <p>Rules, applied additively:
 * <ul>
 *   <li>each opinion cue present in the sentence: -1</li>
 *   <li>each fact cue present in the sentence: +1</li>
 *   <li>VERB with potential or subjunctive mood: -1</li>
 *   <li>ADJ: -0.5</li>
 *   <li>NOUN acting as subject or object: +0.5</li>
 *   <li>ADV listed as a degree adverb: -0.5</li>
 * </ul>
 *
 * <p>Cues count once per sentence no matter how often they occur. The result is not clamped.
 *
 * <p>Thread-safe as long as the annotator is; the lexicon is immutable.
 */
public class LinguisticRuleScorer {

    private static final Logger LOG = LogManager.getLogger(LinguisticRuleScorer.class);

    public static final String RULE_OPINION_CUE = "opinion-cue";
    public static final String RULE_FACT_CUE = "fact-cue";
    public static final String RULE_MODAL_VERB = "modal-verb";
    public static final String RULE_ADJECTIVE = "adjective";
    public static final String RULE_ARGUMENT_NOUN = "argument-noun";
    public static final String RULE_DEGREE_ADVERB = "degree-adverb";

    static final double OPINION_CUE_DELTA = -1.0;
    static final double FACT_CUE_DELTA = 1.0;
    static final double MODAL_VERB_DELTA = -1.0;
    static final double ADJECTIVE_DELTA = -0.5;
    static final double ARGUMENT_NOUN_DELTA = 0.5;
    static final double DEGREE_ADVERB_DELTA = -0.5;

    private static final String MOOD = "Mood";
    private static final Set<String> HEDGED_MOODS = Set.of("Pot", "Sub");
    private static final Set<String> ARGUMENT_RELATIONS = Set.of("nsubj", "obj", "dobj");

    private final Lexicon lexicon;
    private final DependencyAnnotator annotator;

    public LinguisticRuleScorer(Lexicon lexicon, DependencyAnnotator annotator) {
        this.lexicon = Objects.requireNonNull(lexicon, "lexicon");
        this.annotator = Objects.requireNonNull(annotator, "annotator");
    }

    /**
     * @param sentence sentence text
     * @return accumulated logic score with its contributions
     * @throws AnnotationException if the annotator fails
     */
    public LogicScore score(String sentence) {
        Objects.requireNonNull(sentence, "sentence");
        List<RuleContribution> contributions = new ArrayList<>();

        for (String cue : lexicon.opinionCues()) {
            if (sentence.contains(cue)) {
                contributions.add(new RuleContribution(RULE_OPINION_CUE, cue, OPINION_CUE_DELTA));
            }
        }
        for (String cue : lexicon.factCues()) {
            if (sentence.contains(cue)) {
                contributions.add(new RuleContribution(RULE_FACT_CUE, cue, FACT_CUE_DELTA));
            }
        }

        for (AnnotatedWord word : annotator.annotate(sentence)) {
            RuleContribution c = scoreWord(word);
            if (c != null) {
                contributions.add(c);
            }
        }

        LogicScore score = LogicScore.of(contributions);
        LOG.debug("Logic score {} from {} rule hits", score.value(), contributions.size());
        return score;
    }

    private RuleContribution scoreWord(AnnotatedWord word) {
        switch (word.upos()) {
            case "VERB":
                if (isHedgedMood(word)) {
                    return new RuleContribution(RULE_MODAL_VERB, word.text(), MODAL_VERB_DELTA);
                }
                return null;
            case "ADJ":
                return new RuleContribution(RULE_ADJECTIVE, word.text(), ADJECTIVE_DELTA);
            case "NOUN":
                if (ARGUMENT_RELATIONS.contains(word.baseRelation())) {
                    return new RuleContribution(RULE_ARGUMENT_NOUN, word.text(), ARGUMENT_NOUN_DELTA);
                }
                return null;
            case "ADV":
                if (lexicon.degreeAdverbs().contains(word.text())) {
                    return new RuleContribution(RULE_DEGREE_ADVERB, word.text(), DEGREE_ADVERB_DELTA);
                }
                return null;
            default:
                return null;
        }
    }

    private boolean isHedgedMood(AnnotatedWord word) {
        for (String mood : HEDGED_MOODS) {
            if (word.hasFeature(MOOD, mood)) {
                return true;
            }
        }
        return false;
    }
}
