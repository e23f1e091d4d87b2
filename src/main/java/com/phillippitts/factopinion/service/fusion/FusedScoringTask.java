package com.phillippitts.factopinion.service.fusion;

import com.phillippitts.factopinion.domain.ScoredSentence;
import com.phillippitts.factopinion.domain.Sentence;
import com.phillippitts.factopinion.service.dispatch.SentenceScoringTask;
import com.phillippitts.factopinion.service.ensemble.ClassifierEnsemble;
import com.phillippitts.factopinion.service.ensemble.EnsembleResult;
import com.phillippitts.factopinion.service.rules.LinguisticRuleScorer;
import com.phillippitts.factopinion.service.rules.LogicScore;

import java.util.Objects;

/**
 * Binds the rule scorer, the classifier ensemble and the fusion engine into the per-sentence
 * task run by the dispatcher.
 */
public class FusedScoringTask implements SentenceScoringTask {

    private final LinguisticRuleScorer ruleScorer;
    private final ClassifierEnsemble ensemble;
    private final FusionEngine fusionEngine;

    public FusedScoringTask(LinguisticRuleScorer ruleScorer,
                            ClassifierEnsemble ensemble,
                            FusionEngine fusionEngine) {
        this.ruleScorer = Objects.requireNonNull(ruleScorer, "ruleScorer");
        this.ensemble = Objects.requireNonNull(ensemble, "ensemble");
        this.fusionEngine = Objects.requireNonNull(fusionEngine, "fusionEngine");
    }

    @Override
    public ScoredSentence score(Sentence sentence) {
        LogicScore logic = ruleScorer.score(sentence.text());
        EnsembleResult ensembleResult = ensemble.classify(sentence.text());
        double ensembleProbability = ensembleResult.factProbability();
        double adjusted = fusionEngine.fuse(ensembleProbability, logic.value());
        return new ScoredSentence(sentence.index(), sentence.text(), adjusted, ensembleProbability, logic.value());
    }
}
