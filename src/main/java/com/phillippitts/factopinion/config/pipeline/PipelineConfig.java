package com.phillippitts.factopinion.config.pipeline;

import com.phillippitts.factopinion.config.properties.DispatchProperties;
import com.phillippitts.factopinion.config.properties.FusionProperties;
import com.phillippitts.factopinion.config.properties.LexiconProperties;
import com.phillippitts.factopinion.service.annotate.DependencyAnnotator;
import com.phillippitts.factopinion.service.dispatch.ParallelSentenceDispatcher;
import com.phillippitts.factopinion.service.dispatch.SentenceDispatcher;
import com.phillippitts.factopinion.service.dispatch.SentenceScoringTask;
import com.phillippitts.factopinion.service.ensemble.ClassifierEnsemble;
import com.phillippitts.factopinion.service.fusion.FusedScoringTask;
import com.phillippitts.factopinion.service.fusion.FusionEngine;
import com.phillippitts.factopinion.service.metrics.ClassificationMetrics;
import com.phillippitts.factopinion.service.orchestration.ClassificationOrchestrator;
import com.phillippitts.factopinion.service.orchestration.DefaultClassificationOrchestrator;
import com.phillippitts.factopinion.service.rules.LinguisticRuleScorer;
import com.phillippitts.factopinion.service.segment.SentenceSegmenter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executor;

/**
 * Wires the classification pipeline explicitly: rule scorer, fusion, dispatcher and orchestrator.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public LinguisticRuleScorer linguisticRuleScorer(LexiconProperties lexiconProperties,
                                                     DependencyAnnotator annotator) {
        return new LinguisticRuleScorer(lexiconProperties.toLexicon(), annotator);
    }

    @Bean
    public FusionEngine fusionEngine(FusionProperties fusionProperties) {
        return new FusionEngine(fusionProperties.getWeight());
    }

    @Bean
    public SentenceScoringTask sentenceScoringTask(LinguisticRuleScorer ruleScorer,
                                                   ClassifierEnsemble ensemble,
                                                   FusionEngine fusionEngine) {
        return new FusedScoringTask(ruleScorer, ensemble, fusionEngine);
    }

    @Bean
    public SentenceDispatcher sentenceDispatcher(@Qualifier("scoringExecutor") Executor scoringExecutor,
                                                 DispatchProperties dispatchProperties) {
        return new ParallelSentenceDispatcher(scoringExecutor,
                dispatchProperties.getTimeoutMs(), dispatchProperties.getFailurePolicy());
    }

    @Bean
    public ClassificationOrchestrator classificationOrchestrator(SentenceSegmenter segmenter,
                                                                 SentenceDispatcher dispatcher,
                                                                 SentenceScoringTask scoringTask,
                                                                 ClassificationMetrics metrics) {
        return new DefaultClassificationOrchestrator(segmenter, dispatcher, scoringTask, metrics);
    }
}
