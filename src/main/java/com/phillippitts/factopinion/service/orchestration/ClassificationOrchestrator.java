package com.phillippitts.factopinion.service.orchestration;

import com.phillippitts.factopinion.domain.ClassificationReport;
import com.phillippitts.factopinion.exception.InvalidInputException;

/**
 * Public entry point of the fact/opinion pipeline.
 *
 * <p>Pipeline: segment the text, score every sentence concurrently (rule scorer, classifier
 * ensemble, fusion), reassemble results in input order.
 *
 * <p><b>Error Handling:</b> invalid input is rejected with {@link InvalidInputException} before
 * any collaborator is called. Every other failure is logged and reported as
 * {@link ClassificationReport#failed(String)} with no sentences; no lower-level exception
 * crosses this boundary.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * ClassificationReport report = orchestrator.classify("根据最新的数据，他们的市场份额正在扩大。我觉得这个产品很棒。");
 * if (report.succeeded()) {
 *     report.sentences().forEach(s -> System.out.println(s.sentence() + " " + s.adjustedProbability()));
 * }
 * }</pre>
 *
 * @since 1.0
 */
public interface ClassificationOrchestrator {

    /**
     * @param text raw input text
     * @return ordered scored sentences, or a failed report
     * @throws InvalidInputException if text is null, empty or blank
     */
    ClassificationReport classify(String text);
}
