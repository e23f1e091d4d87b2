/**
 * Immutable domain records shared by every stage of the pipeline.
 *
 * <ul>
 *   <li>{@link com.phillippitts.factopinion.domain.Sentence} - index-tagged sentence from the segmenter</li>
 *   <li>{@link com.phillippitts.factopinion.domain.ScoredSentence} - fused result for one sentence</li>
 *   <li>{@link com.phillippitts.factopinion.domain.ClassificationReport} - ordered batch result or failure</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.domain;
