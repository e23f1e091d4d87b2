/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.factopinion.exception.FactOpinionException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.factopinion.exception.InvalidInputException} - Thrown when
 *       the submitted text is null, empty or blank</li>
 *   <li>{@link com.phillippitts.factopinion.exception.AnnotationException} - Thrown when the
 *       dependency annotator fails for a sentence</li>
 *   <li>{@link com.phillippitts.factopinion.exception.ClassifierException} - Thrown when an
 *       ensemble member fails or returns an invalid probability vector</li>
 *   <li>{@link com.phillippitts.factopinion.exception.ScoringException} - Thrown when the
 *       dispatcher aborts a batch (task failure, timeout, interruption)</li>
 * </ul>
 *
 * <p>Only {@code InvalidInputException} crosses the public entry point; every other failure is
 * reported as a failed {@code ClassificationReport}. At the HTTP boundary the
 * {@code GlobalExceptionHandler} maps exceptions to status codes.
 *
 * @see com.phillippitts.factopinion.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.factopinion.exception;
