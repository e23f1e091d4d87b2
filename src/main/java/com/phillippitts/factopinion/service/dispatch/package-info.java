/**
 * Concurrent per-sentence dispatch.
 *
 * <p>{@link com.phillippitts.factopinion.service.dispatch.ParallelSentenceDispatcher} fans one
 * {@link com.phillippitts.factopinion.service.dispatch.SentenceScoringTask} per sentence out on
 * the bounded {@code scoringExecutor} and restores input order from the slot recorded at
 * submission.
 *
 * <p>Configuration (application.properties):
 * <pre>
 * factopinion.dispatch.timeout-ms=30000
 * factopinion.dispatch.failure-policy=ABORT
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.factopinion.service.dispatch;
