package com.phillippitts.factopinion.service.orchestration;

import com.phillippitts.factopinion.domain.ClassificationReport;
import com.phillippitts.factopinion.domain.ScoredSentence;
import com.phillippitts.factopinion.domain.Sentence;
import com.phillippitts.factopinion.exception.AnnotationException;
import com.phillippitts.factopinion.exception.ClassifierException;
import com.phillippitts.factopinion.exception.ScoringException;
import com.phillippitts.factopinion.service.dispatch.SentenceDispatcher;
import com.phillippitts.factopinion.service.dispatch.SentenceScoringTask;
import com.phillippitts.factopinion.service.metrics.ClassificationMetrics;
import com.phillippitts.factopinion.service.segment.SentenceSegmenter;
import com.phillippitts.factopinion.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link ClassificationOrchestrator}.
 *
 * <p>Each call gets a {@code batchId} in the log4j2 MDC; the scoring executor copies the MDC to
 * its workers so per-sentence logs can be correlated with the batch.
 *
 * <p><b>Failure semantics:</b> a failing batch records a failure metric, logs the cause and
 * returns an empty failed report. When the dispatcher skips failing sentences, the report keeps
 * the scored ones and lists the skipped indexes.
 *
 * @since 1.0
 */
public class DefaultClassificationOrchestrator implements ClassificationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultClassificationOrchestrator.class);

    private static final String MDC_BATCH_ID = "batchId";
    private static final int LOG_PREVIEW_CHARS = 30;

    private final SentenceSegmenter segmenter;
    private final SentenceDispatcher dispatcher;
    private final SentenceScoringTask scoringTask;
    private final ClassificationMetrics metrics;

    /**
     * @param segmenter   sentence segmenter
     * @param dispatcher  concurrent dispatcher
     * @param scoringTask per-sentence task (rule scorer + ensemble + fusion)
     * @param metrics     metrics recorder (nullable in tests)
     * @throws NullPointerException if any required parameter is null
     */
    public DefaultClassificationOrchestrator(SentenceSegmenter segmenter,
                                             SentenceDispatcher dispatcher,
                                             SentenceScoringTask scoringTask,
                                             ClassificationMetrics metrics) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.scoringTask = Objects.requireNonNull(scoringTask, "scoringTask must not be null");
        this.metrics = metrics;
    }

    @Override
    public ClassificationReport classify(String text) {
        // InvalidInputException propagates before any collaborator is touched
        List<Sentence> sentences = segmenter.segment(text);

        String previousBatchId = ThreadContext.get(MDC_BATCH_ID);
        ThreadContext.put(MDC_BATCH_ID, UUID.randomUUID().toString());
        long startTime = System.nanoTime();
        try {
            LOG.info("Classifying {} sentences, first='{}'", sentences.size(),
                    LogSanitizer.truncate(sentences.get(0).text(), LOG_PREVIEW_CHARS));

            List<ScoredSentence> scored = dispatcher.dispatch(sentences, scoringTask);

            List<Integer> skipped = skippedIndexes(sentences, scored);
            if (!skipped.isEmpty()) {
                LOG.warn("Skipped {} of {} sentences: {}", skipped.size(), sentences.size(), skipped);
            }

            recordSuccess(startTime, scored.size());
            LOG.info("Classification completed: sentences={}, durationMs={}",
                    scored.size(), (System.nanoTime() - startTime) / 1_000_000L);
            return ClassificationReport.of(scored, skipped);
        } catch (ScoringException se) {
            return fail(startTime, categorize(se.getCause(), "scoring_error"), se);
        } catch (AnnotationException | ClassifierException fe) {
            return fail(startTime, categorize(fe, "scoring_error"), fe);
        } catch (RuntimeException re) {
            LOG.error("Unexpected error during classification", re);
            return fail(startTime, "unexpected_error", re);
        } finally {
            if (previousBatchId == null) {
                ThreadContext.remove(MDC_BATCH_ID);
            } else {
                ThreadContext.put(MDC_BATCH_ID, previousBatchId);
            }
        }
    }

    private static List<Integer> skippedIndexes(List<Sentence> sentences, List<ScoredSentence> scored) {
        if (scored.size() == sentences.size()) {
            return List.of();
        }
        Set<Integer> kept = scored.stream().map(ScoredSentence::index).collect(Collectors.toSet());
        return sentences.stream().map(Sentence::index).filter(i -> !kept.contains(i)).toList();
    }

    private ClassificationReport fail(long startTime, String reason, RuntimeException cause) {
        if (metrics != null) {
            metrics.recordLatency(System.nanoTime() - startTime);
            metrics.incrementFailure(reason);
        }
        String description = describe(cause);
        LOG.warn("Classification batch failed ({}): {}", reason, description);
        return ClassificationReport.failed(description);
    }

    private static String describe(Throwable failure) {
        Throwable cause = failure.getCause();
        if (failure instanceof ScoringException && cause != null && cause.getMessage() != null) {
            return failure.getMessage() + ": " + cause.getMessage();
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }

    private void recordSuccess(long startTime, int sentenceCount) {
        if (metrics == null) {
            return;
        }
        metrics.recordLatency(System.nanoTime() - startTime);
        metrics.recordSuccess(sentenceCount);
    }

    private static String categorize(Throwable cause, String fallback) {
        if (cause instanceof AnnotationException) {
            return "annotation_error";
        }
        if (cause instanceof ClassifierException) {
            return "classifier_error";
        }
        return fallback;
    }
}
