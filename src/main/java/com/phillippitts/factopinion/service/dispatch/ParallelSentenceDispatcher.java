package com.phillippitts.factopinion.service.dispatch;

import com.phillippitts.factopinion.domain.ScoredSentence;
import com.phillippitts.factopinion.domain.Sentence;
import com.phillippitts.factopinion.exception.ScoringException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link SentenceDispatcher} that fans sentences out on a bounded executor.
 *
 * <p><b>Thread Model:</b> one {@link CompletableFuture} per sentence on the {@code scoringExecutor}.
 * The calling thread blocks until the batch completes, fails or times out.
 *
 * <p><b>Ordering:</b> each future is stored at the slot of its sentence when submitted; results
 * are read back slot by slot, so completion order has no effect on output order.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>{@link FailurePolicy#ABORT}: the first failing task aborts the batch, remaining tasks are
 *       cancelled best-effort and a {@link ScoringException} naming the sentence is thrown.</li>
 *   <li>{@link FailurePolicy#SKIP}: failed sentences are logged and omitted. A batch in which
 *       every sentence fails still raises a {@link ScoringException}.</li>
 *   <li>Timeout, interruption and executor rejection abort the batch under both policies.</li>
 * </ul>
 *
 * <p><b>Timeout:</b> the deadline is fixed before the first submission. Sentences the executor
 * runs on the calling thread ({@code CallerRunsPolicy}) consume the same budget, so the wait
 * after submission only gets what is left of it.
 */
public class ParallelSentenceDispatcher implements SentenceDispatcher {

    private static final Logger LOG = LogManager.getLogger(ParallelSentenceDispatcher.class);

    private final Executor executor;
    private final long timeoutMs;
    private final FailurePolicy failurePolicy;

    /**
     * @param executor      bounded pool running the scoring tasks
     * @param timeoutMs     batch timeout in milliseconds (must be positive)
     * @param failurePolicy behaviour on a failing sentence
     */
    public ParallelSentenceDispatcher(Executor executor, long timeoutMs, FailurePolicy failurePolicy) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive, got: " + timeoutMs);
        }
        this.timeoutMs = timeoutMs;
    }

    @Override
    public List<ScoredSentence> dispatch(List<Sentence> sentences, SentenceScoringTask task) {
        Objects.requireNonNull(sentences, "sentences");
        Objects.requireNonNull(task, "task");
        if (sentences.isEmpty()) {
            return List.of();
        }

        long startNanos = System.nanoTime();
        long deadlineNanos = startNanos + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        int n = sentences.size();
        List<CompletableFuture<ScoredSentence>> futures = new ArrayList<>(n);
        CompletableFuture<Void> firstFailure = new CompletableFuture<>();

        try {
            for (int i = 0; i < n; i++) {
                final int slot = i;
                Sentence sentence = sentences.get(slot);
                CompletableFuture<ScoredSentence> future =
                        CompletableFuture.supplyAsync(() -> task.score(sentence), executor);
                future.whenComplete((result, ex) -> {
                    if (ex != null) {
                        firstFailure.completeExceptionally(
                                new ScoringException("Sentence scoring failed", slot, unwrap(ex)));
                    }
                });
                futures.add(future);
            }
        } catch (RejectedExecutionException ree) {
            cancelAll(futures);
            LOG.error("Scoring pool rejected batch after {} of {} tasks", futures.size(), n);
            throw new ScoringException("Scoring pool rejected the batch", ree);
        }

        awaitBatch(futures, firstFailure, deadlineNanos);
        List<ScoredSentence> results = collect(futures);

        long ms = (System.nanoTime() - startNanos) / 1_000_000L;
        LOG.info("Scored {} of {} sentences in {} ms (policy={})", results.size(), n, ms, failurePolicy);
        return List.copyOf(results);
    }

    private void awaitBatch(List<CompletableFuture<ScoredSentence>> futures,
                            CompletableFuture<Void> firstFailure,
                            long deadlineNanos) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
        CompletableFuture<?> barrier = failurePolicy == FailurePolicy.ABORT
                ? CompletableFuture.anyOf(all, firstFailure)
                : all.handle((ignored, ex) -> null);
        try {
            long remainingNanos = Math.max(0L, deadlineNanos - System.nanoTime());
            barrier.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException te) {
            cancelAll(futures);
            LOG.warn("Batch scoring timed out after {} ms", timeoutMs);
            throw new ScoringException("Batch scoring timed out after " + timeoutMs + " ms", te);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new ScoringException("Interrupted while waiting for scoring tasks", ie);
        } catch (ExecutionException ee) {
            cancelAll(futures);
            Throwable cause = ee.getCause();
            if (cause instanceof ScoringException se) {
                LOG.warn("Aborting batch: {}", se.getMessage());
                throw se;
            }
            int slot = firstFailedSlot(futures);
            LOG.warn("Aborting batch: sentence {} failed: {}", slot, cause == null ? "unknown" : cause.getMessage());
            throw new ScoringException("Sentence scoring failed", slot, cause);
        }
    }

    private List<ScoredSentence> collect(List<CompletableFuture<ScoredSentence>> futures) {
        List<ScoredSentence> results = new ArrayList<>(futures.size());
        int firstSkipped = ScoringException.NO_SENTENCE;
        Throwable firstCause = null;
        for (int slot = 0; slot < futures.size(); slot++) {
            try {
                results.add(futures.get(slot).join());
            } catch (CompletionException | CancellationException e) {
                Throwable cause = unwrap(e);
                if (failurePolicy == FailurePolicy.ABORT) {
                    throw new ScoringException("Sentence scoring failed", slot, cause);
                }
                LOG.warn("Skipping sentence {}: {}", slot, cause.getMessage());
                if (firstCause == null) {
                    firstSkipped = slot;
                    firstCause = cause;
                }
            }
        }
        if (results.isEmpty()) {
            LOG.warn("Every one of {} sentences failed; nothing left to report", futures.size());
            throw new ScoringException("All " + futures.size() + " sentences failed", firstSkipped, firstCause);
        }
        return results;
    }

    private static int firstFailedSlot(List<CompletableFuture<ScoredSentence>> futures) {
        for (int i = 0; i < futures.size(); i++) {
            if (futures.get(i).isCompletedExceptionally()) {
                return i;
            }
        }
        return ScoringException.NO_SENTENCE;
    }

    private static void cancelAll(List<CompletableFuture<ScoredSentence>> futures) {
        futures.forEach(f -> f.cancel(true));
    }

    private static Throwable unwrap(Throwable t) {
        if ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }
}
