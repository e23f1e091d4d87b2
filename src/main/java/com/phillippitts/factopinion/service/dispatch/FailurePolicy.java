package com.phillippitts.factopinion.service.dispatch;

/**
 * What the dispatcher does when a sentence task fails.
 */
public enum FailurePolicy {

    /** First failure aborts the batch; no partial results. */
    ABORT,

    /** Failed sentences are logged and left out; the rest keep input order. */
    SKIP
}
