package com.syncbridge.api.executor;

/**
 * How a claimed job ended for this run.
 */
public enum JobOutcome {
    SUCCEEDED,
    RETRY_SCHEDULED,
    FAILED,
    /** Worker was interrupted; the row stays RUNNING until the stale sweep releases it. */
    ABANDONED
}
