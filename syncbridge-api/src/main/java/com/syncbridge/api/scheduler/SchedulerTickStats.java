package com.syncbridge.api.scheduler;

/**
 * Outcome of one scheduler tick.
 *
 * @param polled         Due connections found
 * @param enqueued       Incremental jobs inserted
 * @param skippedPending Connections that already had a queued or running incremental job
 * @param conflicts      Connections locked by another scheduler or no longer due when revisited
 * @param errors         Connections whose scheduling transaction failed
 */
public record SchedulerTickStats(int polled, int enqueued, int skippedPending, int conflicts, int errors) {

    public static SchedulerTickStats empty() {
        return new SchedulerTickStats(0, 0, 0, 0, 0);
    }
}
