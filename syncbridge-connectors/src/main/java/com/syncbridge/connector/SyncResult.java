package com.syncbridge.connector;

import java.util.List;

/**
 * Outcome of a successful {@link Connector#sync} call.
 *
 * @param signals    Normalized events produced by this run
 * @param nextCursor Progress marker to persist, or null to keep the current one
 * @param hasMore    Whether a continuation job should run immediately from {@code nextCursor}
 */
public record SyncResult(List<NormalizedSignal> signals, Cursor nextCursor, boolean hasMore) {

    public SyncResult {
        signals = signals != null ? List.copyOf(signals) : List.of();
    }

    public static SyncResult complete(List<NormalizedSignal> signals, Cursor nextCursor) {
        return new SyncResult(signals, nextCursor, false);
    }

    public static SyncResult partial(List<NormalizedSignal> signals, Cursor nextCursor) {
        return new SyncResult(signals, nextCursor, true);
    }

    public boolean needsContinuation() {
        return hasMore && nextCursor != null;
    }

    public static SyncResult empty(Cursor nextCursor) {
        return new SyncResult(List.of(), nextCursor, false);
    }
}
