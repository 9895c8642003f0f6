package com.syncbridge.api.executor;

import com.syncbridge.core.domain.SyncJob.JobType;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A job row as it looked right after the claim moved it to RUNNING.
 *
 * @param attempts Attempt count including the current run
 * @param cursor   Raw job cursor column, null when absent
 */
public record ClaimedJob(
        UUID id,
        UUID tenantId,
        String providerSlug,
        UUID connectionId,
        JobType jobType,
        int priority,
        int attempts,
        Map<String, Object> cursor,
        Instant startedAt
) {}
