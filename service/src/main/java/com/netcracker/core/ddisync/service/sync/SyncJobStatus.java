package com.netcracker.core.ddisync.service.sync;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Point-in-time copy of a {@link SyncJob}, safe to hand out to callers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncJobStatus(String jobId,
                            String networkView,
                            SyncJobState state,
                            SyncProgress progress,
                            SyncOutcome outcome,
                            String failureReason,
                            Instant submittedAt,
                            Instant finishedAt) {
}
