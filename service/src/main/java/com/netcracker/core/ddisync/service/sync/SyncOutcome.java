package com.netcracker.core.ddisync.service.sync;

import java.util.List;

/**
 * Aggregate result of an apply run. {@code errors} keeps the order in which failures happened.
 */
public record SyncOutcome(int createdCount, int updatedCount, int failedCount, List<String> errors) {

    public SyncOutcome {
        errors = List.copyOf(errors);
    }

    public int processedCount() {
        return createdCount + updatedCount + failedCount;
    }
}
