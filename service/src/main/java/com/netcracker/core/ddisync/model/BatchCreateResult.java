package com.netcracker.core.ddisync.model;

import java.util.List;

public record BatchCreateResult(int createdCount, int failedCount, List<String> errors) {

    public BatchCreateResult {
        errors = List.copyOf(errors);
    }

    public int total() {
        return createdCount + failedCount;
    }
}
