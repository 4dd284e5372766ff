package com.netcracker.core.ddisync.service.sync;

public record SyncProgress(int current, int total, String message) {

    static SyncProgress initial() {
        return new SyncProgress(0, 0, "queued");
    }
}
