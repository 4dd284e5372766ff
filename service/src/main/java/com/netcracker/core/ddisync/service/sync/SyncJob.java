package com.netcracker.core.ddisync.service.sync;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of one apply run. Only the orchestrator running the job writes to it; readers take
 * {@link #snapshot()}s. Once terminal the job no longer changes, and {@code progress.current} never goes back.
 */
@Slf4j
public final class SyncJob {
    @Getter
    private final String id;
    @Getter
    private final String networkView;
    private final Instant submittedAt;

    private SyncJobState state = SyncJobState.PENDING;
    private SyncProgress progress = SyncProgress.initial();
    private int createdCount;
    private int updatedCount;
    private int failedCount;
    private final List<String> errors = new ArrayList<>();
    private String failureReason;
    private Instant finishedAt;

    public SyncJob(String id, String networkView) {
        this.id = Objects.requireNonNull(id, "id");
        this.networkView = Objects.requireNonNull(networkView, "networkView");
        this.submittedAt = Instant.now();
    }

    public synchronized boolean start(int total) {
        if (state != SyncJobState.PENDING) {
            return false;
        }
        state = SyncJobState.RUNNING;
        progress = new SyncProgress(0, total, "started");
        return true;
    }

    public synchronized void updateProgress(int current, String message) {
        if (state.isTerminal()) {
            return;
        }
        progress = new SyncProgress(Math.max(progress.current(), current), progress.total(), message);
    }

    public synchronized void recordCreated() {
        if (!state.isTerminal()) {
            createdCount++;
        }
    }

    public synchronized void recordUpdated() {
        if (!state.isTerminal()) {
            updatedCount++;
        }
    }

    public synchronized void recordFailure(String error) {
        if (!state.isTerminal()) {
            failedCount++;
            errors.add(error);
        }
    }

    public synchronized boolean succeed() {
        return finish(SyncJobState.SUCCEEDED, null);
    }

    public synchronized boolean fail(String reason) {
        return finish(SyncJobState.FAILED, reason);
    }

    public synchronized boolean cancel(String reason) {
        return finish(SyncJobState.CANCELLED, reason);
    }

    /**
     * Cancels the job only while it has not started yet.
     */
    public synchronized boolean cancelIfPending(String reason) {
        return state == SyncJobState.PENDING && finish(SyncJobState.CANCELLED, reason);
    }

    public synchronized SyncJobState state() {
        return state;
    }

    public synchronized SyncJobStatus snapshot() {
        return new SyncJobStatus(id, networkView, state, progress,
                new SyncOutcome(createdCount, updatedCount, failedCount, errors),
                failureReason, submittedAt, finishedAt);
    }

    private boolean finish(SyncJobState terminal, String reason) {
        if (state.isTerminal()) {
            log.debug("Job {} is already {}, ignoring transition to {}", id, state, terminal);
            return false;
        }
        state = terminal;
        failureReason = reason;
        finishedAt = Instant.now();
        return true;
    }
}
