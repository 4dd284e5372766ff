package com.netcracker.core.ddisync.service.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cooperative stop signal for one job: an explicit cancel flag and an optional deadline.
 */
public final class CancellationToken {
    private final Clock clock;
    private final Instant deadline;
    private volatile boolean cancelled;

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static CancellationToken create() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return withTimeout(timeout, Clock.systemUTC());
    }

    public static CancellationToken withTimeout(Duration timeout, Clock clock) {
        return new CancellationToken(clock, clock.instant().plus(timeout));
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return deadline != null && !clock.instant().isBefore(deadline);
    }

    public boolean shouldStop() {
        return cancelled || isExpired();
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Human readable stop reason, or empty while the job may continue.
     */
    public Optional<String> stopReason() {
        if (cancelled) {
            return Optional.of("Cancelled on request");
        }
        if (isExpired()) {
            return Optional.of("Deadline of " + deadline + " exceeded");
        }
        return Optional.empty();
    }
}
