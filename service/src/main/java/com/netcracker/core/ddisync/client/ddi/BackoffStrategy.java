package com.netcracker.core.ddisync.client.ddi;

import java.time.Duration;

public interface BackoffStrategy {
    /**
     * Delay to wait after the given failed attempt (1-based) before the next one.
     */
    Duration next(int failedAttempt, Duration baseDelay);
}
