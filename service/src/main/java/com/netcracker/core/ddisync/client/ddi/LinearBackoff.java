package com.netcracker.core.ddisync.client.ddi;

import java.time.Duration;
import java.util.Objects;

/**
 * {@code baseDelay * failedAttempt}: 1s, 2s, 3s...
 */
public final class LinearBackoff implements BackoffStrategy {

    @Override
    public Duration next(int failedAttempt, Duration baseDelay) {
        Objects.requireNonNull(baseDelay);
        if (failedAttempt < 1 || baseDelay.isNegative())
            throw new IllegalArgumentException("Invalid backoff input");
        return baseDelay.multipliedBy(failedAttempt);
    }
}
