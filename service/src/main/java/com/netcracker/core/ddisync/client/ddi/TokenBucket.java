package com.netcracker.core.ddisync.client.ddi;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Token bucket shared by every call of one client: capacity and refill rate are both
 * {@code permitsPerSecond}. Callers reserve a token and are told how long to wait for it,
 * so waiting callers queue up in reservation order instead of spinning.
 */
public final class TokenBucket {
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private final double capacity;
    private final double tokensPerNano;
    private final LongSupplier nanoClock;

    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(int permitsPerSecond) {
        this(permitsPerSecond, System::nanoTime);
    }

    TokenBucket(int permitsPerSecond, LongSupplier nanoClock) {
        if (permitsPerSecond <= 0)
            throw new IllegalArgumentException("permitsPerSecond must be > 0");
        this.capacity = permitsPerSecond;
        this.tokensPerNano = permitsPerSecond / NANOS_PER_SECOND;
        this.nanoClock = nanoClock;
        this.tokens = capacity;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    /**
     * Takes one token, possibly borrowing against future refills.
     *
     * @return nanoseconds the caller must wait before dispatching; 0 when a token was available
     */
    public synchronized long reserve() {
        refill();
        tokens -= 1;
        if (tokens >= 0) {
            return 0;
        }
        return (long) Math.ceil(-tokens / tokensPerNano);
    }

    /**
     * Blocking variant of {@link #reserve()} for callers running on their own thread.
     */
    public void acquire() throws InterruptedException {
        long waitNanos = reserve();
        if (waitNanos > 0) {
            TimeUnit.NANOSECONDS.sleep(waitNanos);
        }
    }

    synchronized double availableTokens() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * tokensPerNano);
            lastRefillNanos = now;
        }
    }
}
