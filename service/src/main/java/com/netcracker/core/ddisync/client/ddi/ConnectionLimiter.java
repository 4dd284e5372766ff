package com.netcracker.core.ddisync.client.ddi;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * Caps the number of requests in flight across the client. Acquisition never blocks a thread:
 * a caller over the cap gets a future completed when a slot frees up.
 */
final class ConnectionLimiter {
    private final int maxInFlight;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int inFlight;

    ConnectionLimiter(int maxInFlight) {
        if (maxInFlight <= 0)
            throw new IllegalArgumentException("maxInFlight must be > 0");
        this.maxInFlight = maxInFlight;
    }

    CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (inFlight < maxInFlight) {
                inFlight++;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            if (next == null) {
                inFlight = Math.max(0, inFlight - 1);
            }
        }
        // the slot passes straight to the next waiter
        if (next != null) {
            next.complete(null);
        }
    }

    synchronized int inFlight() {
        return inFlight;
    }

    synchronized int waiting() {
        return waiters.size();
    }
}
