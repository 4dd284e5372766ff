package com.netcracker.core.ddisync.service.sync;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * At most one active job per network view.
 */
@ApplicationScoped
public class ViewAdmissionLock {
    private final ConcurrentMap<String, String> holders = new ConcurrentHashMap<>();

    public boolean tryAcquire(String networkView, String jobId) {
        return holders.putIfAbsent(networkView, jobId) == null;
    }

    /**
     * Releases the view only if {@code jobId} still holds it.
     */
    public boolean release(String networkView, String jobId) {
        return holders.remove(networkView, jobId);
    }

    public Optional<String> holder(String networkView) {
        return Optional.ofNullable(holders.get(networkView));
    }
}
