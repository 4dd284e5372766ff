package com.netcracker.core.ddisync.service.sync;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local job store. Holds at most {@code maxRetained} jobs; beyond that the oldest finished
 * jobs are dropped. Active jobs are never dropped.
 */
@ApplicationScoped
@Slf4j
public class InMemorySyncJobRepository implements SyncJobRepository {
    public static final int DEFAULT_MAX_RETAINED = 1000;

    private final int maxRetained;
    private final Map<String, SyncJob> jobs = new LinkedHashMap<>();

    public InMemorySyncJobRepository() {
        this(DEFAULT_MAX_RETAINED);
    }

    public InMemorySyncJobRepository(int maxRetained) {
        if (maxRetained <= 0)
            throw new IllegalArgumentException("maxRetained must be > 0");
        this.maxRetained = maxRetained;
    }

    @Override
    public synchronized void save(SyncJob job) {
        jobs.put(job.getId(), job);
        evictFinished();
    }

    @Override
    public synchronized Optional<SyncJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Collection<SyncJob> findAll() {
        return List.copyOf(jobs.values());
    }

    private void evictFinished() {
        Iterator<SyncJob> it = jobs.values().iterator();
        List<String> evicted = new ArrayList<>();
        while (jobs.size() > maxRetained && it.hasNext()) {
            SyncJob job = it.next();
            if (job.state().isTerminal()) {
                it.remove();
                evicted.add(job.getId());
            }
        }
        if (!evicted.isEmpty()) {
            log.debug("Evicted finished jobs {}", evicted);
        }
    }
}
