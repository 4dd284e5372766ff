package com.netcracker.core.ddisync.service.sync;

import java.util.Collection;
import java.util.Optional;

/**
 * Keeps jobs for later status lookups by id.
 */
public interface SyncJobRepository {

    void save(SyncJob job);

    Optional<SyncJob> findById(String jobId);

    Collection<SyncJob> findAll();
}
