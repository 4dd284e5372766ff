package com.netcracker.core.ddisync.service.sync;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySyncJobRepositoryTest {

    @Test
    void saveShouldEvictOldestFinishedJobsOnly() {
        InMemorySyncJobRepository repository = new InMemorySyncJobRepository(2);
        SyncJob active = new SyncJob("active", "view-a");
        active.start(1);
        SyncJob finished = new SyncJob("finished", "view-b");
        finished.start(1);
        finished.succeed();
        repository.save(active);
        repository.save(finished);

        repository.save(new SyncJob("new", "view-c"));

        assertThat(repository.findById("active")).isPresent();
        assertThat(repository.findById("finished")).isEmpty();
        assertThat(repository.findAll()).extracting(SyncJob::getId).containsExactly("active", "new");
    }

    @Test
    void viewLockShouldOnlyBeReleasedByHolder() {
        ViewAdmissionLock lock = new ViewAdmissionLock();

        assertThat(lock.tryAcquire("default", "job-1")).isTrue();
        assertThat(lock.tryAcquire("default", "job-2")).isFalse();
        assertThat(lock.release("default", "job-2")).isFalse();
        assertThat(lock.holder("default")).contains("job-1");
        assertThat(lock.release("default", "job-1")).isTrue();
        assertThat(lock.tryAcquire("default", "job-2")).isTrue();
    }
}
