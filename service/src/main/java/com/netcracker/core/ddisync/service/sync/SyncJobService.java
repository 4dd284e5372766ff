package com.netcracker.core.ddisync.service.sync;

import com.netcracker.core.ddisync.configuration.SyncSettings;
import com.netcracker.core.ddisync.exception.JobRejectedException;
import com.netcracker.core.ddisync.exception.ValidationException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs apply jobs in the background: {@link #submit(SyncRequest)}, {@link #getStatus(String)},
 * {@link #cancel(String)}.
 * <p>
 * A view accepts one active job at a time. Jobs wait in a bounded queue; a submit that does not fit is rejected.
 */
@ApplicationScoped
@Slf4j
public class SyncJobService {
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);
    private static final String WORKER_POOL_NAME = "ddi-sync-worker";

    private final SyncOrchestrator orchestrator;
    private final SyncJobRepository repository;
    private final ViewAdmissionLock admissionLock;
    private final SyncSettings settings;
    private final BoundedWorkerPool workerPool;
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();

    @Inject
    public SyncJobService(SyncOrchestrator orchestrator,
                          SyncJobRepository repository,
                          ViewAdmissionLock admissionLock,
                          SyncSettings settings) {
        this(orchestrator, repository, admissionLock, settings,
                new BoundedWorkerPool(WORKER_POOL_NAME, settings.getWorkerThreads(), settings.getQueueDepth()));
    }

    SyncJobService(SyncOrchestrator orchestrator,
                   SyncJobRepository repository,
                   ViewAdmissionLock admissionLock,
                   SyncSettings settings,
                   BoundedWorkerPool workerPool) {
        this.orchestrator = orchestrator;
        this.repository = repository;
        this.admissionLock = admissionLock;
        this.settings = settings;
        this.workerPool = workerPool;
    }

    /**
     * @return id of the accepted job
     * @throws ValidationException  when the request carries more networks than allowed
     * @throws JobRejectedException when the view already has an active job or the queue is full
     */
    public String submit(SyncRequest request) {
        int size = request.networks().size();
        if (size > settings.getMaxNetworksPerRequest()) {
            throw new ValidationException("Too many networks in one request: %d, maximum is %d"
                    .formatted(size, settings.getMaxNetworksPerRequest()));
        }
        String view = request.networkView();
        String jobId = UUID.randomUUID().toString();
        if (!admissionLock.tryAcquire(view, jobId)) {
            String holder = admissionLock.holder(view).orElse("unknown");
            throw new JobRejectedException("Network view '%s' already has an active sync job %s".formatted(view, holder));
        }

        SyncJob job = new SyncJob(jobId, view);
        CancellationToken token = request.maybeTimeout()
                .map(CancellationToken::withTimeout)
                .orElseGet(CancellationToken::create);
        repository.save(job);
        tokens.put(jobId, token);
        try {
            workerPool.submit(() -> execute(job, request, token));
        } catch (JobRejectedException e) {
            tokens.remove(jobId);
            admissionLock.release(view, jobId);
            job.fail(e.getMessage());
            log.warn("Job {} for view '{}' rejected: {}", jobId, view, e.getMessage());
            throw e;
        }
        log.info("Job {} accepted: {} networks into view '{}'", jobId, size, view);
        return jobId;
    }

    public Optional<SyncJobStatus> getStatus(String jobId) {
        return repository.findById(jobId).map(SyncJob::snapshot);
    }

    /**
     * Requests cancellation. A queued job is cancelled at once, a running one stops before its next item.
     *
     * @return {@code false} when the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        Optional<SyncJob> maybeJob = repository.findById(jobId);
        if (maybeJob.isEmpty() || maybeJob.get().state().isTerminal()) {
            return false;
        }
        SyncJob job = maybeJob.get();
        CancellationToken token = tokens.get(jobId);
        if (token != null) {
            token.cancel();
        }
        if (job.cancelIfPending("Cancelled before start")) {
            admissionLock.release(job.getNetworkView(), jobId);
        }
        log.info("Cancellation requested for job {}", jobId);
        return true;
    }

    @PreDestroy
    void shutdown() {
        tokens.values().forEach(CancellationToken::cancel);
        workerPool.shutdown(SHUTDOWN_GRACE);
    }

    private void execute(SyncJob job, SyncRequest request, CancellationToken token) {
        try {
            orchestrator.run(job, request, token);
        } catch (RuntimeException e) {
            log.error("Job {} failed unexpectedly", job.getId(), e);
            job.fail("Unexpected error: " + e.getMessage());
        } catch (Error e) {
            log.error("Job {} aborted by {}", job.getId(), e.toString());
            job.fail("Unexpected error: " + e);
            throw e;
        } finally {
            tokens.remove(job.getId());
            admissionLock.release(job.getNetworkView(), job.getId());
        }
    }
}
