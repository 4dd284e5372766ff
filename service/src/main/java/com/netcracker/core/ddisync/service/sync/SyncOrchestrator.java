package com.netcracker.core.ddisync.service.sync;

import com.netcracker.core.ddisync.client.ddi.DdiClient;
import com.netcracker.core.ddisync.client.ddi.DdiTargetRegistry;
import com.netcracker.core.ddisync.configuration.SyncSettings;
import com.netcracker.core.ddisync.exception.AuthenticationException;
import com.netcracker.core.ddisync.model.NetworkCreateRequest;
import com.netcracker.core.ddisync.model.NetworkRecord;
import com.netcracker.core.ddisync.model.TargetNetwork;
import com.netcracker.core.ddisync.service.mapping.AttributeMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies records to the store one at a time, in input order, so that progress stays ordered.
 * <p>
 * Each record is looked up by subnet in the view, then updated with its mapped attributes when it exists or
 * created with a generated comment when it does not. Item failures are recorded and the run goes on.
 * The job fails as a whole only when no store is configured or the store rejects the credentials.
 */
@ApplicationScoped
@Slf4j
public class SyncOrchestrator {
    static final long WAIT_SLICE_MILLIS = 50;

    private final DdiTargetRegistry targetRegistry;
    private final AttributeMapper attributeMapper;
    private final SyncSettings settings;

    @Inject
    public SyncOrchestrator(DdiTargetRegistry targetRegistry, AttributeMapper attributeMapper, SyncSettings settings) {
        this.targetRegistry = targetRegistry;
        this.attributeMapper = attributeMapper;
        this.settings = settings;
    }

    public void run(SyncJob job, SyncRequest request, CancellationToken token) {
        List<NetworkRecord> networks = request.mappingRules().isEmpty()
                ? request.networks()
                : attributeMapper.applyMappingRules(request.networks(), request.mappingRules());
        int total = networks.size();
        if (!job.start(total)) {
            log.info("Job {} is already {}, not starting", job.getId(), job.state());
            return;
        }
        Optional<DdiClient> maybeClient = targetRegistry.client();
        if (maybeClient.isEmpty()) {
            log.error("Job {} failed: DDI target store is not configured", job.getId());
            job.fail("DDI target store is not configured");
            return;
        }
        DdiClient client = maybeClient.get();
        String view = request.networkView();
        log.info("Job {} started: {} networks into view '{}'", job.getId(), total, view);

        try {
            for (int i = 0; i < total; i++) {
                stopIfRequested(token);
                NetworkRecord network = networks.get(i);
                job.updateProgress(i + 1, "processing " + network.subnet());
                applyOne(job, client, network, view, token);
                if (i + 1 < total) {
                    pause(settings.getItemDelay(), token);
                }
            }
        } catch (CancellationException e) {
            String reason = token.stopReason().orElse(e.getMessage());
            log.info("Job {} stopped: {}", job.getId(), reason);
            job.cancel(reason);
            return;
        } catch (AuthenticationException e) {
            log.error("Job {} failed: {}", job.getId(), e.getMessage());
            job.fail(e.getMessage());
            return;
        }
        job.succeed();
        SyncJobStatus status = job.snapshot();
        log.info("Job {} finished: created={}, updated={}, failed={}", job.getId(),
                status.outcome().createdCount(), status.outcome().updatedCount(), status.outcome().failedCount());
    }

    private void applyOne(SyncJob job, DdiClient client, NetworkRecord network, String view, CancellationToken token) {
        String subnet = network.subnet();
        Optional<TargetNetwork> existing;
        try {
            existing = await(client.getNetworkBySubnet(subnet, view), token);
        } catch (AuthenticationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Lookup of {} in view '{}' failed", subnet, view, e);
            job.recordFailure("Error processing %s: %s".formatted(subnet, e.getMessage()));
            return;
        }

        if (existing.isPresent()) {
            try {
                await(client.updateNetwork(existing.get().ref(), null,
                        network.isMapped() ? network.mappedAttributes() : null), token);
                job.recordUpdated();
                log.debug("Updated {} ({})", subnet, existing.get().ref());
            } catch (AuthenticationException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Update of {} failed", subnet, e);
                job.recordFailure("Failed to update %s: %s".formatted(subnet, e.getMessage()));
            }
        } else {
            try {
                String ref = await(client.createNetwork(view, NetworkCreateRequest.from(network)), token);
                job.recordCreated();
                log.debug("Created {} ({})", subnet, ref);
            } catch (AuthenticationException | CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Creation of {} failed", subnet, e);
                job.recordFailure("Failed to create %s: %s".formatted(subnet, e.getMessage()));
            }
        }
    }

    /**
     * Waits for a remote call in short slices so a cancel or deadline is noticed while the call is pending.
     * Failures are rethrown unwrapped.
     */
    static <T> T await(CompletableFuture<T> future, CancellationToken token) {
        while (true) {
            stopIfRequested(token, future);
            try {
                return future.get(WAIT_SLICE_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.trace("Still waiting for the target store");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(false);
                throw new CancellationException("Interrupted while waiting for the target store");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException(cause);
            }
        }
    }

    private static void pause(Duration delay, CancellationToken token) {
        long remaining = delay.toMillis();
        while (remaining > 0) {
            stopIfRequested(token);
            long slice = Math.min(remaining, WAIT_SLICE_MILLIS);
            try {
                Thread.sleep(slice);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted between items");
            }
            remaining -= slice;
        }
    }

    private static void stopIfRequested(CancellationToken token) {
        stopIfRequested(token, null);
    }

    private static void stopIfRequested(CancellationToken token, CompletableFuture<?> pending) {
        if (token.shouldStop()) {
            if (pending != null) {
                pending.cancel(false);
            }
            throw new CancellationException(token.stopReason().orElse("Stopped"));
        }
    }
}
