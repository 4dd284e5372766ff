package com.netcracker.core.ddisync.service.sync;

import com.netcracker.core.ddisync.exception.JobRejectedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed number of worker threads in front of a fixed-depth queue. Work that does not fit is rejected
 * right away instead of piling up.
 */
@Slf4j
public final class BoundedWorkerPool {
    private static final String THREAD_NAME_TEMPLATE = "%s-%d";

    private final String name;
    private final ThreadPoolExecutor executor;
    private final AtomicLong threadSeq = new AtomicLong();

    public BoundedWorkerPool(String name, int threads, int queueDepth) {
        if (threads <= 0 || queueDepth <= 0)
            throw new IllegalArgumentException("threads and queueDepth must be > 0");
        this.name = name;
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueDepth),
                r -> {
                    Thread t = new Thread(r, THREAD_NAME_TEMPLATE.formatted(name, threadSeq.incrementAndGet()));
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * @return future completed when the task finishes, exceptionally if it throws
     * @throws JobRejectedException when the queue is full or the pool is shut down
     */
    public CompletableFuture<Void> submit(Runnable task) {
        try {
            CompletableFuture<Void> future = CompletableFuture.runAsync(task, executor);
            future.whenComplete((v, err) -> {
                if (err != null) {
                    log.error("Task in worker pool '{}' failed", name, err);
                }
            });
            return future;
        } catch (RejectedExecutionException e) {
            throw new JobRejectedException("Worker pool '%s' cannot accept more work (queued=%d, active=%d)"
                    .formatted(name, executor.getQueue().size(), executor.getActiveCount()), e);
        }
    }

    public int queuedTasks() {
        return executor.getQueue().size();
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stops accepting work, waits up to {@code grace} for running tasks, then interrupts them.
     */
    public void shutdown(Duration grace) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool '{}' did not stop within {}, interrupting workers", name, grace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
