package com.netcracker.core.ddisync.configuration;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
public class SyncSettings {
    public static final Duration DEFAULT_ITEM_DELAY = Duration.ofMillis(100);
    public static final int DEFAULT_WORKER_THREADS = 2;
    public static final int DEFAULT_QUEUE_DEPTH = 16;
    public static final int DEFAULT_MAX_NETWORKS_PER_REQUEST = 10_000;
    public static final double DEFAULT_MAPPING_THRESHOLD = 0.8;

    Duration itemDelay;
    int workerThreads;
    int queueDepth;
    int maxNetworksPerRequest;
    double mappingThreshold;

    @Builder
    private SyncSettings(Duration itemDelay, Integer workerThreads, Integer queueDepth, Integer maxNetworksPerRequest,
                         Double mappingThreshold) {
        this.itemDelay = (itemDelay != null ? itemDelay : DEFAULT_ITEM_DELAY);
        this.workerThreads = (workerThreads != null ? workerThreads : DEFAULT_WORKER_THREADS);
        this.queueDepth = (queueDepth != null ? queueDepth : DEFAULT_QUEUE_DEPTH);
        this.maxNetworksPerRequest = (maxNetworksPerRequest != null ? maxNetworksPerRequest : DEFAULT_MAX_NETWORKS_PER_REQUEST);
        this.mappingThreshold = (mappingThreshold != null ? mappingThreshold : DEFAULT_MAPPING_THRESHOLD);
        if (this.itemDelay.isNegative())
            throw new IllegalArgumentException("itemDelay must be non-negative");
        if (this.workerThreads <= 0 || this.queueDepth <= 0)
            throw new IllegalArgumentException("workerThreads and queueDepth must be > 0");
        if (this.maxNetworksPerRequest <= 0)
            throw new IllegalArgumentException("maxNetworksPerRequest must be > 0");
        if (!(this.mappingThreshold > 0 && this.mappingThreshold <= 1))
            throw new IllegalArgumentException("mappingThreshold must be in (0, 1]");
    }

    public static SyncSettings defaults() {
        return builder().build();
    }
}
