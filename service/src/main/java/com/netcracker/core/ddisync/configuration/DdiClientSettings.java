package com.netcracker.core.ddisync.configuration;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Resource bounds and pacing of the target store client.
 */
@Value
public class DdiClientSettings {
    public static final int DEFAULT_RATE_LIMIT_PER_SECOND = 10;
    public static final int DEFAULT_MAX_CONNECTIONS = 100;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_HOST = 30;
    public static final Duration DEFAULT_DNS_CACHE_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_PAGE_SIZE = 1000;
    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_BATCH_PAUSE = Duration.ofMillis(500);

    int rateLimitPerSecond;
    int maxConnections;
    int maxConnectionsPerHost;
    Duration dnsCacheTtl;
    Duration connectTimeout;
    Duration requestTimeout;
    int maxAttempts;
    Duration retryDelay;
    int pageSize;
    int batchSize;
    Duration batchPause;

    @Builder
    private DdiClientSettings(Integer rateLimitPerSecond,
                              Integer maxConnections,
                              Integer maxConnectionsPerHost,
                              Duration dnsCacheTtl,
                              Duration connectTimeout,
                              Duration requestTimeout,
                              Integer maxAttempts,
                              Duration retryDelay,
                              Integer pageSize,
                              Integer batchSize,
                              Duration batchPause) {
        this.rateLimitPerSecond = (rateLimitPerSecond != null ? rateLimitPerSecond : DEFAULT_RATE_LIMIT_PER_SECOND);
        this.maxConnections = (maxConnections != null ? maxConnections : DEFAULT_MAX_CONNECTIONS);
        this.maxConnectionsPerHost = (maxConnectionsPerHost != null ? maxConnectionsPerHost : DEFAULT_MAX_CONNECTIONS_PER_HOST);
        this.dnsCacheTtl = (dnsCacheTtl != null ? dnsCacheTtl : DEFAULT_DNS_CACHE_TTL);
        this.connectTimeout = (connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT);
        this.requestTimeout = (requestTimeout != null ? requestTimeout : DEFAULT_REQUEST_TIMEOUT);
        this.maxAttempts = (maxAttempts != null ? maxAttempts : DEFAULT_MAX_ATTEMPTS);
        this.retryDelay = (retryDelay != null ? retryDelay : DEFAULT_RETRY_DELAY);
        this.pageSize = (pageSize != null ? pageSize : DEFAULT_PAGE_SIZE);
        this.batchSize = (batchSize != null ? batchSize : DEFAULT_BATCH_SIZE);
        this.batchPause = (batchPause != null ? batchPause : DEFAULT_BATCH_PAUSE);
        validate();
    }

    public static DdiClientSettings defaults() {
        return builder().build();
    }

    private void validate() {
        if (rateLimitPerSecond <= 0)
            throw new IllegalArgumentException("rateLimitPerSecond must be > 0");
        if (maxConnections <= 0 || maxConnectionsPerHost <= 0)
            throw new IllegalArgumentException("Connection limits must be > 0");
        if (maxConnectionsPerHost > maxConnections)
            throw new IllegalArgumentException("maxConnectionsPerHost must be <= maxConnections");
        if (dnsCacheTtl.isNegative())
            throw new IllegalArgumentException("dnsCacheTtl must be non-negative");
        if (connectTimeout.isNegative() || connectTimeout.isZero()
                || requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("Timeouts must be > 0");
        if (maxAttempts < 1)
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (retryDelay.isNegative() || batchPause.isNegative())
            throw new IllegalArgumentException("Delays must be non-negative");
        if (pageSize <= 0 || batchSize <= 0)
            throw new IllegalArgumentException("pageSize and batchSize must be > 0");
    }
}
