package com.netcracker.core.ddisync.configuration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Optional;

@ConfigMapping(prefix = "ddi")
public interface DdiSyncProperties {

    Target target();

    Client client();

    Sync sync();

    interface Target {
        /**
         * Base address of the DDI appliance, e.g. {@code https://ddi.example.com}. Unset means unconfigured.
         */
        Optional<String> host();

        Optional<String> username();

        Optional<String> password();

        @WithDefault("wapi")
        String apiRoot();

        @WithDefault("2.13.1")
        String apiVersion();

        /**
         * Skip TLS certificate and host name verification.
         */
        @WithDefault("false")
        boolean trustAll();
    }

    interface Client {
        @WithDefault("10")
        int rateLimitPerSecond();

        @WithDefault("100")
        int maxConnections();

        @WithDefault("30")
        int maxConnectionsPerHost();

        @WithDefault("300s")
        Duration dnsCacheTtl();

        @WithDefault("10s")
        Duration connectTimeout();

        @WithDefault("30s")
        Duration requestTimeout();

        @WithDefault("3")
        int maxAttempts();

        /**
         * Base delay between attempts; attempt N waits {@code retryDelay * N}.
         */
        @WithDefault("1s")
        Duration retryDelay();

        @WithDefault("1000")
        int pageSize();

        @WithDefault("10")
        int batchSize();

        @WithDefault("500ms")
        Duration batchPause();
    }

    interface Sync {
        /**
         * Pause after each applied network, on top of the client throttle.
         */
        @WithDefault("100ms")
        Duration itemDelay();

        @WithDefault("2")
        int workerThreads();

        @WithDefault("16")
        int queueDepth();

        @WithDefault("10000")
        int maxNetworksPerRequest();

        /**
         * Minimum similarity score for a target attribute to be suggested for a source tag key.
         */
        @WithDefault("0.8")
        double mappingThreshold();
    }
}
