package com.netcracker.core.ddisync.configuration;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Turns the raw {@link DdiSyncProperties} into the typed, validated settings used by the beans.
 */
@ApplicationScoped
@Slf4j
public class DdiSyncConfiguration {

    @Produces
    @Singleton
    public DdiClientSettings clientSettings(DdiSyncProperties properties) {
        DdiSyncProperties.Client client = properties.client();
        return DdiClientSettings.builder()
                .rateLimitPerSecond(client.rateLimitPerSecond())
                .maxConnections(client.maxConnections())
                .maxConnectionsPerHost(client.maxConnectionsPerHost())
                .dnsCacheTtl(client.dnsCacheTtl())
                .connectTimeout(client.connectTimeout())
                .requestTimeout(client.requestTimeout())
                .maxAttempts(client.maxAttempts())
                .retryDelay(client.retryDelay())
                .pageSize(client.pageSize())
                .batchSize(client.batchSize())
                .batchPause(client.batchPause())
                .build();
    }

    @Produces
    @Singleton
    public SyncSettings syncSettings(DdiSyncProperties properties) {
        DdiSyncProperties.Sync sync = properties.sync();
        return SyncSettings.builder()
                .itemDelay(sync.itemDelay())
                .workerThreads(sync.workerThreads())
                .queueDepth(sync.queueDepth())
                .maxNetworksPerRequest(sync.maxNetworksPerRequest())
                .mappingThreshold(sync.mappingThreshold())
                .build();
    }

    /**
     * Initial target from configuration; empty when no host is set.
     */
    public static Optional<DdiTargetConfig> initialTarget(DdiSyncProperties.Target target) {
        Optional<String> host = target.host().filter(h -> !h.isBlank());
        if (host.isEmpty()) {
            log.info("No DDI target host configured, target store stays unconfigured until configured at runtime");
            return Optional.empty();
        }
        return Optional.of(DdiTargetConfig.builder()
                .host(host.get())
                .username(target.username().orElse(""))
                .password(target.password().orElse(""))
                .apiRoot(target.apiRoot())
                .apiVersion(target.apiVersion())
                .trustAll(target.trustAll())
                .build());
    }
}
