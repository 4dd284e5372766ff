package com.netcracker.core.ddisync.client.ddi;

import com.netcracker.core.ddisync.configuration.DdiSyncConfiguration;
import com.netcracker.core.ddisync.configuration.DdiSyncProperties;
import com.netcracker.core.ddisync.configuration.DdiTargetConfig;
import com.netcracker.core.ddisync.exception.ConfigurationException;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the one client of the configured target store. Replacing the target closes the previous client.
 */
@ApplicationScoped
@Slf4j
public class DdiTargetRegistry {
    private static final Duration PROBE_GRACE = Duration.ofSeconds(5);

    private final DdiClientFactory clientFactory;
    private final Object lock = new Object();
    private DdiClient client;
    private DdiTargetConfig target;
    private boolean closed;

    @Inject
    public DdiTargetRegistry(DdiClientFactory clientFactory, DdiSyncProperties properties) {
        this(clientFactory, DdiSyncConfiguration.initialTarget(properties.target()));
    }

    DdiTargetRegistry(DdiClientFactory clientFactory, Optional<DdiTargetConfig> initialTarget) {
        this.clientFactory = clientFactory;
        initialTarget.ifPresent(config -> {
            this.client = clientFactory.create(config);
            this.target = config;
        });
    }

    public Optional<DdiClient> client() {
        synchronized (lock) {
            return Optional.ofNullable(client);
        }
    }

    public DdiClient requireClient() {
        return client().orElseThrow(() -> new ConfigurationException("DDI target store is not configured"));
    }

    public Optional<DdiTargetConfig> target() {
        synchronized (lock) {
            return Optional.ofNullable(target);
        }
    }

    /**
     * Switches to a new target after checking that it answers. The current client stays in place when the
     * probe fails.
     *
     * @throws ConfigurationException when the new target cannot be reached
     */
    public void configure(DdiTargetConfig config) {
        DdiClient candidate = clientFactory.create(config);
        if (!probe(candidate, config)) {
            candidate.close();
            throw new ConfigurationException("Failed to connect to DDI target store at " + config.baseUrl());
        }
        DdiClient previous;
        synchronized (lock) {
            if (closed) {
                candidate.close();
                throw new ConfigurationException("DDI target registry is shut down");
            }
            previous = client;
            client = candidate;
            target = config;
        }
        log.info("DDI target store configured: {}", config);
        if (previous != null) {
            previous.close();
        }
    }

    @PreDestroy
    public void close() {
        DdiClient current;
        synchronized (lock) {
            closed = true;
            current = client;
            client = null;
        }
        if (current != null) {
            current.close();
        }
    }

    private boolean probe(DdiClient candidate, DdiTargetConfig config) {
        Duration settingsTimeout = clientFactory.settings().getRequestTimeout()
                .multipliedBy(clientFactory.settings().getMaxAttempts());
        long timeoutMillis = settingsTimeout.plus(PROBE_GRACE).toMillis();
        try {
            return Boolean.TRUE.equals(candidate.testConnection().get(timeoutMillis, TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConfigurationException("Interrupted while probing " + config.baseUrl(), e);
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Connectivity probe to {} did not complete", config.baseUrl(), e);
            return false;
        }
    }
}
