package com.netcracker.core.ddisync.client.ddi;

import com.netcracker.core.ddisync.configuration.DdiClientSettings;
import com.netcracker.core.ddisync.configuration.DdiTargetConfig;
import io.vertx.core.Vertx;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates {@link DdiClient} instances bound to the shared {@link Vertx}.
 */
@ApplicationScoped
@Slf4j
public class DdiClientFactory {
    private final Vertx vertx;
    private final DdiClientSettings settings;

    @Inject
    public DdiClientFactory(Vertx vertx, DdiClientSettings settings) {
        this.vertx = vertx;
        this.settings = settings;
    }

    public DdiClient create(DdiTargetConfig target) {
        log.info("Creating DDI client for {}", target);
        return new VertxDdiClient(vertx, target, settings);
    }

    public DdiClientSettings settings() {
        return settings;
    }
}
