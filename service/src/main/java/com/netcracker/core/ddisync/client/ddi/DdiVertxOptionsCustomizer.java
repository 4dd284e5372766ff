package com.netcracker.core.ddisync.client.ddi;

import com.netcracker.core.ddisync.configuration.DdiClientSettings;
import io.quarkus.vertx.VertxOptionsCustomizer;
import io.vertx.core.VertxOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounds how long resolved DDI host addresses are cached by the managed {@link io.vertx.core.Vertx}
 * the client runs on.
 */
@ApplicationScoped
@Slf4j
public class DdiVertxOptionsCustomizer implements VertxOptionsCustomizer {
    private final DdiClientSettings settings;

    @Inject
    public DdiVertxOptionsCustomizer(DdiClientSettings settings) {
        this.settings = settings;
    }

    @Override
    public void accept(VertxOptions options) {
        int ttlSeconds = (int) settings.getDnsCacheTtl().toSeconds();
        options.getAddressResolverOptions().setCacheMaxTimeToLive(ttlSeconds);
        log.info("DNS cache TTL for the DDI client set to {}s", ttlSeconds);
    }
}
